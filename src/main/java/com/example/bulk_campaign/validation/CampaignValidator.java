package com.example.bulk_campaign.validation;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.example.bulk_campaign.generator.CampaignSettings;
import com.example.bulk_campaign.generator.DateExample;
import com.example.bulk_campaign.generator.MatchType;
import com.example.bulk_campaign.generator.TemplateToken;

/**
 * Amazon bulk sheet のフォーマット制約に合わせた入力チェック。
 *
 * <ul>
 * <li>副作用なし。失敗は {@link ValidationResult} で返し、例外は投げない</li>
 * <li>最初に失敗したルールで打ち切る（リスト系は最初の不正アイテムで打ち切り）</li>
 * </ul>
 */
@Component
public class CampaignValidator {

    // Amazon側の上限
    public static final int MAX_KEYWORD_LENGTH = 80;
    public static final int MAX_SKU_LENGTH = 40;
    public static final int MAX_TEMPLATE_LENGTH = 128;
    public static final BigDecimal MIN_DAILY_BUDGET = new BigDecimal("1.0");
    public static final BigDecimal MIN_BID_AMOUNT = new BigDecimal("0.02");
    public static final BigDecimal DEFAULT_MIN_VALUE = new BigDecimal("0.01");
    public static final int MIN_BID_ADJUSTMENT = 0;
    public static final int MAX_BID_ADJUSTMENT = 900;

    public static final String VALID_PLACEMENT = "top-of-search";
    public static final String DAILY_BUDGET_FIELD = "Daily budget";

    private static final Pattern KEYWORD_PATTERN = Pattern.compile("^[\\w\\s\\-']+$",
            Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SKU_PATTERN = Pattern.compile("^[a-zA-Z0-9_\\-.,></\":;+=]+$");
    private static final Pattern CUSTOM_TEXT_PATTERN = Pattern.compile("^[A-Za-z0-9\\-_]+$");
    private static final Pattern INTEGER_PATTERN = Pattern.compile("^[+-]?\\d+$");
    // NBSP などの Unicode 空白だけの値も空扱い
    private static final Pattern BLANK_PATTERN = Pattern.compile("\\s*", Pattern.UNICODE_CHARACTER_CLASS);

    // テンプレートで許可する言い換え（大文字小文字無視）
    private static final Set<String> TEMPLATE_SYNONYMS = Set.of(
            "type", "kw", "match", "keyword",
            "sp", "sponsored", "products",
            "root", "group", "category",
            "ag");

    private final Clock clock;

    public CampaignValidator(Clock clock) {
        this.clock = clock;
    }

    // --- 数値 / 日付 ---

    public ValidationResult validateNumericInput(String value, String fieldName, BigDecimal minValue) {
        BigDecimal parsed = parseDecimal(value);
        if (parsed == null) {
            return ValidationResult.failure(ErrorCode.INVALID_NUMBER,
                    "Invalid numeric value for " + fieldName);
        }
        return checkMinimum(parsed, fieldName, minValue);
    }

    public ValidationResult validateNumericInput(BigDecimal value, String fieldName, BigDecimal minValue) {
        if (value == null) {
            return ValidationResult.failure(ErrorCode.INVALID_NUMBER,
                    "Invalid numeric value for " + fieldName);
        }
        return checkMinimum(value, fieldName, minValue);
    }

    public ValidationResult validateNumericInput(String value, String fieldName) {
        return validateNumericInput(value, fieldName, DEFAULT_MIN_VALUE);
    }

    public ValidationResult validateDate(LocalDate date) {
        if (date == null) {
            return ValidationResult.failure(ErrorCode.PAST_DATE, "Start date is required");
        }
        if (date.isBefore(LocalDate.now(clock))) {
            return ValidationResult.failure(ErrorCode.PAST_DATE, "Start date cannot be in the past");
        }
        return ValidationResult.success();
    }

    // --- リスト ---

    public ValidationResult validateKeywords(List<String> keywords) {
        return validateItems(keywords, "keyword", "keywords", "Keyword", MAX_KEYWORD_LENGTH, KEYWORD_PATTERN);
    }

    public ValidationResult validateSkus(List<String> skus) {
        return validateItems(skus, "SKU", "SKUs", "SKU", MAX_SKU_LENGTH, SKU_PATTERN);
    }

    public ValidationResult validateMatchTypes(List<String> matchTypes) {
        if (matchTypes == null || matchTypes.isEmpty()) {
            return ValidationResult.failure(ErrorCode.EMPTY_INPUT, "No Match type provided");
        }
        Set<String> invalid = new LinkedHashSet<>();
        for (String mt : matchTypes) {
            if (MatchType.fromValue(mt).isEmpty()) {
                invalid.add(mt == null ? "null" : mt.toLowerCase(Locale.ROOT));
            }
        }
        if (!invalid.isEmpty()) {
            return ValidationResult.failure(ErrorCode.INVALID_CHARACTERS,
                    "Invalid characters in Match type: " + String.join(", ", invalid));
        }
        return ValidationResult.success();
    }

    // --- 入札調整 ---

    public ValidationResult validateBidAdjustment(String value, String placement) {
        if (!VALID_PLACEMENT.equals(placement)) {
            return ValidationResult.failure(ErrorCode.INVALID_PLACEMENT,
                    "Invalid value: \"" + placement + "\" for column: \"Placement\"");
        }
        if (value == null || !value.endsWith("%")) {
            return ValidationResult.failure(ErrorCode.INVALID_PERCENTAGE_FORMAT,
                    "Invalid value: \"" + value + "\" for column: \"Percentage\"");
        }

        String digits = stripTrailingPercent(value).trim();
        if (!INTEGER_PATTERN.matcher(digits).matches()) {
            return ValidationResult.failure(ErrorCode.INVALID_NUMBER,
                    "Invalid value: \"" + value + "\" for column: \"Percentage\"");
        }
        long percentage;
        try {
            percentage = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            // 桁あふれ
            percentage = Long.MAX_VALUE;
        }
        if (percentage < MIN_BID_ADJUSTMENT || percentage > MAX_BID_ADJUSTMENT) {
            return ValidationResult.failure(ErrorCode.PERCENTAGE_OUT_OF_RANGE,
                    "Bid adjustment must be between " + MIN_BID_ADJUSTMENT + "% and " + MAX_BID_ADJUSTMENT + "%");
        }
        return ValidationResult.success();
    }

    // --- 名前テンプレート ---

    public ValidationResult validateNameTemplate(String template, TemplateKind kind) {
        String templateName = kind.label() + " name template";
        if (template == null || template.isBlank()) {
            return ValidationResult.failure(ErrorCode.EMPTY_ITEM, "Empty value found in " + templateName);
        }
        if (template.codePointCount(0, template.length()) > MAX_TEMPLATE_LENGTH) {
            return ValidationResult.failure(ErrorCode.TEMPLATE_LENGTH_EXCEEDED,
                    templateName + " exceeds maximum length");
        }

        boolean hasSku = false;
        boolean hasMatchType = false;

        for (String part : template.split("_", -1)) {
            if (part.isEmpty()) {
                continue;
            }
            String lower = part.toLowerCase(Locale.ROOT);
            if (lower.contains("[sku]")) {
                hasSku = true;
            }
            if (lower.contains("match")) {
                hasMatchType = true;
            }

            if (isKnownToken(part, kind)
                    || DateExample.fromExample(part).isPresent()
                    || TEMPLATE_SYNONYMS.contains(lower)) {
                continue;
            }
            if (!CUSTOM_TEXT_PATTERN.matcher(part).matches()) {
                return ValidationResult.failure(ErrorCode.INVALID_TEMPLATE_CHARACTERS,
                        "Invalid characters in custom text: " + part
                                + ". Only letters, numbers, hyphens, and underscores are allowed.");
            }
        }

        List<String> missing = new ArrayList<>();
        if (!hasSku) {
            missing.add(TemplateToken.SKU.token());
        }
        if (!hasMatchType) {
            missing.add(TemplateToken.MATCH_TYPE.token());
        }
        if (!missing.isEmpty()) {
            return ValidationResult.failure(ErrorCode.MISSING_TEMPLATE_PLACEHOLDER,
                    "Missing required parts in " + kind.label() + " template: " + String.join(", ", missing));
        }
        return ValidationResult.success();
    }

    // --- 設定全体 ---

    /**
     * マッチタイプ → 日予算 → 入札 → 入札調整(placementと両方ある時のみ) → 開始日
     * → キャンペーン名テンプレート → 広告グループ名テンプレート の順に検証し、最初の失敗を返す。
     */
    public ValidationResult validateCampaignSettings(CampaignSettings settings) {
        ValidationResult result = validateMatchTypes(settings.getMatchTypes().stream()
                .map(MatchType::value)
                .toList());
        if (result.failed()) {
            return result;
        }

        result = validateNumericInput(settings.getDailyBudget(), DAILY_BUDGET_FIELD, MIN_DAILY_BUDGET);
        if (result.failed()) {
            return result;
        }

        for (MatchType mt : settings.getMatchTypes()) {
            if (!settings.getBids().containsKey(mt)) {
                return ValidationResult.failure(ErrorCode.INVALID_NUMBER,
                        "Invalid numeric value for " + bidField(mt));
            }
        }
        for (Map.Entry<MatchType, BigDecimal> bid : settings.getBids().entrySet()) {
            result = validateNumericInput(bid.getValue(), bidField(bid.getKey()), MIN_BID_AMOUNT);
            if (result.failed()) {
                return result;
            }
        }

        if (settings.hasBiddingAdjustment()) {
            result = validateBidAdjustment(
                    settings.getBidAdjustment().orElseThrow(),
                    settings.getPlacement().orElseThrow());
            if (result.failed()) {
                return result;
            }
        }

        result = validateDate(settings.getStartDate());
        if (result.failed()) {
            return result;
        }

        result = validateNameTemplate(settings.getCampaignNameTemplate(), TemplateKind.CAMPAIGN);
        if (result.failed()) {
            return result;
        }

        return validateNameTemplate(settings.getAdGroupNameTemplate(), TemplateKind.AD_GROUP);
    }

    // --- helpers ---

    private ValidationResult validateItems(
            List<String> items,
            String singular,
            String plural,
            String field,
            int maxLength,
            Pattern allowed) {
        if (items == null || items.isEmpty()) {
            return ValidationResult.failure(ErrorCode.EMPTY_INPUT, "No " + singular + " provided");
        }
        for (String item : items) {
            if (item == null || BLANK_PATTERN.matcher(item).matches()) {
                return ValidationResult.failure(ErrorCode.EMPTY_ITEM, "Empty value found in " + plural);
            }
            if (item.codePointCount(0, item.length()) > maxLength) {
                return ValidationResult.failure(ErrorCode.LENGTH_EXCEEDED,
                        "Invalid length for " + field + ": '" + item + "' exceeds maximum length of " + maxLength);
            }
            if (!allowed.matcher(item).matches()) {
                return ValidationResult.failure(ErrorCode.INVALID_CHARACTERS,
                        "Invalid characters in " + field + ": " + item);
            }
        }
        return ValidationResult.success();
    }

    private ValidationResult checkMinimum(BigDecimal value, String fieldName, BigDecimal minValue) {
        // 下限ちょうども不可
        if (value.compareTo(minValue) <= 0) {
            return ValidationResult.failure(ErrorCode.BELOW_MINIMUM,
                    "Invalid value for " + fieldName + ": must be greater than " + minValue.toPlainString());
        }
        return ValidationResult.success();
    }

    private boolean isKnownToken(String part, TemplateKind kind) {
        for (TemplateToken token : TemplateToken.values()) {
            boolean allowed = kind == TemplateKind.CAMPAIGN ? token.allowedInCampaign() : token.allowedInAdGroup();
            if (allowed && token.matchesIgnoreCase(part)) {
                return true;
            }
        }
        return false;
    }

    private static String bidField(MatchType matchType) {
        return "Bid for " + matchType.value();
    }

    private static String stripTrailingPercent(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '%') {
            end--;
        }
        return value.substring(0, end);
    }

    /**
     * 厳密なBigDecimalパース。失敗時はnullを返す。
     */
    private static BigDecimal parseDecimal(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
