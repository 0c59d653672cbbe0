package com.example.bulk_campaign.generator;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 1回の生成呼び出しで使うキャンペーン設定。生成後は変更しない。
 */
@ToString
@EqualsAndHashCode
public final class CampaignSettings {

    public static final String DEFAULT_CAMPAIGN_TEMPLATE = "SP_[SKU]_match_type";
    public static final String DEFAULT_AD_GROUP_TEMPLATE = "AG_[SKU]_match_type";

    private final BigDecimal dailyBudget;
    private final LocalDate startDate;
    private final List<MatchType> matchTypes;
    private final Map<MatchType, BigDecimal> bids;
    private final Map<String, BigDecimal> keywordBids;
    private final String bidAdjustment;
    private final String placement;
    private final String campaignNameTemplate;
    private final String adGroupNameTemplate;
    private final Integer keywordGroupSize;
    private final Integer skuGroupSize;

    @Builder
    private CampaignSettings(
            BigDecimal dailyBudget,
            LocalDate startDate,
            List<MatchType> matchTypes,
            Map<MatchType, BigDecimal> bids,
            Map<String, BigDecimal> keywordBids,
            String bidAdjustment,
            String placement,
            String campaignNameTemplate,
            String adGroupNameTemplate,
            Integer keywordGroupSize,
            Integer skuGroupSize) {
        this.dailyBudget = dailyBudget;
        this.startDate = startDate;
        // 重複は最初の出現位置を残す
        this.matchTypes = matchTypes == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(matchTypes)));
        this.bids = bids == null || bids.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(MatchType.class))
                : Collections.unmodifiableMap(new EnumMap<>(bids));
        this.keywordBids = keywordBids == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(keywordBids));
        this.bidAdjustment = blankToNull(bidAdjustment);
        this.placement = blankToNull(placement);
        this.campaignNameTemplate = campaignNameTemplate == null ? DEFAULT_CAMPAIGN_TEMPLATE : campaignNameTemplate;
        this.adGroupNameTemplate = adGroupNameTemplate == null ? DEFAULT_AD_GROUP_TEMPLATE : adGroupNameTemplate;
        this.keywordGroupSize = keywordGroupSize;
        this.skuGroupSize = skuGroupSize;
    }

    public BigDecimal getDailyBudget() {
        return dailyBudget;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public List<MatchType> getMatchTypes() {
        return matchTypes;
    }

    public Map<MatchType, BigDecimal> getBids() {
        return bids;
    }

    public Optional<Map<String, BigDecimal>> getKeywordBids() {
        return Optional.ofNullable(keywordBids);
    }

    public Optional<String> getBidAdjustment() {
        return Optional.ofNullable(bidAdjustment);
    }

    public Optional<String> getPlacement() {
        return Optional.ofNullable(placement);
    }

    public String getCampaignNameTemplate() {
        return campaignNameTemplate;
    }

    public String getAdGroupNameTemplate() {
        return adGroupNameTemplate;
    }

    public Optional<Integer> getKeywordGroupSize() {
        return Optional.ofNullable(keywordGroupSize);
    }

    public Optional<Integer> getSkuGroupSize() {
        return Optional.ofNullable(skuGroupSize);
    }

    public BigDecimal bidFor(MatchType matchType) {
        BigDecimal bid = bids.get(matchType);
        if (bid == null) {
            throw new IllegalStateException("No bid configured for match type " + matchType.value());
        }
        return bid;
    }

    /**
     * キーワード個別入札があればそれを、無ければマッチタイプのデフォルト入札を返す。
     */
    public BigDecimal keywordBidFor(String keyword, MatchType matchType) {
        if (keywordBids != null) {
            BigDecimal override = keywordBids.get(keyword);
            if (override != null) {
                return override;
            }
        }
        return bidFor(matchType);
    }

    /** placement と bid adjustment が両方指定されている場合のみ true */
    public boolean hasBiddingAdjustment() {
        return placement != null && bidAdjustment != null;
    }

    private static String blankToNull(String v) {
        return (v == null || v.isBlank()) ? null : v;
    }
}
