package com.example.bulk_campaign.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * SKUグループ × キーワードグループ × マッチタイプ ごとに1キャンペーンユニットの行を生成する。
 *
 * <p>
 * 出力順は SKUグループ → キーワードグループ → マッチタイプ の入れ子順で固定。
 * ユニット内は Campaign, Ad Group, Bidding Adjustment(任意), Product Ad×N, Keyword×M。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class BulkSheetGenerator {

    private static final Logger log = LoggerFactory.getLogger(BulkSheetGenerator.class);

    private final Grouper grouper;
    private final NameTemplateEngine nameTemplateEngine;

    /**
     * 入力は検証済みであること（{@link com.example.bulk_campaign.validation.CampaignValidator}）。
     */
    public List<BulkRow> generate(List<String> keywords, List<String> skus, CampaignSettings settings) {
        String startDate = NameTemplateEngine.BULK_DATE.format(settings.getStartDate());

        List<List<String>> keywordGroups = grouper.group(keywords, settings.getKeywordGroupSize().orElse(null));
        List<List<String>> skuGroups = grouper.group(skus, settings.getSkuGroupSize().orElse(null));

        List<BulkRow> rows = new ArrayList<>();
        int units = 0;
        for (List<String> skuGroup : skuGroups) {
            for (List<String> keywordGroup : keywordGroups) {
                for (MatchType matchType : settings.getMatchTypes()) {
                    rows.addAll(generateUnit(skuGroup, keywordGroup, matchType, startDate, settings));
                    units++;
                }
            }
        }

        log.debug("Generated {} campaign units ({} rows): skuGroups={}, keywordGroups={}, matchTypes={}",
                units, rows.size(), skuGroups.size(), keywordGroups.size(), settings.getMatchTypes().size());
        return rows;
    }

    /**
     * 1キャンペーンユニット分の行。
     */
    public List<BulkRow> generateUnit(
            List<String> skuGroup,
            List<String> keywordGroup,
            MatchType matchType,
            String startDate,
            CampaignSettings settings) {
        List<BulkRow> rows = new ArrayList<>();

        String groupKeyword = cleanKeyword(keywordGroup.get(0));
        String combinedSku = String.join("_", skuGroup);
        String unitId = unitId(combinedSku, matchType, groupKeyword);

        String campaignName = nameTemplateEngine.render(
                settings.getCampaignNameTemplate(), combinedSku, matchType, startDate);
        String adGroupName = nameTemplateEngine.render(
                settings.getAdGroupNameTemplate(), combinedSku, matchType, startDate);

        rows.add(new CampaignRow(
                unitId,
                campaignName + "_" + groupKeyword,
                startDate,
                settings.getDailyBudget()));

        rows.add(new AdGroupRow(
                unitId,
                adGroupName + "_" + groupKeyword,
                settings.bidFor(matchType)));

        if (settings.hasBiddingAdjustment()) {
            rows.add(new BiddingAdjustmentRow(
                    unitId,
                    settings.getPlacement().orElseThrow(),
                    settings.getBidAdjustment().orElseThrow()));
        }

        for (String sku : skuGroup) {
            rows.add(new ProductAdRow(unitId, sku));
        }

        for (String keyword : keywordGroup) {
            rows.add(new KeywordRow(
                    unitId,
                    keyword,
                    settings.keywordBidFor(keyword, matchType),
                    matchType));
        }
        return rows;
    }

    /**
     * ユニットIDは SKU + マッチタイプ + 先頭キーワードのみで決まる。
     * 先頭キーワードが同じ別キーワードグループは同じIDになる。
     */
    public String unitId(String combinedSku, MatchType matchType, String cleanedFirstKeyword) {
        return combinedSku + "_" + matchType.value() + "_" + cleanedFirstKeyword;
    }

    /** 英数字以外を "_" にして小文字化 */
    public String cleanKeyword(String keyword) {
        return keyword.replaceAll("[^a-zA-Z0-9]", "_").toLowerCase(Locale.ROOT);
    }
}
