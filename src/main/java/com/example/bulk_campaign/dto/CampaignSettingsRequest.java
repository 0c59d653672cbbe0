package com.example.bulk_campaign.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.example.bulk_campaign.generator.CampaignSettings;
import com.example.bulk_campaign.generator.MatchType;

import lombok.Data;

/**
 * 画面から受け取るキャンペーン設定（未検証）。
 */
@Data
public class CampaignSettingsRequest {

    private BigDecimal dailyBudget;
    private LocalDate startDate;
    private List<String> matchTypes;
    private Map<String, BigDecimal> bids; // key: exact / phrase / broad

    private Map<String, BigDecimal> keywordBids; // null可
    private String bidAdjustment; // 例: "50%"（null可）
    private String placement; // "top-of-search"（null可）

    private String campaignNameTemplate;
    private String adGroupNameTemplate;

    private Integer keywordGroupSize; // null可
    private Integer skuGroupSize; // null可

    /**
     * マッチタイプ名を enum に変換した設定を作る。不正なマッチタイプは
     * {@link com.example.bulk_campaign.validation.CampaignValidator#validateMatchTypes} で先に弾くこと。
     */
    public CampaignSettings toSettings() {
        List<MatchType> types = new ArrayList<>();
        if (matchTypes != null) {
            for (String mt : matchTypes) {
                MatchType.fromValue(mt).ifPresent(types::add);
            }
        }

        Map<MatchType, BigDecimal> bidMap = new EnumMap<>(MatchType.class);
        if (bids != null) {
            bids.forEach((k, v) -> MatchType.fromValue(k).ifPresent(t -> bidMap.put(t, v)));
        }

        return CampaignSettings.builder()
                .dailyBudget(dailyBudget)
                .startDate(startDate)
                .matchTypes(types)
                .bids(bidMap)
                .keywordBids(keywordBids)
                .bidAdjustment(bidAdjustment)
                .placement(placement)
                .campaignNameTemplate(campaignNameTemplate)
                .adGroupNameTemplate(adGroupNameTemplate)
                .keywordGroupSize(keywordGroupSize)
                .skuGroupSize(skuGroupSize)
                .build();
    }
}
