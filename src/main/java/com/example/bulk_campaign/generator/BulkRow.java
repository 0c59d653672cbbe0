package com.example.bulk_campaign.generator;

import java.util.EnumMap;
import java.util.Map;

import com.example.bulk_campaign.sheet.BulkColumn;

/**
 * bulk sheet の1行。Entity ごとに必要な項目だけを持つ。
 * {@link #cells()} で27列スキーマへ写像し、使わない列は含めない（= 空欄）。
 */
public sealed interface BulkRow
        permits CampaignRow, AdGroupRow, BiddingAdjustmentRow, ProductAdRow, KeywordRow {

    String PRODUCT = "Sponsored Products";
    String OPERATION = "Create";
    String TARGETING_TYPE = "MANUAL";
    String BIDDING_STRATEGY = "Dynamic bids - down only";
    String STATE = "enabled";

    Entity entity();

    /** キャンペーンユニットID（Campaign ID / Ad Group ID 共通） */
    String campaignId();

    Map<BulkColumn, Object> cells();

    /** 全Entity共通の列 */
    default Map<BulkColumn, Object> baseCells() {
        Map<BulkColumn, Object> cells = new EnumMap<>(BulkColumn.class);
        cells.put(BulkColumn.PRODUCT, PRODUCT);
        cells.put(BulkColumn.ENTITY, entity().label());
        cells.put(BulkColumn.OPERATION, OPERATION);
        cells.put(BulkColumn.CAMPAIGN_ID, campaignId());
        cells.put(BulkColumn.STATE, STATE);
        return cells;
    }
}
