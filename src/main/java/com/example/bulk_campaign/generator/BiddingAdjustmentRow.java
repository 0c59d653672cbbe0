package com.example.bulk_campaign.generator;

import java.util.Map;

import com.example.bulk_campaign.sheet.BulkColumn;

public record BiddingAdjustmentRow(
        String campaignId,
        String placement,
        String percentage) implements BulkRow {

    @Override
    public Entity entity() {
        return Entity.BIDDING_ADJUSTMENT;
    }

    @Override
    public Map<BulkColumn, Object> cells() {
        Map<BulkColumn, Object> cells = baseCells();
        cells.put(BulkColumn.AD_GROUP_ID, campaignId);
        cells.put(BulkColumn.PLACEMENT, placement);
        cells.put(BulkColumn.PERCENTAGE, percentage);
        return cells;
    }
}
