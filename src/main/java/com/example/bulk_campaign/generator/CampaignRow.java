package com.example.bulk_campaign.generator;

import java.math.BigDecimal;
import java.util.Map;

import com.example.bulk_campaign.sheet.BulkColumn;

public record CampaignRow(
        String campaignId,
        String campaignName,
        String startDate,
        BigDecimal dailyBudget) implements BulkRow {

    @Override
    public Entity entity() {
        return Entity.CAMPAIGN;
    }

    @Override
    public Map<BulkColumn, Object> cells() {
        Map<BulkColumn, Object> cells = baseCells();
        cells.put(BulkColumn.CAMPAIGN_NAME, campaignName);
        cells.put(BulkColumn.START_DATE, startDate);
        cells.put(BulkColumn.TARGETING_TYPE, TARGETING_TYPE);
        cells.put(BulkColumn.DAILY_BUDGET, dailyBudget);
        cells.put(BulkColumn.BIDDING_STRATEGY, BIDDING_STRATEGY);
        return cells;
    }
}
