package com.example.bulk_campaign.generator;

import java.math.BigDecimal;
import java.util.Map;

import com.example.bulk_campaign.sheet.BulkColumn;

public record AdGroupRow(
        String campaignId,
        String adGroupName,
        BigDecimal defaultBid) implements BulkRow {

    @Override
    public Entity entity() {
        return Entity.AD_GROUP;
    }

    public String adGroupId() {
        return campaignId;
    }

    @Override
    public Map<BulkColumn, Object> cells() {
        Map<BulkColumn, Object> cells = baseCells();
        cells.put(BulkColumn.AD_GROUP_ID, adGroupId());
        cells.put(BulkColumn.AD_GROUP_NAME, adGroupName);
        cells.put(BulkColumn.AD_GROUP_DEFAULT_BID, defaultBid);
        return cells;
    }
}
