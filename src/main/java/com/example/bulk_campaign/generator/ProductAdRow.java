package com.example.bulk_campaign.generator;

import java.util.Map;

import com.example.bulk_campaign.sheet.BulkColumn;

public record ProductAdRow(
        String campaignId,
        String sku) implements BulkRow {

    @Override
    public Entity entity() {
        return Entity.PRODUCT_AD;
    }

    @Override
    public Map<BulkColumn, Object> cells() {
        Map<BulkColumn, Object> cells = baseCells();
        cells.put(BulkColumn.AD_GROUP_ID, campaignId);
        cells.put(BulkColumn.SKU, sku);
        return cells;
    }
}
