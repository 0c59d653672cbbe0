package com.example.bulk_campaign.generator;

import java.math.BigDecimal;
import java.util.Map;

import com.example.bulk_campaign.sheet.BulkColumn;

public record KeywordRow(
        String campaignId,
        String keywordText,
        BigDecimal bid,
        MatchType matchType) implements BulkRow {

    @Override
    public Entity entity() {
        return Entity.KEYWORD;
    }

    @Override
    public Map<BulkColumn, Object> cells() {
        Map<BulkColumn, Object> cells = baseCells();
        cells.put(BulkColumn.AD_GROUP_ID, campaignId);
        cells.put(BulkColumn.BID, bid);
        cells.put(BulkColumn.KEYWORD_TEXT, keywordText);
        cells.put(BulkColumn.MATCH_TYPE, matchType.value());
        return cells;
    }
}
