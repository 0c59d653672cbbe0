package com.example.bulk_campaign.sheet;

import java.util.Arrays;
import java.util.List;

import com.example.bulk_campaign.generator.Entity;

/**
 * 27列固定の bulk sheet。
 */
public record BulkSheet(List<BulkSheetRow> rows) {

    public BulkSheet {
        rows = List.copyOf(rows);
    }

    public List<BulkColumn> columns() {
        return Arrays.asList(BulkColumn.values());
    }

    public List<String> headers() {
        return columns().stream().map(BulkColumn::header).toList();
    }

    public int size() {
        return rows.size();
    }

    public BulkSheetRow row(int index) {
        return rows.get(index);
    }

    public long count(Entity entity) {
        return rows.stream()
                .filter(r -> entity.label().equals(r.value(BulkColumn.ENTITY)))
                .count();
    }

    public List<BulkSheetRow> rowsOf(Entity entity) {
        return rows.stream()
                .filter(r -> entity.label().equals(r.value(BulkColumn.ENTITY)))
                .toList();
    }

    public BulkSheet head(int maxRows) {
        return new BulkSheet(rows.subList(0, Math.min(Math.max(maxRows, 0), rows.size())));
    }
}
