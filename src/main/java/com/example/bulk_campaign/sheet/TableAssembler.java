package com.example.bulk_campaign.sheet;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.example.bulk_campaign.generator.BulkRow;

/**
 * 生成済みの行を27列テーブルに並べる。空文字は null（空欄）に正規化する。
 */
@Component
public class TableAssembler {

    public BulkSheet assemble(List<BulkRow> rows) {
        List<BulkSheetRow> out = new ArrayList<>(rows.size());
        for (BulkRow row : rows) {
            out.add(toSheetRow(row));
        }
        return new BulkSheet(out);
    }

    BulkSheetRow toSheetRow(BulkRow row) {
        Map<BulkColumn, Object> values = new EnumMap<>(BulkColumn.class);
        for (Map.Entry<BulkColumn, Object> e : row.cells().entrySet()) {
            Object v = e.getValue();
            if (v instanceof String s && s.isBlank()) {
                continue;
            }
            if (v != null) {
                values.put(e.getKey(), v);
            }
        }
        return new BulkSheetRow(values);
    }
}
