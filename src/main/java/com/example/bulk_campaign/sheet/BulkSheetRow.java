package com.example.bulk_campaign.sheet;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 組み立て済みテーブルの1行。
 *
 * 金額列は数値（BigDecimal）のまま保持し、表示・出力時にだけ2桁小数の文字列にする。
 */
public final class BulkSheetRow {

    private final Map<BulkColumn, Object> values;

    BulkSheetRow(Map<BulkColumn, Object> values) {
        Map<BulkColumn, Object> copy = new EnumMap<>(BulkColumn.class);
        copy.putAll(values);
        this.values = Collections.unmodifiableMap(copy);
    }

    /** 元の値。空欄は null */
    public Object value(BulkColumn column) {
        return values.get(column);
    }

    public BigDecimal decimal(BulkColumn column) {
        Object v = values.get(column);
        return v instanceof BigDecimal d ? d : null;
    }

    /** 出力用の文字列。空欄は null */
    public String display(BulkColumn column) {
        Object v = values.get(column);
        if (v == null) {
            return null;
        }
        if (column.isCurrency() && v instanceof BigDecimal d) {
            return d.setScale(2, RoundingMode.HALF_UP).toPlainString();
        }
        return v.toString();
    }

    public List<String> displayValues() {
        List<String> out = new ArrayList<>(BulkColumn.values().length);
        for (BulkColumn c : BulkColumn.values()) {
            out.add(display(c));
        }
        return out;
    }

    /** ヘッダー名 → 表示値（列順を保持） */
    public Map<String, String> toDisplayMap() {
        Map<String, String> out = new LinkedHashMap<>();
        for (BulkColumn c : BulkColumn.values()) {
            out.put(c.header(), display(c));
        }
        return out;
    }

    @Override
    public String toString() {
        return "BulkSheetRow" + values;
    }
}
