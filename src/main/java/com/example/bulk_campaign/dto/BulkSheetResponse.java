package com.example.bulk_campaign.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.example.bulk_campaign.generator.Entity;
import com.example.bulk_campaign.sheet.BulkColumn;
import com.example.bulk_campaign.sheet.BulkSheet;
import com.example.bulk_campaign.sheet.BulkSheetRow;

/**
 * 生成結果レスポンス（金額列は2桁小数の表示値）
 */
public record BulkSheetResponse(
        List<String> headers,
        List<Map<String, String>> rows,
        Summary summary) {

    // プレビューでは常に空の列を隠す
    private static final Set<BulkColumn> PREVIEW_HIDDEN = Set.of(BulkColumn.PORTFOLIO_ID, BulkColumn.END_DATE);

    public record Summary(
            int totalRows,
            long campaigns,
            long adGroups,
            long biddingAdjustments,
            long productAds,
            long keywords) {
    }

    public static BulkSheetResponse of(BulkSheet sheet) {
        return of(sheet, sheet);
    }

    /**
     * @param shown   返す行（プレビュー時は先頭N行）
     * @param summary 件数集計の対象（全体）
     */
    public static BulkSheetResponse of(BulkSheet shown, BulkSheet summary) {
        return new BulkSheetResponse(
                shown.headers(),
                shown.rows().stream().map(BulkSheetRow::toDisplayMap).toList(),
                new Summary(
                        summary.size(),
                        summary.count(Entity.CAMPAIGN),
                        summary.count(Entity.AD_GROUP),
                        summary.count(Entity.BIDDING_ADJUSTMENT),
                        summary.count(Entity.PRODUCT_AD),
                        summary.count(Entity.KEYWORD)));
    }

    public static BulkSheetResponse preview(BulkSheet sheet, int maxRows) {
        BulkSheetResponse full = of(sheet.head(maxRows), sheet);
        Set<String> hidden = PREVIEW_HIDDEN.stream().map(BulkColumn::header).collect(Collectors.toSet());
        List<Map<String, String>> rows = full.rows().stream()
                .map(r -> {
                    Map<String, String> copy = new LinkedHashMap<>(r);
                    copy.keySet().removeAll(hidden);
                    return copy;
                })
                .toList();
        List<String> headers = full.headers().stream().filter(h -> !hidden.contains(h)).toList();
        return new BulkSheetResponse(headers, rows, full.summary());
    }
}
