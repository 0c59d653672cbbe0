package com.example.bulk_campaign.generator;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

import org.springframework.stereotype.Component;

/**
 * キャンペーン名 / 広告グループ名テンプレートの展開。
 */
@Component
public class NameTemplateEngine {

    public static final DateTimeFormatter BULK_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    /**
     * @param template  名前テンプレート
     * @param sku       代表SKU（グループ化されている場合は "_" 連結済み）
     * @param matchType マッチタイプ
     * @param startDate yyyyMMdd 形式の開始日
     */
    public String render(String template, String sku, MatchType matchType, String startDate) {
        return render(template, sku, matchType, LocalDate.parse(startDate, BULK_DATE));
    }

    public String render(String template, String sku, MatchType matchType, LocalDate startDate) {
        String name = template;

        for (DateExample example : DateExample.values()) {
            if (name.contains(example.example())) {
                name = name.replace(example.example(), example.format(startDate));
            }
        }

        for (TemplateToken token : TemplateToken.values()) {
            name = name.replace(token.token(), valueFor(token, sku, matchType));
        }
        return name;
    }

    /**
     * グループ化されたSKUは "先頭SKU+残り件数" で表示して名前が長くなりすぎるのを防ぐ。
     */
    public String skuDisplay(String sku) {
        String[] parts = sku.split("_", -1);
        if (parts.length > 1) {
            return parts[0] + "+" + (parts.length - 1);
        }
        return sku;
    }

    private String valueFor(TemplateToken token, String sku, MatchType matchType) {
        return switch (token) {
            case SKU -> skuDisplay(sku);
            case MATCH_TYPE -> matchType.value();
            case AD_TYPE, ROOT, KEYWORD, AD_GROUP -> token.token();
        };
    }
}
