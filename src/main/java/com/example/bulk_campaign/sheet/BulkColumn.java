package com.example.bulk_campaign.sheet;

/**
 * Sponsored Products bulk sheet の列。宣言順がそのまま出力順（Amazon指定のヘッダー）。
 */
public enum BulkColumn {
    PRODUCT("Product"),
    ENTITY("Entity"),
    OPERATION("Operation"),
    CAMPAIGN_ID("Campaign ID"),
    AD_GROUP_ID("Ad Group ID"),
    PORTFOLIO_ID("Portfolio ID"),
    AD_ID("Ad ID"),
    KEYWORD_ID("Keyword ID"),
    PRODUCT_TARGETING_ID("Product Targeting ID"),
    CAMPAIGN_NAME("Campaign Name"),
    AD_GROUP_NAME("Ad Group Name"),
    START_DATE("Start Date"),
    END_DATE("End Date"),
    TARGETING_TYPE("Targeting Type"),
    STATE("State"),
    DAILY_BUDGET("Daily Budget", true),
    SKU("SKU"),
    AD_GROUP_DEFAULT_BID("Ad Group Default Bid", true),
    BID("Bid", true),
    KEYWORD_TEXT("Keyword Text"),
    NATIVE_LANGUAGE_KEYWORD("Native Language Keyword"),
    NATIVE_LANGUAGE_LOCALE("Native Language Locale"),
    MATCH_TYPE("Match Type"),
    BIDDING_STRATEGY("Bidding Strategy"),
    PLACEMENT("Placement"),
    PERCENTAGE("Percentage"),
    PRODUCT_TARGETING_EXPRESSION("Product Targeting Expression");

    private final String header;
    private final boolean currency;

    BulkColumn(String header) {
        this(header, false);
    }

    BulkColumn(String header, boolean currency) {
        this.header = header;
        this.currency = currency;
    }

    public String header() {
        return header;
    }

    /** 2桁小数で表示する金額列か */
    public boolean isCurrency() {
        return currency;
    }
}
