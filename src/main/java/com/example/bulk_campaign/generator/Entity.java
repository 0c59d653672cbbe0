package com.example.bulk_campaign.generator;

/**
 * bulk sheet の Entity 列に書く値。
 */
public enum Entity {
    CAMPAIGN("Campaign"),
    AD_GROUP("Ad Group"),
    BIDDING_ADJUSTMENT("Bidding Adjustment"),
    PRODUCT_AD("Product Ad"),
    KEYWORD("Keyword");

    private final String label;

    Entity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
