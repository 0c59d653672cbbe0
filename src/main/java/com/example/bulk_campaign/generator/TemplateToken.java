package com.example.bulk_campaign.generator;

import java.util.Locale;

/**
 * 名前テンプレートのプレースホルダ。置換順はこの宣言順。
 */
public enum TemplateToken {
    SKU("[SKU]", true, true),
    AD_TYPE("SP", true, true),
    MATCH_TYPE("match_type", true, true),
    ROOT("[Root]", true, true),
    KEYWORD("[KW]", true, true),
    AD_GROUP("AG", false, true);

    private final String token;
    private final boolean campaign;
    private final boolean adGroup;

    TemplateToken(String token, boolean campaign, boolean adGroup) {
        this.token = token;
        this.campaign = campaign;
        this.adGroup = adGroup;
    }

    public String token() {
        return token;
    }

    public boolean allowedInCampaign() {
        return campaign;
    }

    public boolean allowedInAdGroup() {
        return adGroup;
    }

    public boolean matchesIgnoreCase(String segment) {
        return token.toLowerCase(Locale.ROOT).equals(segment.toLowerCase(Locale.ROOT));
    }
}
