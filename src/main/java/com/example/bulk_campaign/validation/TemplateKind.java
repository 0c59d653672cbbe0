package com.example.bulk_campaign.validation;

public enum TemplateKind {
    CAMPAIGN("campaign"),
    AD_GROUP("ad group");

    private final String label;

    TemplateKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
