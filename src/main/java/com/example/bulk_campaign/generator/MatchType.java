package com.example.bulk_campaign.generator;

import java.util.Locale;
import java.util.Optional;

public enum MatchType {
    EXACT("exact"),
    PHRASE("phrase"),
    BROAD("broad");

    private final String value;

    MatchType(String value) {
        this.value = value;
    }

    /** bulk sheet / 名前テンプレートに書き出す小文字表記 */
    public String value() {
        return value;
    }

    public static Optional<MatchType> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        for (MatchType t : values()) {
            if (t.value.equals(lower)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
