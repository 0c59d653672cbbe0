package com.example.bulk_campaign.generator;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

/**
 * テンプレートビルダーで選べる日付フォーマットの見本文字列。
 * 見本と完全一致した部分だけが開始日に置き換わる（正規表現ではない）。
 */
public enum DateExample {
    DDMMYY("250423", "ddMMyy"),
    US_SLASH("04/23/2025", "MM/dd/yyyy"),
    DASHED("23-04-2025", "dd-MM-yyyy"),
    MONTH_NAME("Apr 23, 2025", "MMM dd, yyyy");

    private final String example;
    private final DateTimeFormatter formatter;

    DateExample(String example, String pattern) {
        this.example = example;
        this.formatter = DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH);
    }

    public String example() {
        return example;
    }

    public String format(LocalDate date) {
        return formatter.format(date);
    }

    public static Optional<DateExample> fromExample(String segment) {
        for (DateExample d : values()) {
            if (d.example.equals(segment)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
