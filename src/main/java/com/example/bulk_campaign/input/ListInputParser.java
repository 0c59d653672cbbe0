package com.example.bulk_campaign.input;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * キーワード / SKU リストの入力を文字列リストにする。
 */
@Component
public class ListInputParser {

    private static final Logger log = LoggerFactory.getLogger(ListInputParser.class);

    // String.trim() は NBSP などを残すので Unicode の空白で切る
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * カンマ区切り・改行区切りのテキストを分割し、前後の空白を除いて空要素を捨てる。
     */
    public List<String> parseText(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.replace("\r\n", "\n").replace('\n', ',').split(","))
                .map(ListInputParser::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /**
     * アップロードされたCSVの1列目を上から順に返す（1行目はヘッダー）。
     */
    public List<String> readFirstColumn(InputStream inputStream) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setAllowMissingColumnNames(true)
                .setTrim(true)
                .build();

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(inputStream, StandardCharsets.UTF_8));
                CSVParser parser = format.parse(reader)) {

            List<String> values = new ArrayList<>();
            int records = 0;
            for (CSVRecord record : parser) {
                records++;
                if (record.size() == 0) {
                    continue;
                }
                String v = strip(record.get(0));
                if (v != null && !v.isEmpty()) {
                    values.add(v);
                }
            }

            if (records == 0) {
                // 空ファイルは呼び出し側のリスト検証で EMPTY_INPUT になる
                log.warn("CSV file has no data rows");
            }
            log.info("CSV column import completed: {} values from {} rows", values.size(), records);
            return values;

        } catch (IOException e) {
            log.error("Error loading CSV file", e);
            throw new UncheckedIOException("Error loading CSV file", e);
        }
    }

    static String strip(String value) {
        return value == null ? null : EDGE_WHITESPACE.matcher(value).replaceAll("");
    }
}
