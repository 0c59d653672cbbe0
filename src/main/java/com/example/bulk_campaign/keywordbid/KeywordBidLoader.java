package com.example.bulk_campaign.keywordbid;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.bulk_campaign.exception.BulkSheetException;
import com.example.bulk_campaign.validation.ErrorCode;

/**
 * キーワード個別入札CSVの読み込み。
 *
 * CSV形式 (ヘッダー必須):
 * Keyword,Bid
 *
 * Bid が数値でない行は捨てる。同じキーワードが複数あれば後の行が優先。
 */
@Service
public class KeywordBidLoader {

    private static final Logger log = LoggerFactory.getLogger(KeywordBidLoader.class);

    public static final String KEYWORD_COLUMN = "Keyword";
    public static final String BID_COLUMN = "Bid";

    public Map<String, BigDecimal> load(InputStream inputStream) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setAllowMissingColumnNames(true)
                .setIgnoreEmptyLines(true)
                .build();

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(inputStream, StandardCharsets.UTF_8));
                CSVParser parser = format.parse(reader)) {

            List<String> headers = stripBom(parser.getHeaderNames());
            int keywordIdx = headers.indexOf(KEYWORD_COLUMN);
            int bidIdx = headers.indexOf(BID_COLUMN);
            if (keywordIdx < 0 || bidIdx < 0) {
                throw new BulkSheetException(ErrorCode.MALFORMED_OVERRIDE_FILE,
                        "CSV must contain 'Keyword' and 'Bid' columns");
            }

            Map<String, BigDecimal> bids = new LinkedHashMap<>();
            int dropped = 0;
            for (CSVRecord record : parser) {
                String keyword = record.isSet(keywordIdx) ? record.get(keywordIdx) : null;
                BigDecimal bid = parseBid(record.isSet(bidIdx) ? record.get(bidIdx) : null);
                if (keyword == null || bid == null) {
                    log.debug("Dropping keyword bid line {}: {}", record.getRecordNumber(), record);
                    dropped++;
                    continue;
                }
                bids.put(keyword, bid);
            }

            log.info("Keyword bids loaded: {} entries, {} dropped", bids.size(), dropped);
            return Collections.unmodifiableMap(bids);

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read keyword bid file", e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            // ヘッダー重複・引用符の不整合など
            throw new BulkSheetException(ErrorCode.MALFORMED_OVERRIDE_FILE,
                    "Malformed keyword bid file: " + e.getMessage(), e);
        }
    }

    private static BigDecimal parseBid(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // Excel保存のCSVは先頭にBOMが付く
    private static List<String> stripBom(List<String> headers) {
        if (headers.isEmpty() || !headers.get(0).startsWith("\uFEFF")) {
            return headers;
        }
        List<String> copy = new ArrayList<>(headers);
        copy.set(0, copy.get(0).substring(1));
        return copy;
    }
}
