package com.example.bulk_campaign.keywordbid;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.example.bulk_campaign.exception.BulkSheetException;
import com.example.bulk_campaign.validation.ErrorCode;

class KeywordBidLoaderTest {

    private final KeywordBidLoader loader = new KeywordBidLoader();

    @Test
    void load_readsKeywordAndBidColumns() {
        String csv = "Keyword,Bid\n" +
                "gaming keyboard,1.25\n" +
                "wireless mouse,0.80";

        Map<String, BigDecimal> bids = loader.load(stream(csv));

        assertEquals(2, bids.size());
        assertEquals(new BigDecimal("1.25"), bids.get("gaming keyboard"));
        assertEquals(new BigDecimal("0.80"), bids.get("wireless mouse"));
    }

    @Test
    void load_extraColumnsAndOrderDoNotMatter() {
        String csv = "Bid,Note,Keyword\n" +
                "0.90,top seller,laptop stand";

        assertEquals(new BigDecimal("0.90"), loader.load(stream(csv)).get("laptop stand"));
    }

    @Test
    void load_nonNumericBidIsDropped() {
        String csv = "Keyword,Bid\n" +
                "gaming keyboard,abc\n" +
                "wireless mouse,\n" +
                "laptop stand,0.5";

        Map<String, BigDecimal> bids = loader.load(stream(csv));

        assertEquals(Map.of("laptop stand", new BigDecimal("0.5")), bids);
    }

    @Test
    void load_laterDuplicateWins() {
        String csv = "Keyword,Bid\n" +
                "gaming keyboard,1.00\n" +
                "gaming keyboard,2.00";

        assertEquals(new BigDecimal("2.00"), loader.load(stream(csv)).get("gaming keyboard"));
    }

    @Test
    void load_utf8BomHeader_isAccepted() {
        String csv = "\uFEFFKeyword,Bid\n" +
                "gaming keyboard,1.25";

        assertEquals(new BigDecimal("1.25"), loader.load(stream(csv)).get("gaming keyboard"));
    }

    @Test
    void load_headerOnly_returnsEmptyMap() {
        assertTrue(loader.load(stream("Keyword,Bid\n")).isEmpty());
    }

    @Test
    void load_missingBidColumn_isFatal() {
        BulkSheetException ex = assertThrows(BulkSheetException.class,
                () -> loader.load(stream("Keyword,Price\ngaming keyboard,1.25")));

        assertEquals(ErrorCode.MALFORMED_OVERRIDE_FILE, ex.getCode());
        assertTrue(ex.getCode().isFatal());
        assertEquals("CSV must contain 'Keyword' and 'Bid' columns", ex.getMessage());
    }

    @Test
    void load_emptyFile_isFatal() {
        BulkSheetException ex = assertThrows(BulkSheetException.class, () -> loader.load(stream("")));

        assertEquals(ErrorCode.MALFORMED_OVERRIDE_FILE, ex.getCode());
    }

    private static InputStream stream(String csv) {
        return new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8));
    }
}
