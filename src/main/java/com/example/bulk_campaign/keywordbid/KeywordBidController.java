package com.example.bulk_campaign.keywordbid;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/keyword-bids")
@RequiredArgsConstructor
public class KeywordBidController {

    private final KeywordBidLoader loader;

    /**
     * キーワード個別入札CSVを読み込んで keyword → bid を返す。
     * 返した map はそのまま settings.keywordBids に渡す。
     *
     * POST /keyword-bids/import
     * Content-Type: multipart/form-data
     * Body: file=@keyword_bids.csv
     */
    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> importCsv(@RequestParam("file") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "File is required"));
        }

        Map<String, BigDecimal> bids = loader.load(file.getInputStream());
        return ResponseEntity.ok(Map.of(
                "count", bids.size(),
                "keywordBids", bids));
    }
}
