package com.example.bulk_campaign.input;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/inputs")
@RequiredArgsConstructor
public class InputController {

    private final ListInputParser parser;

    /**
     * POST /inputs/parse-text
     * Body: {"text": "gaming keyboard, wireless mouse\nlaptop stand"}
     */
    @PostMapping("/parse-text")
    public ResponseEntity<?> parseText(@RequestBody TextInput input) {
        List<String> values = parser.parseText(input == null ? null : input.text());
        return ResponseEntity.ok(Map.of("count", values.size(), "values", values));
    }

    /**
     * CSVの1列目をリストとして取り込む
     *
     * POST /inputs/import-column
     * Content-Type: multipart/form-data
     */
    @PostMapping(value = "/import-column", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> importColumn(@RequestParam("file") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "File is required"));
        }
        List<String> values = parser.readFirstColumn(file.getInputStream());
        return ResponseEntity.ok(Map.of("count", values.size(), "values", values));
    }

    public record TextInput(String text) {
    }
}
