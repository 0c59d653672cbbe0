package com.example.bulk_campaign.sheet;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.bulk_campaign.dto.BulkSheetRequest;
import com.example.bulk_campaign.dto.BulkSheetResponse;
import com.example.bulk_campaign.dto.ExampleDataResponse;
import com.example.bulk_campaign.export.BulkSheetExporter;
import com.example.bulk_campaign.export.ExportFormat;
import com.example.bulk_campaign.service.BulkSheetService;
import com.example.bulk_campaign.service.GenerationResult;
import com.example.bulk_campaign.validation.ValidationResult;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/bulk-sheets")
@RequiredArgsConstructor
@Validated
public class BulkSheetController {

    private final BulkSheetService bulkSheetService;
    private final BulkSheetExporter exporter;

    /**
     * 入力チェックのみ（生成はしない）
     *
     * POST /bulk-sheets/validate
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationResult> validate(@Valid @RequestBody BulkSheetRequest req) {
        return ResponseEntity.ok(bulkSheetService.validate(req));
    }

    /**
     * POST /bulk-sheets/generate
     *
     * 入力エラーは 400 + ValidationResult（再入力を促す）
     */
    @PostMapping("/generate")
    public ResponseEntity<?> generate(@Valid @RequestBody BulkSheetRequest req) {
        GenerationResult result = bulkSheetService.generate(req);
        if (!result.isOk()) {
            return ResponseEntity.badRequest().body(result.validation());
        }
        return ResponseEntity.ok(BulkSheetResponse.of(result.sheet()));
    }

    /**
     * 先頭N行だけ返す（画面プレビュー用）
     *
     * POST /bulk-sheets/preview?maxRows=5
     */
    @PostMapping("/preview")
    public ResponseEntity<?> preview(
            @Valid @RequestBody BulkSheetRequest req,
            @RequestParam(value = "maxRows", defaultValue = "5") int maxRows) {
        GenerationResult result = bulkSheetService.generate(req);
        if (!result.isOk()) {
            return ResponseEntity.badRequest().body(result.validation());
        }
        return ResponseEntity.ok(BulkSheetResponse.preview(result.sheet(), maxRows));
    }

    /**
     * 生成してファイルとして返す。出力ディレクトリにも保存する。
     *
     * POST /bulk-sheets/export?format=xlsx|csv
     */
    @PostMapping("/export")
    public ResponseEntity<?> export(
            @Valid @RequestBody BulkSheetRequest req,
            @RequestParam(value = "format", defaultValue = "xlsx") String format) throws IOException {
        // 形式が不正なら生成前に BulkSheetException
        ExportFormat exportFormat = ExportFormat.fromValue(format);

        GenerationResult result = bulkSheetService.generate(req);
        if (!result.isOk()) {
            return ResponseEntity.badRequest().body(result.validation());
        }

        Path saved = exporter.save(result.sheet(), exportFormat);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"" + saved.getFileName() + "\"")
                .contentType(MediaType.parseMediaType(exportFormat.contentType()))
                .body(Files.readAllBytes(saved));
    }

    /**
     * GET /bulk-sheets/example
     */
    @GetMapping("/example")
    public ResponseEntity<ExampleDataResponse> example() {
        return ResponseEntity.ok(bulkSheetService.exampleData());
    }
}
