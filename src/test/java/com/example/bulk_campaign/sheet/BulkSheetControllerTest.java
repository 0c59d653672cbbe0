package com.example.bulk_campaign.sheet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;

import com.example.bulk_campaign.dto.BulkSheetRequest;
import com.example.bulk_campaign.dto.BulkSheetResponse;
import com.example.bulk_campaign.dto.CampaignSettingsRequest;
import com.example.bulk_campaign.exception.BulkSheetException;
import com.example.bulk_campaign.export.BulkSheetExporter;
import com.example.bulk_campaign.generator.BulkSheetGenerator;
import com.example.bulk_campaign.generator.Grouper;
import com.example.bulk_campaign.generator.NameTemplateEngine;
import com.example.bulk_campaign.service.BulkSheetService;
import com.example.bulk_campaign.validation.CampaignValidator;
import com.example.bulk_campaign.validation.ErrorCode;
import com.example.bulk_campaign.validation.ValidationResult;

class BulkSheetControllerTest {

    @TempDir
    Path tempDir;

    private BulkSheetController controller;
    private BulkSheetExporter exporter;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-04-20T08:00:00Z"), ZoneOffset.UTC);
        BulkSheetService service = new BulkSheetService(
                new CampaignValidator(clock),
                new BulkSheetGenerator(new Grouper(), new NameTemplateEngine()),
                new TableAssembler());
        exporter = new BulkSheetExporter(clock);
        ReflectionTestUtils.setField(exporter, "outputDir", tempDir.toString());
        controller = new BulkSheetController(service, exporter);
    }

    @Test
    void generate_returnsTableAndSummary() {
        ResponseEntity<?> res = controller.generate(request("10.00"));

        assertEquals(200, res.getStatusCode().value());
        BulkSheetResponse body = (BulkSheetResponse) res.getBody();
        assertEquals(27, body.headers().size());
        assertEquals(8, body.summary().totalRows());
        assertEquals(2, body.summary().campaigns());
        assertEquals("10.00", body.rows().get(0).get("Daily Budget"));
    }

    @Test
    void generate_invalidInput_returns400WithValidationResult() {
        ResponseEntity<?> res = controller.generate(request("1"));

        assertEquals(400, res.getStatusCode().value());
        ValidationResult body = (ValidationResult) res.getBody();
        assertFalse(body.ok());
        assertEquals(ErrorCode.BELOW_MINIMUM, body.code());
    }

    @Test
    void validate_doesNotGenerate() {
        ResponseEntity<ValidationResult> res = controller.validate(request("10.00"));

        assertTrue(res.getBody().ok());
    }

    @Test
    void preview_limitsRowsAndHidesAlwaysEmptyColumns() {
        ResponseEntity<?> res = controller.preview(request("10.00"), 3);

        BulkSheetResponse body = (BulkSheetResponse) res.getBody();
        assertEquals(3, body.rows().size());
        assertEquals(8, body.summary().totalRows());
        assertFalse(body.headers().contains("Portfolio ID"));
        assertFalse(body.headers().contains("End Date"));
        assertEquals(25, body.headers().size());
    }

    @Test
    void export_csv_returnsAttachment() throws Exception {
        ResponseEntity<?> res = controller.export(request("10.00"), "csv");

        assertEquals(200, res.getStatusCode().value());
        assertEquals("attachment; filename=\"amazon_bulk_upload_20250420_080000.csv\"",
                res.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION));
        String csv = new String((byte[]) res.getBody());
        assertTrue(csv.startsWith("Product,Entity,Operation"));
    }

    @Test
    void export_unsupportedFormat_failsBeforeGenerating() {
        BulkSheetService service = mock(BulkSheetService.class);
        BulkSheetController c = new BulkSheetController(service, exporter);

        BulkSheetException ex = assertThrows(BulkSheetException.class, () -> c.export(request("10.00"), "pdf"));

        assertEquals(ErrorCode.UNSUPPORTED_EXPORT_FORMAT, ex.getCode());
        verify(service, never()).generate(any());
    }

    @Test
    void example_returnsSampleLists() {
        assertEquals(List.of("SKU001", "SKU002"), controller.example().getBody().skus());
    }

    private BulkSheetRequest request(String dailyBudget) {
        CampaignSettingsRequest settings = new CampaignSettingsRequest();
        settings.setDailyBudget(new BigDecimal(dailyBudget));
        settings.setStartDate(LocalDate.of(2025, 4, 21));
        settings.setMatchTypes(List.of("exact"));
        settings.setBids(Map.of("exact", new BigDecimal("0.75")));

        BulkSheetRequest req = new BulkSheetRequest();
        req.setKeywords(List.of("gaming keyboard", "wireless mouse"));
        req.setSkus(List.of("SKU001"));
        req.setSettings(settings);
        return req;
    }
}
