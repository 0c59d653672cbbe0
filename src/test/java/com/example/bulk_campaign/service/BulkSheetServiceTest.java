package com.example.bulk_campaign.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.bulk_campaign.dto.BulkSheetRequest;
import com.example.bulk_campaign.dto.CampaignSettingsRequest;
import com.example.bulk_campaign.generator.BulkSheetGenerator;
import com.example.bulk_campaign.generator.Entity;
import com.example.bulk_campaign.generator.Grouper;
import com.example.bulk_campaign.generator.NameTemplateEngine;
import com.example.bulk_campaign.sheet.BulkColumn;
import com.example.bulk_campaign.sheet.BulkSheet;
import com.example.bulk_campaign.sheet.TableAssembler;
import com.example.bulk_campaign.validation.CampaignValidator;
import com.example.bulk_campaign.validation.ErrorCode;
import com.example.bulk_campaign.validation.ValidationResult;

class BulkSheetServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 4, 20);

    private CampaignValidator validator;
    private BulkSheetService service;

    @BeforeEach
    void setUp() {
        validator = new CampaignValidator(Clock.fixed(Instant.parse("2025-04-20T00:00:00Z"), ZoneOffset.UTC));
        service = new BulkSheetService(
                validator,
                new BulkSheetGenerator(new Grouper(), new NameTemplateEngine()),
                new TableAssembler());
    }

    @Test
    void generate_exampleData_producesOneUnitPerKeywordSkuAndMatchType() {
        BulkSheetRequest req = request(
                service.exampleData().keywords(),
                service.exampleData().skus(),
                List.of("exact", "phrase"));

        GenerationResult result = service.generate(req);

        assertTrue(result.isOk());
        BulkSheet sheet = result.sheet();
        // 3 keywords × 2 SKU × 2 マッチタイプ
        assertEquals(12, sheet.count(Entity.CAMPAIGN));
        assertEquals(12, sheet.count(Entity.AD_GROUP));
        assertEquals(12, sheet.count(Entity.PRODUCT_AD));
        assertEquals(12, sheet.count(Entity.KEYWORD));
        assertEquals(48, sheet.size());
        assertEquals("SKU001_exact_gaming_keyboard", sheet.row(0).value(BulkColumn.CAMPAIGN_ID));
        assertEquals("0.50", sheet.rowsOf(Entity.AD_GROUP).get(1).display(BulkColumn.AD_GROUP_DEFAULT_BID));
    }

    @Test
    void validate_checksKeywordsBeforeSkus() {
        ValidationResult result = service.validate(request(List.of(), List.of(), List.of("exact")));

        assertEquals(ErrorCode.EMPTY_INPUT, result.code());
        assertEquals("No keyword provided", result.message());
    }

    @Test
    void validate_rawMatchTypeNamesAreChecked() {
        ValidationResult result = service.validate(
                request(List.of("gaming keyboard"), List.of("SKU001"), List.of("exact", "fuzzy")));

        assertEquals(ErrorCode.INVALID_CHARACTERS, result.code());
        assertEquals("Invalid characters in Match type: fuzzy", result.message());
    }

    @Test
    void generate_invalidInput_returnsValidationWithoutSheet() {
        BulkSheetRequest req = request(List.of("gaming keyboard"), List.of("SKU 001"), List.of("exact"));

        GenerationResult result = service.generate(req);

        assertFalse(result.isOk());
        assertNull(result.sheet());
        assertEquals("Invalid characters in SKU: SKU 001", result.validation().message());
    }

    @Test
    void generate_invalidInput_neverCallsGenerator() {
        BulkSheetGenerator generator = mock(BulkSheetGenerator.class);
        TableAssembler assembler = mock(TableAssembler.class);
        BulkSheetService mocked = new BulkSheetService(validator, generator, assembler);

        BulkSheetRequest req = request(List.of("gaming keyboard"), List.of("SKU001"), List.of("exact"));
        req.getSettings().setDailyBudget(new BigDecimal("1.0"));

        GenerationResult result = mocked.generate(req);

        assertEquals(ErrorCode.BELOW_MINIMUM, result.validation().code());
        verify(generator, never()).generate(any(), any(), any());
        verify(assembler, never()).assemble(any());
    }

    @Test
    void generate_keywordBidOverridesFromRequest() {
        BulkSheetRequest req = request(List.of("gaming keyboard", "wireless mouse"), List.of("SKU001"),
                List.of("exact"));
        req.getSettings().setKeywordBids(Map.of("wireless mouse", new BigDecimal("1.1")));

        BulkSheet sheet = service.generate(req).sheet();

        assertEquals("0.75", sheet.rowsOf(Entity.KEYWORD).get(0).display(BulkColumn.BID));
        assertEquals("1.10", sheet.rowsOf(Entity.KEYWORD).get(1).display(BulkColumn.BID));
    }

    private BulkSheetRequest request(List<String> keywords, List<String> skus, List<String> matchTypes) {
        CampaignSettingsRequest settings = new CampaignSettingsRequest();
        settings.setDailyBudget(new BigDecimal("10.00"));
        settings.setStartDate(TODAY);
        settings.setMatchTypes(matchTypes);
        settings.setBids(Map.of(
                "exact", new BigDecimal("0.75"),
                "phrase", new BigDecimal("0.50"),
                "broad", new BigDecimal("0.40")));

        BulkSheetRequest req = new BulkSheetRequest();
        req.setKeywords(keywords);
        req.setSkus(skus);
        req.setSettings(settings);
        return req;
    }
}
