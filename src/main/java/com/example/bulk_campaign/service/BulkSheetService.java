package com.example.bulk_campaign.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.bulk_campaign.dto.BulkSheetRequest;
import com.example.bulk_campaign.dto.CampaignSettingsRequest;
import com.example.bulk_campaign.dto.ExampleDataResponse;
import com.example.bulk_campaign.generator.BulkRow;
import com.example.bulk_campaign.generator.BulkSheetGenerator;
import com.example.bulk_campaign.generator.CampaignSettings;
import com.example.bulk_campaign.sheet.BulkSheet;
import com.example.bulk_campaign.sheet.TableAssembler;
import com.example.bulk_campaign.validation.CampaignValidator;
import com.example.bulk_campaign.validation.ValidationResult;

import lombok.RequiredArgsConstructor;

/**
 * 検証 → 生成 → テーブル組み立て。
 */
@Service
@RequiredArgsConstructor
public class BulkSheetService {

    private static final Logger log = LoggerFactory.getLogger(BulkSheetService.class);

    private static final ExampleDataResponse EXAMPLE_DATA = new ExampleDataResponse(
            List.of("gaming keyboard", "wireless mouse", "laptop stand"),
            List.of("SKU001", "SKU002"));

    private final CampaignValidator validator;
    private final BulkSheetGenerator generator;
    private final TableAssembler assembler;

    /**
     * キーワード → SKU → マッチタイプ(生値) → 設定全体 の順に検証する。
     */
    public ValidationResult validate(BulkSheetRequest request) {
        ValidationResult result = validator.validateKeywords(request.getKeywords());
        if (result.failed()) {
            return result;
        }
        result = validator.validateSkus(request.getSkus());
        if (result.failed()) {
            return result;
        }
        CampaignSettingsRequest settings = request.getSettings();
        result = validator.validateMatchTypes(settings.getMatchTypes());
        if (result.failed()) {
            return result;
        }
        return validator.validateCampaignSettings(settings.toSettings());
    }

    public GenerationResult generate(BulkSheetRequest request) {
        ValidationResult validation = validate(request);
        if (validation.failed()) {
            log.info("Bulk sheet rejected: code={}, message={}", validation.code(), validation.message());
            return GenerationResult.rejected(validation);
        }
        BulkSheet sheet = build(request.getKeywords(), request.getSkus(), request.getSettings().toSettings());
        return GenerationResult.generated(sheet);
    }

    /**
     * 検証済みの入力から bulk sheet を作る。
     */
    public BulkSheet build(List<String> keywords, List<String> skus, CampaignSettings settings) {
        List<BulkRow> rows = generator.generate(keywords, skus, settings);
        BulkSheet sheet = assembler.assemble(rows);
        log.info("Bulk sheet generated: keywords={}, skus={}, matchTypes={}, rows={}",
                keywords.size(), skus.size(), settings.getMatchTypes().size(), sheet.size());
        return sheet;
    }

    public ExampleDataResponse exampleData() {
        return EXAMPLE_DATA;
    }
}
