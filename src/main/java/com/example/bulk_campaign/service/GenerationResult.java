package com.example.bulk_campaign.service;

import com.example.bulk_campaign.sheet.BulkSheet;
import com.example.bulk_campaign.validation.ValidationResult;

/**
 * 生成結果。検証に失敗した場合 sheet は null。
 */
public record GenerationResult(
        ValidationResult validation,
        BulkSheet sheet) {

    public static GenerationResult rejected(ValidationResult validation) {
        return new GenerationResult(validation, null);
    }

    public static GenerationResult generated(BulkSheet sheet) {
        return new GenerationResult(ValidationResult.success(), sheet);
    }

    public boolean isOk() {
        return validation.ok();
    }
}
