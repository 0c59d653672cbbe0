package com.example.bulk_campaign.validation;

/**
 * バリデーション結果。失敗時は最初に引っかかったルールのみを保持する。
 */
public record ValidationResult(
        boolean ok,
        ErrorCode code,
        String message) {

    private static final ValidationResult SUCCESS = new ValidationResult(true, null, null);

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(ErrorCode code, String message) {
        return new ValidationResult(false, code, message);
    }

    public boolean failed() {
        return !ok;
    }
}
