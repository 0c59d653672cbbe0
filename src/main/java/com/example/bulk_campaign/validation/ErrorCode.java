package com.example.bulk_campaign.validation;

/**
 * 入力エラーの分類。
 *
 * fatal = false のものは {@link ValidationResult} として呼び出し元に返し、
 * fatal = true のものは {@link com.example.bulk_campaign.exception.BulkSheetException} で投げる。
 */
public enum ErrorCode {
    EMPTY_INPUT(false),
    EMPTY_ITEM(false),
    LENGTH_EXCEEDED(false),
    INVALID_CHARACTERS(false),
    INVALID_NUMBER(false),
    BELOW_MINIMUM(false),
    PAST_DATE(false),
    INVALID_PLACEMENT(false),
    INVALID_PERCENTAGE_FORMAT(false),
    PERCENTAGE_OUT_OF_RANGE(false),
    TEMPLATE_LENGTH_EXCEEDED(false),
    MISSING_TEMPLATE_PLACEHOLDER(false),
    INVALID_TEMPLATE_CHARACTERS(false),
    UNSUPPORTED_EXPORT_FORMAT(true),
    MALFORMED_OVERRIDE_FILE(true);

    private final boolean fatal;

    ErrorCode(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
