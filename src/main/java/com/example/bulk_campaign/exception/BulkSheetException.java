package com.example.bulk_campaign.exception;

import com.example.bulk_campaign.validation.ErrorCode;

/**
 * 再入力では回復できない失敗（override ファイルの列不足、未対応の出力形式など）。
 */
public class BulkSheetException extends RuntimeException {

    private final ErrorCode code;

    public BulkSheetException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public BulkSheetException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
