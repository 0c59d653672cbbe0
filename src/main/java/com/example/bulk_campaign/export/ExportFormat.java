package com.example.bulk_campaign.export;

import java.util.Locale;

import com.example.bulk_campaign.exception.BulkSheetException;
import com.example.bulk_campaign.validation.ErrorCode;

public enum ExportFormat {
    XLSX("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
    CSV("csv", "text/csv");

    private final String extension;
    private final String contentType;

    ExportFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    public String extension() {
        return extension;
    }

    public String contentType() {
        return contentType;
    }

    /**
     * @throws BulkSheetException xlsx / csv 以外
     */
    public static ExportFormat fromValue(String value) {
        if (value != null) {
            String lower = value.trim().toLowerCase(Locale.ROOT);
            for (ExportFormat f : values()) {
                if (f.extension.equals(lower)) {
                    return f;
                }
            }
        }
        throw new BulkSheetException(ErrorCode.UNSUPPORTED_EXPORT_FORMAT, "Unsupported format: " + value);
    }
}
