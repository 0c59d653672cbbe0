package com.example.bulk_campaign.export;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.example.bulk_campaign.sheet.BulkSheet;
import com.example.bulk_campaign.sheet.BulkSheetRow;

/**
 * bulk sheet を XLSX / CSV に書き出す。
 */
@Service
public class BulkSheetExporter {

    private static final Logger log = LoggerFactory.getLogger(BulkSheetExporter.class);

    public static final String SHEET_NAME = "Sponsored Products";
    public static final String FILE_PREFIX = "amazon_bulk_upload_";
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_COLUMN_CHARS = 255;

    private final Clock clock;

    @Value("${bulk.output-dir:output}")
    private String outputDir;

    public BulkSheetExporter(Clock clock) {
        this.clock = clock;
    }

    /**
     * 出力ディレクトリにファイルを保存してパスを返す。
     */
    public Path save(BulkSheet sheet, ExportFormat format) {
        Path dir = Paths.get(outputDir);
        Path file = dir.resolve(fileName(format));
        try {
            Files.createDirectories(dir);
            try (OutputStream out = Files.newOutputStream(file)) {
                write(sheet, format, out);
            }
        } catch (IOException e) {
            log.error("Failed to save bulk sheet: {}", file, e);
            throw new UncheckedIOException("Failed to save bulk sheet: " + file, e);
        }
        log.info("Saved {} file: {} ({} rows)", format.extension(), file, sheet.size());
        return file;
    }

    public byte[] toBytes(BulkSheet sheet, ExportFormat format) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(sheet, format, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render bulk sheet", e);
        }
        return out.toByteArray();
    }

    public void write(BulkSheet sheet, ExportFormat format, OutputStream out) throws IOException {
        switch (format) {
            case XLSX -> writeXlsx(sheet, out);
            case CSV -> writeCsv(sheet, out);
        }
    }

    public String fileName(ExportFormat format) {
        return FILE_PREFIX + FILE_TIMESTAMP.format(LocalDateTime.now(clock)) + "." + format.extension();
    }

    private void writeCsv(BulkSheet sheet, OutputStream out) throws IOException {
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader(sheet.headers().toArray(new String[0]))
                .build();

        // 呼び出し側のストリームは閉じない
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        CSVPrinter printer = new CSVPrinter(writer, csvFormat);
        for (BulkSheetRow row : sheet.rows()) {
            printer.printRecord(row.displayValues());
        }
        printer.flush();
    }

    private void writeXlsx(BulkSheet sheet, OutputStream out) throws IOException {
        List<String> headers = sheet.headers();
        int[] widths = new int[headers.size()];

        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet ws = workbook.createSheet(SHEET_NAME);

            Row headerRow = ws.createRow(0);
            for (int c = 0; c < headers.size(); c++) {
                headerRow.createCell(c).setCellValue(headers.get(c));
                widths[c] = headers.get(c).length();
            }

            int r = 1;
            for (BulkSheetRow row : sheet.rows()) {
                Row xRow = ws.createRow(r++);
                List<String> values = row.displayValues();
                for (int c = 0; c < values.size(); c++) {
                    String v = values.get(c);
                    if (v == null) {
                        continue;
                    }
                    Cell cell = xRow.createCell(c);
                    cell.setCellValue(v);
                    widths[c] = Math.max(widths[c], v.length());
                }
            }

            // 列幅は内容に合わせる（+2文字）
            for (int c = 0; c < widths.length; c++) {
                ws.setColumnWidth(c, Math.min(widths[c] + 2, MAX_COLUMN_CHARS) * 256);
            }

            workbook.write(out);
        }
    }
}
