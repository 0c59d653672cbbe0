package com.example.bulk_campaign.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import com.example.bulk_campaign.exception.BulkSheetException;
import com.example.bulk_campaign.generator.AdGroupRow;
import com.example.bulk_campaign.generator.CampaignRow;
import com.example.bulk_campaign.generator.KeywordRow;
import com.example.bulk_campaign.generator.MatchType;
import com.example.bulk_campaign.sheet.BulkSheet;
import com.example.bulk_campaign.sheet.TableAssembler;
import com.example.bulk_campaign.validation.ErrorCode;

class BulkSheetExporterTest {

    @TempDir
    Path tempDir;

    private BulkSheetExporter exporter;
    private BulkSheet sheet;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-05-01T09:30:15Z"), ZoneOffset.UTC);
        exporter = new BulkSheetExporter(clock);
        ReflectionTestUtils.setField(exporter, "outputDir", tempDir.resolve("output").toString());

        sheet = new TableAssembler().assemble(List.of(
                new CampaignRow("SKU001_exact_kw", "SP_SKU001_exact_kw", "20250501", new BigDecimal("10")),
                new AdGroupRow("SKU001_exact_kw", "AG_SKU001_exact_kw", new BigDecimal("0.755")),
                new KeywordRow("SKU001_exact_kw", "kw", new BigDecimal("1.2"), MatchType.EXACT)));
    }

    @Test
    void fileName_usesTimestampFromClock() {
        assertEquals("amazon_bulk_upload_20250501_093015.xlsx", exporter.fileName(ExportFormat.XLSX));
        assertEquals("amazon_bulk_upload_20250501_093015.csv", exporter.fileName(ExportFormat.CSV));
    }

    @Test
    void save_csv_writesHeaderAndFormattedRows() throws Exception {
        Path file = exporter.save(sheet, ExportFormat.CSV);

        assertTrue(Files.exists(file));
        assertEquals(tempDir.resolve("output"), file.getParent());

        String content = Files.readString(file, StandardCharsets.UTF_8);
        try (CSVParser parser = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build()
                .parse(new StringReader(content))) {
            assertEquals(sheet.headers(), parser.getHeaderNames());

            List<CSVRecord> records = parser.getRecords();
            assertEquals(3, records.size());
            assertEquals("Campaign", records.get(0).get("Entity"));
            assertEquals("10.00", records.get(0).get("Daily Budget"));
            assertEquals("", records.get(0).get("Ad Group ID"));
            assertEquals("0.76", records.get(1).get("Ad Group Default Bid"));
            assertEquals("1.20", records.get(2).get("Bid"));
            assertEquals("exact", records.get(2).get("Match Type"));
        }
    }

    @Test
    void save_xlsx_writesSingleSheetWithAllRows() throws Exception {
        Path file = exporter.save(sheet, ExportFormat.XLSX);

        try (InputStream in = Files.newInputStream(file);
                XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            assertEquals(1, workbook.getNumberOfSheets());
            Sheet ws = workbook.getSheet(BulkSheetExporter.SHEET_NAME);

            Row header = ws.getRow(0);
            assertEquals(27, header.getLastCellNum());
            assertEquals("Product", header.getCell(0).getStringCellValue());
            assertEquals("Product Targeting Expression", header.getCell(26).getStringCellValue());

            assertEquals(3, ws.getLastRowNum());
            assertEquals("10.00", ws.getRow(1).getCell(15).getStringCellValue());
            assertNull(ws.getRow(1).getCell(4));
            assertTrue(ws.getColumnWidth(9) >= ("SP_SKU001_exact_kw".length() + 2) * 256);
        }
    }

    @Test
    void toBytes_csv_startsWithHeader() {
        byte[] bytes = exporter.toBytes(sheet, ExportFormat.CSV);

        String text = new String(bytes, StandardCharsets.UTF_8);
        assertTrue(text.startsWith("Product,Entity,Operation,Campaign ID,Ad Group ID"));
    }

    @Test
    void toBytes_xlsx_isReadableWorkbook() throws Exception {
        byte[] bytes = exporter.toBytes(sheet, ExportFormat.XLSX);

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            assertEquals("Sponsored Products", workbook.getSheetAt(0).getSheetName());
        }
    }

    @Test
    void unsupportedFormat_isFatal() {
        BulkSheetException ex = assertThrows(BulkSheetException.class, () -> ExportFormat.fromValue("pdf"));

        assertEquals(ErrorCode.UNSUPPORTED_EXPORT_FORMAT, ex.getCode());
        assertEquals("Unsupported format: pdf", ex.getMessage());
    }

    @Test
    void formatName_isCaseInsensitive() {
        assertEquals(ExportFormat.XLSX, ExportFormat.fromValue("XLSX"));
        assertEquals(ExportFormat.CSV, ExportFormat.fromValue(" csv "));
    }
}
