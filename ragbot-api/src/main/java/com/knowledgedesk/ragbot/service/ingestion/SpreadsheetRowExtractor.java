package com.knowledgedesk.ragbot.service.ingestion;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.ByteOrderMark;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BOMInputStream;
import org.apache.poi.poifs.filesystem.FileMagic;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.tika.detect.AutoDetectReader;
import org.apache.tika.exception.TikaException;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Renders spreadsheets one row per line, cells separated by {@code " | "}, each sheet introduced
 * by a {@code "Sheet: <name>"} line.
 */
@Component
public class SpreadsheetRowExtractor {

    private static final String CELL_SEPARATOR = " | ";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public DocumentTextExtractor.ExtractedDocument extractWorkbook(byte[] content) throws IOException {
        DataFormatter formatter = new DataFormatter();
        StringBuilder text = new StringBuilder();
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            for (Sheet sheet : workbook) {
                text.append(SentenceWindowChunker.SHEET_PREFIX).append(sheet.getSheetName()).append('\n');
                for (Row row : sheet) {
                    List<String> cells = new ArrayList<>();
                    for (Cell cell : row) {
                        String value = formatter.formatCellValue(cell).trim();
                        if (!value.isEmpty()) {
                            cells.add(value);
                        }
                    }
                    if (!cells.isEmpty()) {
                        text.append(String.join(CELL_SEPARATOR, cells)).append('\n');
                    }
                }
            }
        }
        return new DocumentTextExtractor.ExtractedDocument(
                DocumentMetadata.empty().withContentType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
                text.toString().trim());
    }

    /** OLE2 (xls) or OOXML (xlsx) container, as opposed to delimited text. */
    public boolean isWorkbook(byte[] content) throws IOException {
        FileMagic magic = FileMagic.valueOf(new ByteArrayInputStream(content));
        return magic == FileMagic.OLE2 || magic == FileMagic.OOXML;
    }

    /**
     * Comma or tab separated text in any charset Tika can detect. Line breaks inside quoted cells are
     * folded so that each record stays one row.
     */
    public DocumentTextExtractor.ExtractedDocument extractDelimited(byte[] content) throws IOException {
        StringBuilder text = new StringBuilder();
        try (Reader reader = openReader(content)) {
            String body = IOUtils.toString(reader);
            CSVFormat format = (looksTabSeparated(body) ? CSVFormat.TDF : CSVFormat.DEFAULT).builder()
                    .setIgnoreSurroundingSpaces(true)
                    .setIgnoreEmptyLines(true)
                    .build();
            try (CSVParser parser = CSVParser.parse(body, format)) {
                for (CSVRecord record : parser) {
                    List<String> cells = new ArrayList<>();
                    for (String cell : record) {
                        String value = WHITESPACE.matcher(cell).replaceAll(" ").trim();
                        if (!value.isEmpty()) {
                            cells.add(value);
                        }
                    }
                    if (!cells.isEmpty()) {
                        text.append(String.join(CELL_SEPARATOR, cells)).append('\n');
                    }
                }
            }
        }
        return new DocumentTextExtractor.ExtractedDocument(
                DocumentMetadata.empty().withContentType("text/csv"), text.toString().trim());
    }

    private static Reader openReader(byte[] content) throws IOException {
        BOMInputStream bomStream = BOMInputStream.builder()
                .setInputStream(new ByteArrayInputStream(content))
                .setByteOrderMarks(ByteOrderMark.UTF_8, ByteOrderMark.UTF_16LE, ByteOrderMark.UTF_16BE)
                .get();
        if (bomStream.hasBOM()) {
            return new InputStreamReader(bomStream, bomStream.getBOMCharsetName());
        }
        try {
            return new AutoDetectReader(bomStream);
        } catch (TikaException ex) {
            // no detector was confident about the charset
            return new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8);
        }
    }

    private static boolean looksTabSeparated(String body) {
        int newline = body.indexOf('\n');
        String header = newline < 0 ? body : body.substring(0, newline);
        return header.indexOf('\t') >= 0 && header.indexOf(',') < 0;
    }
}
