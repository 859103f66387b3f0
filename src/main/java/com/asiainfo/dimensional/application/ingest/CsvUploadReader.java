package com.asiainfo.dimensional.application.ingest;

import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * CSV 上传解析（jackson-dataformat-csv）
 * <p>
 * 第一行为表头；列名 trim + 小写后不得重复，且必须包含全部保留列。
 * 行号按 CSV 记录计（表头为第 1 行），报错与校验阶段共用同一行号。
 */
public final class CsvUploadReader {

    private static final CsvMapper MAPPER = new CsvMapper();

    private CsvUploadReader() {
    }

    public static CsvTable read(byte[] content) {
        List<String[]> records = parse(content);
        if (records.isEmpty()) {
            throw new InvalidRequestException("uploaded file is empty");
        }
        List<String> columns = normalizeHeader(records.get(0));

        List<CsvTable.Row> rows = new ArrayList<>();
        for (int i = 1; i < records.size(); i++) {
            String[] cells = records.get(i);
            int line = i + 1;
            if (isBlankRecord(cells)) {
                continue;
            }
            if (cells.length > columns.size()) {
                throw new InvalidRequestException("line " + line + ": has " + cells.length
                        + " columns, expected " + columns.size());
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                row.put(columns.get(c), c < cells.length ? cells[c] : "");
            }
            rows.add(new CsvTable.Row(line, row));
        }
        if (rows.isEmpty()) {
            throw new InvalidRequestException("uploaded file contains no data rows");
        }
        return new CsvTable(columns, rows);
    }

    static List<String> normalizeHeader(String[] header) {
        List<String> columns = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String raw : header) {
            String column = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
            if (column.isEmpty()) {
                throw new InvalidRequestException("CSV header contains an empty column name");
            }
            if (!seen.add(column)) {
                duplicates.add(column);
            }
            columns.add(column);
        }
        if (!duplicates.isEmpty()) {
            throw new InvalidRequestException("duplicate columns after normalization: " + String.join(", ", duplicates));
        }
        List<String> missing = UploadColumns.RESERVED.stream().filter(c -> !seen.contains(c)).toList();
        if (!missing.isEmpty()) {
            throw new InvalidRequestException("missing required columns: " + String.join(", ", missing));
        }
        return columns;
    }

    private static List<String[]> parse(byte[] content) {
        String text = new String(content, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        try (MappingIterator<String[]> it = MAPPER.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(text)) {
            return it.readAll();
        } catch (IOException | RuntimeException e) {
            throw new InvalidRequestException("unable to parse CSV: " + e.getMessage());
        }
    }

    private static boolean isBlankRecord(String[] cells) {
        for (String cell : cells) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
