package com.asiainfo.dimensional.application.ingest;

import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import com.asiainfo.dimensional.common.util.TextNormalizer;
import com.asiainfo.dimensional.common.util.TimestampParser;
import com.asiainfo.dimensional.domain.model.Aggregation;
import com.asiainfo.dimensional.domain.model.DimensionSetHasher;
import com.asiainfo.dimensional.domain.model.Grain;
import com.asiainfo.dimensional.domain.model.MetricDraft;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static com.asiainfo.dimensional.application.ingest.UploadColumns.*;

/**
 * 上传内容校验与归一化
 * <p>
 * 所有校验在写库之前完成，任何一行失败都会拒绝整个文件。
 *
 * @author QvQ
 * @date 2026/10/14
 */
public final class UploadValidator {

    private static final Set<String> TRUE_TOKENS = Set.of("true", "t", "yes", "y", "1");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "f", "no", "n", "0", "");

    private UploadValidator() {
    }

    public static ValidatedUpload validate(CsvTable table) {
        List<String> dimensionKeys = table.columns().stream()
                .filter(c -> !RESERVED_SET.contains(c))
                .toList();
        for (String key : dimensionKeys) {
            if (key.length() > MAX_DIMENSION_KEY_LENGTH) {
                throw new InvalidRequestException("dimension column name exceeds " + MAX_DIMENSION_KEY_LENGTH
                        + " characters: " + key.substring(0, 32) + "...");
            }
        }

        List<UploadRow> rows = new ArrayList<>();
        Map<String, List<Map<String, String>>> rawByMetric = new LinkedHashMap<>();
        Map<ObservationIdentity, Integer> firstSeen = new HashMap<>();

        for (CsvTable.Row csvRow : table.rows()) {
            Map<String, String> raw = csvRow.cells();
            UploadRow row = parseRow(csvRow.line(), raw, dimensionKeys);
            ObservationIdentity identity = new ObservationIdentity(row.metricKey(), row.grain(),
                    row.setHash(), row.timeStartTs());
            Integer previous = firstSeen.putIfAbsent(identity, row.line());
            if (previous != null) {
                throw new InvalidRequestException("duplicate observation for metric_key=" + row.metricKey()
                        + ", grain=" + row.grain().code() + ", time_start_ts=" + row.timeStartTs()
                        + " (lines " + previous + " and " + row.line() + ")");
            }
            rows.add(row);
            rawByMetric.computeIfAbsent(row.metricKey(), k -> new ArrayList<>()).add(raw);
        }

        List<MetricDraft> metrics = new ArrayList<>();
        rawByMetric.forEach((metricKey, group) -> metrics.add(metricDraft(metricKey, group)));
        return new ValidatedUpload(rows, metrics, dimensionKeys);
    }

    static UploadRow parseRow(int line, Map<String, String> raw, List<String> dimensionKeys) {
        for (String column : REQUIRED_VALUES) {
            if (isBlank(raw.get(column))) {
                throw rowError(line, "missing required value for " + column);
            }
        }
        String metricKey = lower(raw.get(METRIC_KEY));
        if (metricKey.length() > MAX_LENGTH.get(METRIC_KEY)) {
            throw rowError(line, METRIC_KEY + " exceeds " + MAX_LENGTH.get(METRIC_KEY) + " characters");
        }
        Grain grain = Grain.fromCode(raw.get(GRAIN))
                .orElseThrow(() -> rowError(line, "unsupported grain: " + raw.get(GRAIN)));

        Instant start = TimestampParser.parse(raw.get(TIME_START_TS))
                .orElseThrow(() -> rowError(line, "invalid time_start_ts: " + raw.get(TIME_START_TS)));
        Instant end = null;
        if (!isBlank(raw.get(TIME_END_TS))) {
            end = TimestampParser.parse(raw.get(TIME_END_TS))
                    .orElseThrow(() -> rowError(line, "invalid time_end_ts: " + raw.get(TIME_END_TS)));
            if (!end.isAfter(start)) {
                throw rowError(line, "time_end_ts must be after time_start_ts");
            }
        }

        double value = parseValue(line, raw.get(VALUE_NUM));
        Long sampleSize = parseSampleSize(line, raw.get(SAMPLE_SIZE));
        boolean estimated = parseEstimated(line, raw.get(IS_ESTIMATED));

        Map<String, String> dimensions = new TreeMap<>();
        for (String key : dimensionKeys) {
            String cell = TextNormalizer.trimToNull(raw.get(key));
            if (cell != null) {
                if (cell.length() > MAX_DIMENSION_VALUE_LENGTH) {
                    throw rowError(line, "value of dimension " + key + " exceeds "
                            + MAX_DIMENSION_VALUE_LENGTH + " characters");
                }
                dimensions.put(key, cell);
            }
        }
        return new UploadRow(line, metricKey, grain, start, end, value, sampleSize, estimated,
                dimensions, DimensionSetHasher.hash(dimensions));
    }

    static double parseValue(int line, String raw) {
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw rowError(line, "value_num must be a finite number: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw rowError(line, "invalid value_num: " + raw);
        }
    }

    static Long parseSampleSize(int line, String raw) {
        if (isBlank(raw)) {
            return null;
        }
        try {
            BigDecimal number = new BigDecimal(raw.trim());
            long size = number.longValueExact();
            if (size < 0) {
                throw rowError(line, "sample_size must be non-negative: " + raw);
            }
            return size;
        } catch (NumberFormatException | ArithmeticException e) {
            throw rowError(line, "invalid sample_size: " + raw);
        }
    }

    static boolean parseEstimated(int line, String raw) {
        String token = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(token)) {
            return true;
        }
        if (FALSE_TOKENS.contains(token)) {
            return false;
        }
        throw rowError(line, "invalid is_estimated: " + raw);
    }

    /**
     * 同一 metric_key 的目录字段必须一致：必填字段恰好一个取值，可选字段至多一个取值
     */
    static MetricDraft metricDraft(String metricKey, List<Map<String, String>> group) {
        String name = single(group, METRIC_NAME, metricKey, true, false);
        String description = single(group, METRIC_DESCRIPTION, metricKey, false, false);
        String type = single(group, METRIC_TYPE, metricKey, true, true);
        String unit = single(group, UNIT, metricKey, false, false);
        String directionality = single(group, DIRECTIONALITY, metricKey, false, true);
        String aggregationCode = single(group, AGGREGATION, metricKey, true, true);
        Aggregation aggregation = Aggregation.fromCode(aggregationCode)
                .orElseThrow(() -> new InvalidRequestException("unsupported aggregation for metric_key "
                        + metricKey + ": " + aggregationCode + " (use sum, avg, min, max or count)"));
        return new MetricDraft(metricKey, name, description, type, unit, directionality, aggregation);
    }

    private static String single(List<Map<String, String>> group, String column, String metricKey,
                                 boolean required, boolean lowercase) {
        Set<String> values = new LinkedHashSet<>();
        for (Map<String, String> raw : group) {
            String value = TextNormalizer.trimToNull(raw.get(column));
            if (value != null) {
                values.add(lowercase ? value.toLowerCase(Locale.ROOT) : value);
            }
        }
        if (values.size() > 1) {
            throw new InvalidRequestException("conflicting " + column + " values for metric_key "
                    + metricKey + ": " + String.join(", ", values));
        }
        if (values.isEmpty()) {
            if (required) {
                throw new InvalidRequestException("missing " + column + " for metric_key " + metricKey);
            }
            return null;
        }
        String value = values.iterator().next();
        Integer maxLength = MAX_LENGTH.get(column);
        if (maxLength != null && value.length() > maxLength) {
            throw new InvalidRequestException(column + " for metric_key " + metricKey
                    + " exceeds " + maxLength + " characters");
        }
        return value;
    }

    private static InvalidRequestException rowError(int line, String detail) {
        return new InvalidRequestException("line " + line + ": " + detail);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String lower(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private record ObservationIdentity(String metricKey, Grain grain, String setHash, Instant timeStartTs) {
    }
}
