package com.asiainfo.dimensional.application.ingest;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 上传文件的保留列，其余列均视为维度
 */
public final class UploadColumns {

    public static final String METRIC_KEY = "metric_key";
    public static final String METRIC_NAME = "metric_name";
    public static final String METRIC_DESCRIPTION = "metric_description";
    public static final String METRIC_TYPE = "metric_type";
    public static final String UNIT = "unit";
    public static final String DIRECTIONALITY = "directionality";
    public static final String AGGREGATION = "aggregation";
    public static final String GRAIN = "grain";
    public static final String TIME_START_TS = "time_start_ts";
    public static final String TIME_END_TS = "time_end_ts";
    public static final String VALUE_NUM = "value_num";
    public static final String SAMPLE_SIZE = "sample_size";
    public static final String IS_ESTIMATED = "is_estimated";

    public static final List<String> RESERVED = List.of(
            METRIC_KEY, METRIC_NAME, METRIC_DESCRIPTION, METRIC_TYPE, UNIT, DIRECTIONALITY,
            AGGREGATION, GRAIN, TIME_START_TS, TIME_END_TS, VALUE_NUM, SAMPLE_SIZE, IS_ESTIMATED);

    /**
     * 每行都必须非空的列
     */
    public static final List<String> REQUIRED_VALUES = List.of(
            METRIC_KEY, METRIC_NAME, METRIC_TYPE, AGGREGATION, GRAIN, TIME_START_TS, VALUE_NUM);

    public static final Set<String> RESERVED_SET = Set.copyOf(RESERVED);

    /**
     * 与 db/schema.sql 中的列宽一致
     */
    public static final Map<String, Integer> MAX_LENGTH = Map.of(
            METRIC_KEY, 128,
            METRIC_NAME, 256,
            METRIC_DESCRIPTION, 2048,
            METRIC_TYPE, 32,
            UNIT, 32,
            DIRECTIONALITY, 16);

    public static final int MAX_DIMENSION_KEY_LENGTH = 128;
    public static final int MAX_DIMENSION_VALUE_LENGTH = 256;

    private UploadColumns() {
    }
}
