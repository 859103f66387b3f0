package com.asiainfo.dimensional.api.dto;

import java.util.List;

/**
 * Top-K 查询请求，k 默认 10，order 默认 desc
 */
public record TopKQueryRequest(
        String metricKey,
        String grain,
        String startTime,
        String endTime,
        List<String> groupBy,
        List<DimensionFilterRequest> filters,
        Integer k,
        String order) {

    public static final int DEFAULT_K = 10;

    public int effectiveK() {
        return k == null ? DEFAULT_K : k;
    }
}
