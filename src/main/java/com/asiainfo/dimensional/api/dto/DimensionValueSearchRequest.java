package com.asiainfo.dimensional.api.dto;

import java.util.List;

/**
 * 维度取值检索请求，可按维度、指标、观测时间范围限定
 */
public record DimensionValueSearchRequest(
        Filters filters,
        String q,
        Double similarity,
        Integer limit,
        Integer offset) {

    public record Filters(List<String> dimensionKey, String metricKey, String startTime, String endTime) {
    }
}
