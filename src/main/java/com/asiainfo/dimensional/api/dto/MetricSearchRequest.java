package com.asiainfo.dimensional.api.dto;

import java.util.List;

/**
 * 指标检索请求
 * search_fields 可选 metric_name / metric_description / metric_type，默认全部
 */
public record MetricSearchRequest(
        Filters filters,
        String q,
        List<String> searchFields,
        Double similarity,
        Integer limit,
        Integer offset) {

    public record Filters(
            List<Long> metricId,
            List<String> metricKey,
            List<String> metricName,
            List<String> metricType,
            List<String> unit,
            List<String> directionality,
            List<String> aggregation,
            List<Boolean> isActive) {
    }
}
