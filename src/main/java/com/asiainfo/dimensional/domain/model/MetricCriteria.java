package com.asiainfo.dimensional.domain.model;

import java.util.List;

/**
 * 指标目录过滤条件，各字段内部为 IN（OR），字段之间为 AND；空列表表示不过滤
 */
public record MetricCriteria(
        List<Long> metricIds,
        List<String> metricKeys,
        List<String> metricNames,
        List<String> metricTypes,
        List<String> units,
        List<String> directionalities,
        List<String> aggregations,
        List<Boolean> isActive) {

    public MetricCriteria {
        metricIds = metricIds == null ? List.of() : List.copyOf(metricIds);
        metricKeys = metricKeys == null ? List.of() : List.copyOf(metricKeys);
        metricNames = metricNames == null ? List.of() : List.copyOf(metricNames);
        metricTypes = metricTypes == null ? List.of() : List.copyOf(metricTypes);
        units = units == null ? List.of() : List.copyOf(units);
        directionalities = directionalities == null ? List.of() : List.copyOf(directionalities);
        aggregations = aggregations == null ? List.of() : List.copyOf(aggregations);
        isActive = isActive == null ? List.of() : List.copyOf(isActive);
    }

    public static MetricCriteria none() {
        return new MetricCriteria(null, null, null, null, null, null, null, null);
    }
}
