package com.asiainfo.dimensional.api.dto;

import java.util.List;

/**
 * 时序 / 聚合查询请求
 * 时间范围为左闭右开 [start_time, end_time)
 */
public record MetricQueryRequest(
        List<String> metricKeys,
        String grain,
        String startTime,
        String endTime,
        List<String> groupBy,
        List<DimensionFilterRequest> filters) {
}
