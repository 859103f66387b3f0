package com.asiainfo.dimensional.domain.model;

/**
 * 上传文件中归并出的一条指标定义，按 metric_key 插入或更新
 */
public record MetricDraft(
        String metricKey,
        String metricName,
        String metricDescription,
        String metricType,
        String unit,
        String directionality,
        Aggregation aggregation) {
}
