package com.asiainfo.dimensional.domain.model;

/**
 * key 解析后的指标：内部 id + 聚合方式
 */
public record ResolvedMetric(String metricKey, long metricId, Aggregation aggregation) {
}
