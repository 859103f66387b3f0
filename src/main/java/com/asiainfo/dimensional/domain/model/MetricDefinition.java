package com.asiainfo.dimensional.domain.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.Instant;

/**
 * 指标定义（metric_definition）
 */
@RegisterForReflection
public record MetricDefinition(
        long metricId,
        String metricKey,
        String metricName,
        String metricDescription,
        String metricType,
        String unit,
        String directionality,
        String aggregation,
        boolean isActive,
        Instant createdTs,
        Instant updatedTs) {
}
