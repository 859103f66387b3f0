package com.asiainfo.dimensional.domain.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.Instant;

/**
 * 维度定义（dimension_definition）
 */
@RegisterForReflection
public record DimensionDefinition(
        long dimensionId,
        String dimensionKey,
        String dimensionName,
        String dimensionDescription,
        String valueType,
        boolean isActive,
        Instant createdTs,
        Instant updatedTs) {
}
