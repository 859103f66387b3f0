package com.asiainfo.dimensional.domain.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * 维度取值（带所属维度 key）
 */
@RegisterForReflection
public record DimensionValueEntry(String dimensionKey, long dimensionId, long valueId, String value) {
}
