package com.asiainfo.dimensional.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

@RegisterForReflection
public record DimensionValueItem(String dimensionKey, long valueId, String value) {
}
