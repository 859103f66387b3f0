package com.asiainfo.dimensional.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

@RegisterForReflection
public record DimensionValuesResponse(String dimensionKey, List<String> items, int limit, int offset) {
}
