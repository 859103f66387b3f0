package com.asiainfo.dimensional.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

@RegisterForReflection
public record PageResponse<T>(List<T> items, int limit, int offset) {
}
