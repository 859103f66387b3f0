package com.asiainfo.dimensional.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * 统一错误响应：kind 为稳定的机器可读类型，detail 为可读描述
 */
@RegisterForReflection
public record ErrorResponse(String kind, String detail) {
}
