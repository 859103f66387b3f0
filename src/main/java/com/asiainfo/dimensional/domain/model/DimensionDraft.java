package com.asiainfo.dimensional.domain.model;

public record DimensionDraft(String dimensionKey, String dimensionName) {
}
