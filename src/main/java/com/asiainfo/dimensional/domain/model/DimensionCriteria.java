package com.asiainfo.dimensional.domain.model;

import java.util.List;

/**
 * 维度目录过滤条件
 */
public record DimensionCriteria(
        List<Long> dimensionIds,
        List<String> dimensionKeys,
        List<String> dimensionNames,
        List<String> valueTypes,
        List<Boolean> isActive) {

    public DimensionCriteria {
        dimensionIds = dimensionIds == null ? List.of() : List.copyOf(dimensionIds);
        dimensionKeys = dimensionKeys == null ? List.of() : List.copyOf(dimensionKeys);
        dimensionNames = dimensionNames == null ? List.of() : List.copyOf(dimensionNames);
        valueTypes = valueTypes == null ? List.of() : List.copyOf(valueTypes);
        isActive = isActive == null ? List.of() : List.copyOf(isActive);
    }

    public static DimensionCriteria none() {
        return new DimensionCriteria(null, null, null, null, null);
    }
}
