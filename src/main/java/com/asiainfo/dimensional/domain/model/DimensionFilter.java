package com.asiainfo.dimensional.domain.model;

import java.util.List;

/**
 * 调用方提交的维度过滤条件，两种形式二选一：
 * <ul>
 *   <li>dimensionKey + values（字符串取值）</li>
 *   <li>dimensionId + valueIds（内部 id）</li>
 * </ul>
 */
public record DimensionFilter(String dimensionKey, List<String> values, Long dimensionId, List<Long> valueIds) {

    public DimensionFilter {
        values = values == null ? List.of() : List.copyOf(values);
        valueIds = valueIds == null ? List.of() : List.copyOf(valueIds);
    }

    public static DimensionFilter byKey(String dimensionKey, List<String> values) {
        return new DimensionFilter(dimensionKey, values, null, null);
    }

    public static DimensionFilter byId(long dimensionId, List<Long> valueIds) {
        return new DimensionFilter(null, null, dimensionId, valueIds);
    }

    public boolean isKeyForm() {
        return dimensionKey != null && !dimensionKey.isBlank();
    }
}
