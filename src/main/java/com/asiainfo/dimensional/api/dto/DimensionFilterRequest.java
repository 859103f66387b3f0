package com.asiainfo.dimensional.api.dto;

import com.asiainfo.dimensional.domain.model.DimensionFilter;

import java.util.List;

/**
 * 请求中的维度过滤：{dimension_key, values} 或 {dimension_id, value_ids}
 */
public record DimensionFilterRequest(String dimensionKey, List<String> values, Long dimensionId, List<Long> valueIds) {

    public DimensionFilter toDomain() {
        return new DimensionFilter(dimensionKey, values, dimensionId, valueIds);
    }

    public static List<DimensionFilter> toDomain(List<DimensionFilterRequest> filters) {
        return filters == null ? List.of() : filters.stream().map(DimensionFilterRequest::toDomain).toList();
    }
}
