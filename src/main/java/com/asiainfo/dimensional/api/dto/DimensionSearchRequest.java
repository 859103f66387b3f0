package com.asiainfo.dimensional.api.dto;

import java.util.List;

/**
 * 维度检索请求
 * search_fields 可选 dimension_name / dimension_key / dimension_description，默认 name + description
 */
public record DimensionSearchRequest(
        Filters filters,
        String q,
        List<String> searchFields,
        Double similarity,
        Integer limit,
        Integer offset) {

    public record Filters(
            List<Long> dimensionId,
            List<String> dimensionKey,
            List<String> dimensionName,
            List<String> valueType,
            List<Boolean> isActive) {
    }
}
