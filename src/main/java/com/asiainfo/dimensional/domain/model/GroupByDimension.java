package com.asiainfo.dimensional.domain.model;

/**
 * 分组维度：输出列标签使用 dimensionKey
 */
public record GroupByDimension(String dimensionKey, long dimensionId) {
}
