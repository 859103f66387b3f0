package com.asiainfo.dimensional.domain.model;

/**
 * 维度集合中的一个 (维度, 取值) 对
 */
public record DimensionPair(String dimensionKey, long dimensionId, String value, long valueId) {
}
