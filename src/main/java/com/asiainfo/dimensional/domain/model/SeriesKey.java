package com.asiainfo.dimensional.domain.model;

/**
 * 序列的自然键 (metric, grain, dimension set)
 */
public record SeriesKey(long metricId, Grain grain, long setId) {
}
