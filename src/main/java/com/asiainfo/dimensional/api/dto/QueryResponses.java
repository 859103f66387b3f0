package com.asiainfo.dimensional.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 查询接口响应体
 * <p>
 * source_grains / source_grain 为实际读取的存储粒度，可能与请求粒度不同。
 */
public final class QueryResponses {

    private QueryResponses() {
    }

    @RegisterForReflection
    public record Point(Instant timeStartTs, Double value) {
    }

    @RegisterForReflection
    public record Series(String metricKey, Map<String, String> dimensions, List<Point> points) {
    }

    @RegisterForReflection
    public record TimeseriesResponse(List<String> metricKeys, String grain,
                                     Map<String, String> sourceGrains, List<Series> series) {
    }

    @RegisterForReflection
    public record Group(String metricKey, Map<String, String> dimensions, Double value) {
    }

    @RegisterForReflection
    public record AggregateResponse(List<String> metricKeys, String grain,
                                    Map<String, String> sourceGrains, List<Group> groups) {
    }

    @RegisterForReflection
    public record TopKItem(Map<String, String> dimensions, Double value) {
    }

    @RegisterForReflection
    public record TopKResponse(String metricKey, String grain, String sourceGrain, List<TopKItem> items) {
    }

    @RegisterForReflection
    public record LatestResponse(String metricKey, String grain, String sourceGrain,
                                 Instant timeStartTs, Double value) {
    }

    @RegisterForReflection
    public record AvailabilityResponse(String metricKey, String grain, String sourceGrain,
                                       Instant minTimeStartTs, Instant maxTimeStartTs) {
    }

    @RegisterForReflection
    public record FreshnessResponse(String metricKey, String grain, String sourceGrain,
                                    Instant latestTimeStartTs, Instant latestIngestedTs) {
    }
}
