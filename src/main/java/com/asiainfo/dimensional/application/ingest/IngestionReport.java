package com.asiainfo.dimensional.application.ingest;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * 入库结果：各类实体新建 / 命中数量
 */
@RegisterForReflection
public record IngestionReport(
        int rows,
        int metricsCreated,
        int metricsMatched,
        int dimensionsCreated,
        int dimensionsMatched,
        int dimensionValuesCreated,
        int dimensionValuesMatched,
        int dimensionSetsCreated,
        int dimensionSetsMatched,
        int seriesCreated,
        int seriesMatched,
        int observationsInserted,
        int observationsSkipped) {
}
