package com.asiainfo.dimensional.application.ingest;

import com.asiainfo.dimensional.domain.model.Grain;

import java.time.Instant;
import java.util.Map;

/**
 * 校验通过的一行观测
 *
 * @param line       CSV 记录行号（表头为第 1 行）
 * @param dimensions 非空维度取值，按维度 key 排序
 * @param setHash    维度集合哈希
 */
public record UploadRow(
        int line,
        String metricKey,
        Grain grain,
        Instant timeStartTs,
        Instant timeEndTs,
        double valueNum,
        Long sampleSize,
        boolean isEstimated,
        Map<String, String> dimensions,
        String setHash) {
}
