package com.asiainfo.dimensional.domain.model;

import java.time.Instant;

/**
 * 待写入的一条观测值
 */
public record ObservationDraft(
        long seriesId,
        Instant timeStartTs,
        Instant timeEndTs,
        double valueNum,
        Long sampleSize,
        boolean isEstimated) {

    public ObservationKey key() {
        return new ObservationKey(seriesId, timeStartTs);
    }

    public record ObservationKey(long seriesId, Instant timeStartTs) {
    }
}
