package com.asiainfo.dimensional.domain.model;

import java.time.Instant;

/**
 * 观测时间覆盖范围，无数据时两端均为 null
 */
public record TimeSpan(Instant min, Instant max) {

    public static TimeSpan empty() {
        return new TimeSpan(null, null);
    }
}
