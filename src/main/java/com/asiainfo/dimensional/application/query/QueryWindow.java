package com.asiainfo.dimensional.application.query;

import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import com.asiainfo.dimensional.common.util.TimestampParser;
import com.asiainfo.dimensional.domain.model.Grain;

import java.time.Instant;

/**
 * 已校验的请求粒度与时间范围 [start, end)
 */
public record QueryWindow(Grain grain, Instant start, Instant end) {

    public static QueryWindow of(String grain, String startTime, String endTime) {
        Grain requested = Grain.parse(grain);
        Instant start = parseTime("start_time", startTime);
        Instant end = parseTime("end_time", endTime);
        if (!end.isAfter(start)) {
            throw new InvalidRequestException("end_time must be after start_time");
        }
        return new QueryWindow(requested, start, end);
    }

    private static Instant parseTime(String field, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidRequestException(field + " is required");
        }
        return TimestampParser.parse(raw)
                .orElseThrow(() -> new InvalidRequestException("invalid " + field + ": " + raw));
    }
}
