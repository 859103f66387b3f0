package com.asiainfo.dimensional.common.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class TimestampParserTest {

    @Test
    void parsesOffsetTimestamps() {
        assertEquals(Optional.of(Instant.parse("2024-01-01T00:00:00Z")), TimestampParser.parse("2024-01-01T00:00:00Z"));
        assertEquals(Optional.of(Instant.parse("2024-01-01T00:00:00Z")), TimestampParser.parse("2024-01-01T08:00:00+08:00"));
    }

    @Test
    void localTimestampsAreUtc() {
        assertEquals(Optional.of(Instant.parse("2024-01-01T10:30:00Z")), TimestampParser.parse("2024-01-01T10:30:00"));
        assertEquals(Optional.of(Instant.parse("2024-01-01T10:30:00Z")), TimestampParser.parse(" 2024-01-01 10:30:00 "));
        assertEquals(Optional.of(Instant.parse("2024-01-01T00:00:00Z")), TimestampParser.parse("2024-01-01"));
    }

    @Test
    void truncatesToMicroseconds() {
        assertEquals(Instant.parse("2024-01-01T00:00:00.123456Z"),
                TimestampParser.parse("2024-01-01T00:00:00.123456789Z").orElseThrow());
    }

    @Test
    void rejectsGarbage() {
        assertTrue(TimestampParser.parse("yesterday").isEmpty());
        assertTrue(TimestampParser.parse("2024-13-01").isEmpty());
        assertTrue(TimestampParser.parse("").isEmpty());
        assertTrue(TimestampParser.parse(null).isEmpty());
    }
}
