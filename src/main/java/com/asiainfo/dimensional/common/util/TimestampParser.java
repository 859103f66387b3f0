package com.asiainfo.dimensional.common.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 时间戳解析
 * <p>
 * 支持：带时区的 ISO-8601（Z 或 ±hh:mm）、本地日期时间（T 或空格分隔，按 UTC 解释）、纯日期（UTC 零点）。
 * 结果截断到微秒，与存储精度一致。
 */
public final class TimestampParser {

    private static final DateTimeFormatter LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter();

    private static final DateTimeFormatter OFFSET_DATE_TIME = new DateTimeFormatterBuilder()
            .append(LOCAL_DATE_TIME)
            .appendOffset("+HH:MM:ss", "Z")
            .toFormatter();

    private TimestampParser() {
    }

    public static Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim();
        return attempt(() -> OffsetDateTime.parse(text, OFFSET_DATE_TIME).toInstant())
                .or(() -> attempt(() -> LocalDateTime.parse(text, LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC)))
                .or(() -> attempt(() -> LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE)
                        .atStartOfDay(ZoneOffset.UTC).toInstant()))
                .map(TimestampParser::truncate);
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MICROS);
    }
}
