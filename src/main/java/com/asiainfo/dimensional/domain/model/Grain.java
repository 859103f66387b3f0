package com.asiainfo.dimensional.domain.model;

import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * 时间粒度，从细到粗全序排列，rank 即声明顺序（0 最细）
 */
public enum Grain {
    MIN_30("30m"),
    HOUR("hour"),
    DAY("day"),
    WEEK("week"),
    BIWEEK("biweek"),
    MONTH("month"),
    QUARTER("quarter");

    private final String code;

    Grain(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public int rank() {
        return ordinal();
    }

    public static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }

    public static Optional<Grain> fromCode(String raw) {
        String normalized = normalize(raw);
        for (Grain grain : values()) {
            if (grain.code.equals(normalized)) {
                return Optional.of(grain);
            }
        }
        return Optional.empty();
    }

    public static boolean isSupported(String raw) {
        return fromCode(raw).isPresent();
    }

    /**
     * 解析请求中的粒度，不支持时抛出 INVALID
     */
    public static Grain parse(String raw) {
        return fromCode(raw).orElseThrow(() -> new InvalidRequestException("unsupported grain: " + raw));
    }

    @Override
    public String toString() {
        return code;
    }
}
