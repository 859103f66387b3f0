package com.asiainfo.dimensional.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * 指标聚合函数
 */
public enum Aggregation {
    SUM("sum"),
    AVG("avg"),
    MIN("min"),
    MAX("max"),
    COUNT("count");

    private final String code;

    Aggregation(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static Optional<Aggregation> fromCode(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Aggregation aggregation : values()) {
            if (aggregation.code.equals(normalized)) {
                return Optional.of(aggregation);
            }
        }
        return Optional.empty();
    }

    /**
     * 查询路径使用：只支持 sum/avg/min/max，count 及无法识别的聚合方式一律按 sum 处理
     */
    public static Aggregation forQuery(String raw) {
        Aggregation aggregation = fromCode(raw).orElse(SUM);
        return aggregation == COUNT ? SUM : aggregation;
    }

    @Override
    public String toString() {
        return code;
    }
}
