package com.asiainfo.dimensional.domain.model;

import com.asiainfo.dimensional.common.exception.InvalidRequestException;

import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return DESC;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "asc" -> ASC;
            case "desc" -> DESC;
            default -> throw new InvalidRequestException("invalid order: " + raw + " (use asc or desc)");
        };
    }
}
