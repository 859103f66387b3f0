package com.asiainfo.dimensional.application.catalog;

import com.asiainfo.dimensional.common.exception.InvalidRequestException;

import java.util.List;

/**
 * 分页参数：limit 1..5000（默认 500），offset >= 0（默认 0）
 */
public record Paging(int limit, int offset) {

    public static final int DEFAULT_LIMIT = 500;
    public static final int MAX_LIMIT = 5000;

    public static Paging of(Integer limit, Integer offset) {
        int l = limit == null ? DEFAULT_LIMIT : limit;
        int o = offset == null ? 0 : offset;
        if (l < 1 || l > MAX_LIMIT) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (o < 0) {
            throw new InvalidRequestException("offset must be non-negative");
        }
        return new Paging(l, o);
    }

    public <T> List<T> slice(List<T> items) {
        if (offset >= items.size()) {
            return List.of();
        }
        return items.subList(offset, Math.min(items.size(), offset + limit));
    }
}
