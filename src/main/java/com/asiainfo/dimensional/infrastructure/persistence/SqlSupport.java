package com.asiainfo.dimensional.infrastructure.persistence;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * JDBC 参数绑定与分批工具
 */
public final class SqlSupport {

    /**
     * IN 列表单批最大参数数
     */
    public static final int IN_CHUNK_SIZE = 500;

    private SqlSupport() {
    }

    public static void bind(PreparedStatement stmt, List<?> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            bindOne(stmt, i + 1, params.get(i));
        }
    }

    public static void bindOne(PreparedStatement stmt, int index, Object value) throws SQLException {
        if (value instanceof Instant instant) {
            stmt.setObject(index, instant.atOffset(ZoneOffset.UTC));
        } else if (value instanceof OffsetDateTime time) {
            stmt.setObject(index, time.withOffsetSameInstant(ZoneOffset.UTC));
        } else if (value instanceof Long l) {
            stmt.setLong(index, l);
        } else if (value instanceof Integer n) {
            stmt.setInt(index, n);
        } else if (value instanceof Double d) {
            stmt.setDouble(index, d);
        } else if (value instanceof Boolean b) {
            stmt.setBoolean(index, b);
        } else if (value == null) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, value.toString());
        }
    }

    public static void setNullableLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.BIGINT);
        } else {
            stmt.setLong(index, value);
        }
    }

    public static void setNullableTimestamp(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            stmt.setObject(index, value.atOffset(ZoneOffset.UTC));
        }
    }

    public static void setNullableString(PreparedStatement stmt, int index, String value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, value);
        }
    }

    public static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    public static <T> List<List<T>> chunks(Collection<T> values) {
        List<T> all = new ArrayList<>(values);
        List<List<T>> chunks = new ArrayList<>();
        for (int from = 0; from < all.size(); from += IN_CHUNK_SIZE) {
            chunks.add(all.subList(from, Math.min(all.size(), from + IN_CHUNK_SIZE)));
        }
        return chunks;
    }
}
