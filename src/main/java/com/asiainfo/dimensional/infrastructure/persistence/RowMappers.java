package com.asiainfo.dimensional.infrastructure.persistence;

import com.asiainfo.dimensional.domain.model.DimensionDefinition;
import com.asiainfo.dimensional.domain.model.DimensionValueEntry;
import com.asiainfo.dimensional.domain.model.MetricDefinition;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * ResultSet 行映射
 */
public final class RowMappers {

    private RowMappers() {
    }

    /**
     * 映射ResultSet到MetricDefinition
     */
    public static MetricDefinition metricDefinition(ResultSet rs) throws SQLException {
        return new MetricDefinition(
                rs.getLong("metric_id"),
                rs.getString("metric_key"),
                rs.getString("metric_name"),
                rs.getString("metric_description"),
                rs.getString("metric_type"),
                rs.getString("unit"),
                rs.getString("directionality"),
                rs.getString("aggregation"),
                rs.getBoolean("is_active"),
                instant(rs, "created_ts"),
                instant(rs, "updated_ts")
        );
    }

    /**
     * 映射ResultSet到DimensionDefinition
     */
    public static DimensionDefinition dimensionDefinition(ResultSet rs) throws SQLException {
        return new DimensionDefinition(
                rs.getLong("dimension_id"),
                rs.getString("dimension_key"),
                rs.getString("dimension_name"),
                rs.getString("dimension_description"),
                rs.getString("value_type"),
                rs.getBoolean("is_active"),
                instant(rs, "created_ts"),
                instant(rs, "updated_ts")
        );
    }

    public static DimensionValueEntry dimensionValue(ResultSet rs) throws SQLException {
        return new DimensionValueEntry(
                rs.getString("dimension_key"),
                rs.getLong("dimension_id"),
                rs.getLong("value_id"),
                rs.getString("dim_value")
        );
    }

    public static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    public static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    public static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
