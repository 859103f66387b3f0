package com.asiainfo.dimensional.infrastructure.persistence;

import com.asiainfo.dimensional.domain.model.DimensionValueEntry;
import jakarta.enterprise.context.ApplicationScoped;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 维度取值仓库（dimension_value）
 */
@ApplicationScoped
public class DimensionValueRepository {

    /**
     * (维度, 取值) 自然键
     */
    public record ValueKey(long dimensionId, String value) {
    }

    /**
     * 查询某个维度下已存在的取值 id
     */
    public Map<String, Long> findValueIds(Connection conn, long dimensionId, Collection<String> values) throws SQLException {
        Map<String, Long> result = new HashMap<>();
        for (List<String> chunk : SqlSupport.chunks(new HashSet<>(values))) {
            String sql = "SELECT value_id, dim_value FROM dimension_value WHERE dimension_id = ? AND dim_value IN ("
                    + SqlSupport.placeholders(chunk.size()) + ")";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setLong(1, dimensionId);
                for (int i = 0; i < chunk.size(); i++) {
                    stmt.setString(i + 2, chunk.get(i));
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        result.put(rs.getString("dim_value"), rs.getLong("value_id"));
                    }
                }
            }
        }
        return result;
    }

    /**
     * 确保所有取值存在（插入冲突忽略），返回全部 id
     */
    public IdAssignment<ValueKey> ensureValues(Connection conn, Map<Long, Set<String>> valuesByDimension) throws SQLException {
        Map<ValueKey, Long> ids = new HashMap<>();
        int created = 0;
        int matched = 0;
        String insertSql = "INSERT INTO dimension_value (dimension_id, dim_value) VALUES (?, ?) ON CONFLICT DO NOTHING";
        for (Map.Entry<Long, Set<String>> entry : valuesByDimension.entrySet()) {
            long dimensionId = entry.getKey();
            Set<String> values = entry.getValue();
            Map<String, Long> existing = findValueIds(conn, dimensionId, values);
            matched += existing.size();

            List<String> missing = values.stream().filter(v -> !existing.containsKey(v)).sorted().toList();
            if (!missing.isEmpty()) {
                try (PreparedStatement stmt = conn.prepareStatement(insertSql)) {
                    for (String value : missing) {
                        stmt.setLong(1, dimensionId);
                        stmt.setString(2, value);
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                created += missing.size();
                existing.putAll(findValueIds(conn, dimensionId, missing));
            }
            existing.forEach((value, id) -> ids.put(new ValueKey(dimensionId, value), id));
        }
        return new IdAssignment<>(ids, created, matched);
    }

    /**
     * 列出维度的去重取值，可按指标和观测时间范围 [start, end) 限定
     */
    public List<String> listValues(Connection conn, long dimensionId, Long metricId,
                                   Instant start, Instant end, int limit, int offset) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT DISTINCT v.dim_value AS dim_value FROM dimension_value v");
        WhereClause where = scoped(sql, metricId, start, end).eq("v.dimension_id", dimensionId);
        sql.append(where.toSql()).append(" ORDER BY v.dim_value LIMIT ? OFFSET ?");
        List<Object> params = new ArrayList<>(where.params());
        params.add(limit);
        params.add(offset);

        List<String> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            SqlSupport.bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(rs.getString("dim_value"));
                }
            }
        }
        return result;
    }

    /**
     * 取值检索候选集：按维度、指标、时间范围限定后的全部取值，按取值排序
     */
    public List<DimensionValueEntry> searchCandidates(Connection conn, Collection<Long> dimensionIds, Long metricId,
                                                      Instant start, Instant end) throws SQLException {
        StringBuilder sql = new StringBuilder("""
                SELECT DISTINCT d.dimension_key AS dimension_key, v.dimension_id AS dimension_id,
                       v.value_id AS value_id, v.dim_value AS dim_value
                  FROM dimension_value v
                  JOIN dimension_definition d ON d.dimension_id = v.dimension_id""");
        WhereClause where = scoped(sql, metricId, start, end).in("v.dimension_id", dimensionIds);
        sql.append(where.toSql()).append(" ORDER BY v.dim_value, v.value_id");

        List<DimensionValueEntry> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            SqlSupport.bind(stmt, where.params());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(RowMappers.dimensionValue(rs));
                }
            }
        }
        return result;
    }

    // 指标或时间限定时经由 set -> series -> observation 关联
    private WhereClause scoped(StringBuilder sql, Long metricId, Instant start, Instant end) {
        WhereClause where = new WhereClause();
        if (metricId != null || start != null || end != null) {
            sql.append("""

                      JOIN dimension_set_value sv ON sv.value_id = v.value_id
                      JOIN metric_series s ON s.set_id = sv.set_id
                      JOIN metric_observation o ON o.series_id = s.series_id""");
            where.eq("s.metric_id", metricId)
                    .gte("o.time_start_ts", start)
                    .lt("o.time_start_ts", end);
        }
        return where;
    }
}
