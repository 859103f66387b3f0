package com.asiainfo.dimensional.infrastructure.persistence;

import com.asiainfo.dimensional.domain.model.DimensionCriteria;
import com.asiainfo.dimensional.domain.model.DimensionDefinition;
import com.asiainfo.dimensional.domain.model.DimensionDraft;
import com.asiainfo.dimensional.domain.model.MetricCriteria;
import com.asiainfo.dimensional.domain.model.MetricDefinition;
import com.asiainfo.dimensional.domain.model.MetricDraft;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 指标 / 维度目录仓库
 * 负责 metric_definition、dimension_definition 的查询与按自然键 upsert
 *
 * @author QvQ
 * @date 2026/10/12
 */
@ApplicationScoped
public class CatalogRepository {

    private static final Logger log = LoggerFactory.getLogger(CatalogRepository.class);

    /**
     * 批量按 metric_key 查询指标定义
     */
    public Map<String, MetricDefinition> findMetricsByKeys(Connection conn, Collection<String> keys) throws SQLException {
        Map<String, MetricDefinition> result = new HashMap<>();
        for (List<String> chunk : SqlSupport.chunks(keys)) {
            String sql = "SELECT * FROM metric_definition WHERE metric_key IN ("
                    + SqlSupport.placeholders(chunk.size()) + ")";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                SqlSupport.bind(stmt, chunk);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        MetricDefinition def = RowMappers.metricDefinition(rs);
                        result.put(def.metricKey(), def);
                    }
                }
            }
        }
        return result;
    }

    /**
     * 批量按 dimension_key 查询维度定义
     */
    public Map<String, DimensionDefinition> findDimensionsByKeys(Connection conn, Collection<String> keys) throws SQLException {
        Map<String, DimensionDefinition> result = new HashMap<>();
        for (List<String> chunk : SqlSupport.chunks(keys)) {
            String sql = "SELECT * FROM dimension_definition WHERE dimension_key IN ("
                    + SqlSupport.placeholders(chunk.size()) + ")";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                SqlSupport.bind(stmt, chunk);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        DimensionDefinition def = RowMappers.dimensionDefinition(rs);
                        result.put(def.dimensionKey(), def);
                    }
                }
            }
        }
        return result;
    }

    public Optional<MetricDefinition> findMetric(Connection conn, String metricKey) throws SQLException {
        return Optional.ofNullable(findMetricsByKeys(conn, List.of(metricKey)).get(metricKey));
    }

    public Optional<DimensionDefinition> findDimension(Connection conn, String dimensionKey) throws SQLException {
        return Optional.ofNullable(findDimensionsByKeys(conn, List.of(dimensionKey)).get(dimensionKey));
    }

    /**
     * 按条件列出指标，按 metric_key 排序；limit 为 null 时不分页
     */
    public List<MetricDefinition> listMetrics(Connection conn, MetricCriteria criteria,
                                              Integer limit, Integer offset) throws SQLException {
        WhereClause where = new WhereClause()
                .in("metric_id", criteria.metricIds())
                .in("metric_key", criteria.metricKeys())
                .in("metric_name", criteria.metricNames())
                .in("metric_type", criteria.metricTypes())
                .in("unit", criteria.units())
                .in("directionality", criteria.directionalities())
                .in("aggregation", criteria.aggregations())
                .in("is_active", criteria.isActive());
        String sql = "SELECT * FROM metric_definition" + where.toSql() + " ORDER BY metric_key"
                + pagination(where.params(), limit, offset);
        List<MetricDefinition> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            SqlSupport.bind(stmt, where.params());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(RowMappers.metricDefinition(rs));
                }
            }
        }
        return result;
    }

    /**
     * 按条件列出维度，按 dimension_key 排序；limit 为 null 时不分页
     */
    public List<DimensionDefinition> listDimensions(Connection conn, DimensionCriteria criteria,
                                                    Integer limit, Integer offset) throws SQLException {
        WhereClause where = new WhereClause()
                .in("dimension_id", criteria.dimensionIds())
                .in("dimension_key", criteria.dimensionKeys())
                .in("dimension_name", criteria.dimensionNames())
                .in("value_type", criteria.valueTypes())
                .in("is_active", criteria.isActive());
        String sql = "SELECT * FROM dimension_definition" + where.toSql() + " ORDER BY dimension_key"
                + pagination(where.params(), limit, offset);
        List<DimensionDefinition> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            SqlSupport.bind(stmt, where.params());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(RowMappers.dimensionDefinition(rs));
                }
            }
        }
        return result;
    }

    /**
     * 指标定义 upsert：已存在的按 key 更新，新 key 插入（冲突忽略）
     * 可选字段为空时保留原值
     */
    public IdAssignment<String> upsertMetrics(Connection conn, Collection<MetricDraft> drafts) throws SQLException {
        Map<String, MetricDraft> byKey = new LinkedHashMap<>();
        drafts.forEach(d -> byKey.put(d.metricKey(), d));
        Map<String, MetricDefinition> existing = findMetricsByKeys(conn, byKey.keySet());

        String updateSql = """
                UPDATE metric_definition
                   SET metric_name = ?,
                       metric_description = COALESCE(?, metric_description),
                       metric_type = ?,
                       unit = COALESCE(?, unit),
                       directionality = COALESCE(?, directionality),
                       aggregation = ?,
                       updated_ts = CURRENT_TIMESTAMP
                 WHERE metric_key = ?
                """;
        String insertSql = """
                INSERT INTO metric_definition
                    (metric_key, metric_name, metric_description, metric_type, unit, directionality, aggregation)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT DO NOTHING
                """;
        int created = 0;
        try (PreparedStatement update = conn.prepareStatement(updateSql);
             PreparedStatement insert = conn.prepareStatement(insertSql)) {
            for (MetricDraft draft : byKey.values()) {
                if (existing.containsKey(draft.metricKey())) {
                    update.setString(1, draft.metricName());
                    SqlSupport.setNullableString(update, 2, draft.metricDescription());
                    update.setString(3, draft.metricType());
                    SqlSupport.setNullableString(update, 4, draft.unit());
                    SqlSupport.setNullableString(update, 5, draft.directionality());
                    update.setString(6, draft.aggregation().code());
                    update.setString(7, draft.metricKey());
                    update.addBatch();
                } else {
                    insert.setString(1, draft.metricKey());
                    insert.setString(2, draft.metricName());
                    SqlSupport.setNullableString(insert, 3, draft.metricDescription());
                    insert.setString(4, draft.metricType());
                    SqlSupport.setNullableString(insert, 5, draft.unit());
                    SqlSupport.setNullableString(insert, 6, draft.directionality());
                    insert.setString(7, draft.aggregation().code());
                    insert.addBatch();
                    created++;
                }
            }
            if (!existing.isEmpty()) {
                update.executeBatch();
            }
            if (created > 0) {
                insert.executeBatch();
            }
        }

        Map<String, Long> ids = new HashMap<>();
        findMetricsByKeys(conn, byKey.keySet()).forEach((key, def) -> ids.put(key, def.metricId()));
        log.debug("[Catalog] metrics upserted: created={}, matched={}", created, existing.size());
        return new IdAssignment<>(ids, created, existing.size());
    }

    /**
     * 维度定义 upsert：已存在的刷新展示名，新 key 插入（冲突忽略）
     */
    public IdAssignment<String> upsertDimensions(Connection conn, Collection<DimensionDraft> drafts) throws SQLException {
        Map<String, DimensionDraft> byKey = new LinkedHashMap<>();
        drafts.forEach(d -> byKey.put(d.dimensionKey(), d));
        if (byKey.isEmpty()) {
            return new IdAssignment<>(Map.of(), 0, 0);
        }
        Map<String, DimensionDefinition> existing = findDimensionsByKeys(conn, byKey.keySet());

        String updateSql = """
                UPDATE dimension_definition
                   SET dimension_name = ?, updated_ts = CURRENT_TIMESTAMP
                 WHERE dimension_key = ?
                """;
        String insertSql = """
                INSERT INTO dimension_definition (dimension_key, dimension_name)
                VALUES (?, ?)
                ON CONFLICT DO NOTHING
                """;
        int created = 0;
        try (PreparedStatement update = conn.prepareStatement(updateSql);
             PreparedStatement insert = conn.prepareStatement(insertSql)) {
            for (DimensionDraft draft : byKey.values()) {
                PreparedStatement target = existing.containsKey(draft.dimensionKey()) ? update : insert;
                if (target == update) {
                    update.setString(1, draft.dimensionName());
                    update.setString(2, draft.dimensionKey());
                } else {
                    insert.setString(1, draft.dimensionKey());
                    insert.setString(2, draft.dimensionName());
                    created++;
                }
                target.addBatch();
            }
            if (!existing.isEmpty()) {
                update.executeBatch();
            }
            if (created > 0) {
                insert.executeBatch();
            }
        }

        Map<String, Long> ids = new HashMap<>();
        findDimensionsByKeys(conn, byKey.keySet()).forEach((key, def) -> ids.put(key, def.dimensionId()));
        log.debug("[Catalog] dimensions upserted: created={}, matched={}", created, existing.size());
        return new IdAssignment<>(ids, created, existing.size());
    }

    static String pagination(List<Object> params, Integer limit, Integer offset) {
        if (limit == null) {
            return "";
        }
        params.add(limit);
        params.add(offset == null ? 0 : offset);
        return " LIMIT ? OFFSET ?";
    }
}
