package com.asiainfo.dimensional.infrastructure.persistence;

import com.asiainfo.dimensional.domain.model.Grain;
import com.asiainfo.dimensional.domain.model.SeriesKey;
import jakarta.enterprise.context.ApplicationScoped;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 指标序列仓库（metric_series）
 */
@ApplicationScoped
public class SeriesRepository {

    /**
     * 每个指标实际存储了哪些粒度
     */
    public Map<Long, Set<Grain>> findGrainsByMetric(Connection conn, Collection<Long> metricIds) throws SQLException {
        Map<Long, Set<Grain>> result = new HashMap<>();
        for (List<Long> chunk : SqlSupport.chunks(new HashSet<>(metricIds))) {
            String sql = "SELECT DISTINCT metric_id, grain FROM metric_series WHERE metric_id IN ("
                    + SqlSupport.placeholders(chunk.size()) + ")";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                SqlSupport.bind(stmt, chunk);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        long metricId = rs.getLong("metric_id");
                        Grain.fromCode(rs.getString("grain")).ifPresent(grain ->
                                result.computeIfAbsent(metricId, k -> EnumSet.noneOf(Grain.class)).add(grain));
                    }
                }
            }
        }
        return result;
    }

    /**
     * 确保所有 (metric, grain, set) 序列存在，返回 series_id
     */
    public IdAssignment<SeriesKey> ensureSeries(Connection conn, Collection<SeriesKey> keys) throws SQLException {
        Set<SeriesKey> wanted = new HashSet<>(keys);
        Map<SeriesKey, Long> ids = findExisting(conn, wanted);
        int matched = ids.size();

        List<SeriesKey> missing = wanted.stream().filter(k -> !ids.containsKey(k)).toList();
        if (!missing.isEmpty()) {
            String sql = "INSERT INTO metric_series (metric_id, grain, set_id) VALUES (?, ?, ?) ON CONFLICT DO NOTHING";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (SeriesKey key : missing) {
                    stmt.setLong(1, key.metricId());
                    stmt.setString(2, key.grain().code());
                    stmt.setLong(3, key.setId());
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            ids.putAll(findExisting(conn, new HashSet<>(missing)));
        }
        return new IdAssignment<>(ids, missing.size(), matched);
    }

    private Map<SeriesKey, Long> findExisting(Connection conn, Set<SeriesKey> keys) throws SQLException {
        Map<SeriesKey, Long> result = new HashMap<>();
        Set<Long> metricIds = new HashSet<>();
        keys.forEach(k -> metricIds.add(k.metricId()));
        for (List<Long> chunk : SqlSupport.chunks(metricIds)) {
            String sql = "SELECT series_id, metric_id, grain, set_id FROM metric_series WHERE metric_id IN ("
                    + SqlSupport.placeholders(chunk.size()) + ")";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                SqlSupport.bind(stmt, chunk);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        Grain grain = Grain.fromCode(rs.getString("grain")).orElse(null);
                        if (grain == null) {
                            continue;
                        }
                        SeriesKey key = new SeriesKey(rs.getLong("metric_id"), grain, rs.getLong("set_id"));
                        if (keys.contains(key)) {
                            result.put(key, rs.getLong("series_id"));
                        }
                    }
                }
            }
        }
        return result;
    }
}
