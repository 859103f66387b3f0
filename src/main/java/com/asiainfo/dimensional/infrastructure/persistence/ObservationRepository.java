package com.asiainfo.dimensional.infrastructure.persistence;

import com.asiainfo.dimensional.domain.model.ObservationDraft;
import com.asiainfo.dimensional.domain.model.ObservationDraft.ObservationKey;
import jakarta.enterprise.context.ApplicationScoped;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 观测值仓库（metric_observation），只插入不更新
 */
@ApplicationScoped
public class ObservationRepository {

    private static final int BATCH_SIZE = 1000;

    /**
     * 找出已存在的 (series, time_start_ts)
     */
    public Set<ObservationKey> findExisting(Connection conn, Collection<ObservationKey> keys) throws SQLException {
        Set<ObservationKey> result = new HashSet<>();
        if (keys.isEmpty()) {
            return result;
        }
        Instant from = keys.stream().map(ObservationKey::timeStartTs).min(Comparator.naturalOrder()).orElseThrow();
        Instant to = keys.stream().map(ObservationKey::timeStartTs).max(Comparator.naturalOrder()).orElseThrow();
        Set<Long> seriesIds = new HashSet<>();
        keys.forEach(k -> seriesIds.add(k.seriesId()));
        Set<ObservationKey> wanted = new HashSet<>(keys);

        for (List<Long> chunk : SqlSupport.chunks(seriesIds)) {
            String sql = "SELECT series_id, time_start_ts FROM metric_observation WHERE series_id IN ("
                    + SqlSupport.placeholders(chunk.size()) + ") AND time_start_ts >= ? AND time_start_ts <= ?";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                int index = 1;
                for (Long seriesId : chunk) {
                    stmt.setLong(index++, seriesId);
                }
                SqlSupport.bindOne(stmt, index++, from);
                SqlSupport.bindOne(stmt, index, to);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        ObservationKey key = new ObservationKey(rs.getLong("series_id"),
                                RowMappers.instant(rs, "time_start_ts"));
                        if (wanted.contains(key)) {
                            result.add(key);
                        }
                    }
                }
            }
        }
        return result;
    }

    /**
     * 批量插入，唯一约束冲突的行被忽略
     */
    public void insertAll(Connection conn, List<ObservationDraft> observations) throws SQLException {
        String sql = """
                INSERT INTO metric_observation
                    (series_id, time_start_ts, time_end_ts, value_num, sample_size, is_estimated)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT DO NOTHING
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            int pending = 0;
            for (ObservationDraft obs : observations) {
                stmt.setLong(1, obs.seriesId());
                SqlSupport.setNullableTimestamp(stmt, 2, obs.timeStartTs());
                SqlSupport.setNullableTimestamp(stmt, 3, obs.timeEndTs());
                stmt.setDouble(4, obs.valueNum());
                SqlSupport.setNullableLong(stmt, 5, obs.sampleSize());
                stmt.setBoolean(6, obs.isEstimated());
                stmt.addBatch();
                if (++pending == BATCH_SIZE) {
                    stmt.executeBatch();
                    pending = 0;
                }
            }
            if (pending > 0) {
                stmt.executeBatch();
            }
        }
    }
}
