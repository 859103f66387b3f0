package com.asiainfo.dimensional.infrastructure.persistence;

import com.asiainfo.dimensional.domain.model.DimensionPair;
import com.asiainfo.dimensional.domain.model.DimensionSetHasher;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 维度集合存储（内容寻址）
 * <p>
 * 同一组 (维度, 取值) 无论顺序如何都映射到同一个 set_hash，因此只存一份。
 * 插入依赖 uq_dimension_set_hash 的 ON CONFLICT DO NOTHING，并发写入同一组合时不会重复。
 */
@ApplicationScoped
public class DimensionSetStore {

    private static final Logger log = LoggerFactory.getLogger(DimensionSetStore.class);

    public static String hashOf(Collection<DimensionPair> pairs) {
        Map<String, String> canonical = new TreeMap<>();
        for (DimensionPair pair : pairs) {
            String previous = canonical.put(pair.dimensionKey(), pair.value());
            if (previous != null && !previous.equals(pair.value())) {
                throw new IllegalArgumentException("dimension " + pair.dimensionKey()
                        + " appears twice in one set with different values");
            }
        }
        return DimensionSetHasher.hash(canonical);
    }

    /**
     * 解析或创建单个维度集合，返回 set_id
     */
    public long resolveOrCreate(Connection conn, Collection<DimensionPair> pairs) throws SQLException {
        String hash = hashOf(pairs);
        return resolveAll(conn, Map.of(hash, List.copyOf(pairs))).idOf(hash);
    }

    /**
     * 批量解析或创建维度集合
     *
     * @param setsByHash 已在内存中按 hash 去重的集合
     */
    public IdAssignment<String> resolveAll(Connection conn, Map<String, List<DimensionPair>> setsByHash) throws SQLException {
        Map<String, Long> ids = findByHashes(conn, setsByHash.keySet());
        int matched = ids.size();

        List<String> missing = setsByHash.keySet().stream().filter(h -> !ids.containsKey(h)).sorted().toList();
        if (!missing.isEmpty()) {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT INTO dimension_set (set_hash) VALUES (?) ON CONFLICT DO NOTHING")) {
                for (String hash : missing) {
                    stmt.setString(1, hash);
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            ids.putAll(findByHashes(conn, missing));
        }

        insertMembers(conn, setsByHash, ids);
        log.debug("[DimensionSet] resolved {} sets: created={}, matched={}", setsByHash.size(), missing.size(), matched);
        return new IdAssignment<>(ids, missing.size(), matched);
    }

    private Map<String, Long> findByHashes(Connection conn, Collection<String> hashes) throws SQLException {
        Map<String, Long> result = new HashMap<>();
        for (List<String> chunk : SqlSupport.chunks(hashes)) {
            String sql = "SELECT set_id, set_hash FROM dimension_set WHERE set_hash IN ("
                    + SqlSupport.placeholders(chunk.size()) + ")";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                SqlSupport.bind(stmt, chunk);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        result.put(rs.getString("set_hash"), rs.getLong("set_id"));
                    }
                }
            }
        }
        return result;
    }

    private void insertMembers(Connection conn, Map<String, List<DimensionPair>> setsByHash,
                               Map<String, Long> ids) throws SQLException {
        String sql = "INSERT INTO dimension_set_value (set_id, value_id, dimension_id) VALUES (?, ?, ?) ON CONFLICT DO NOTHING";
        int pending = 0;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (Map.Entry<String, List<DimensionPair>> entry : setsByHash.entrySet()) {
                long setId = ids.get(entry.getKey());
                for (DimensionPair pair : entry.getValue()) {
                    stmt.setLong(1, setId);
                    stmt.setLong(2, pair.valueId());
                    stmt.setLong(3, pair.dimensionId());
                    stmt.addBatch();
                    pending++;
                }
            }
            if (pending > 0) {
                stmt.executeBatch();
            }
        }
    }
}
