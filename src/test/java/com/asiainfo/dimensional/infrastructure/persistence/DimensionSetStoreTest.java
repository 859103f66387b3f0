package com.asiainfo.dimensional.infrastructure.persistence;

import com.asiainfo.dimensional.domain.model.DimensionPair;
import com.asiainfo.dimensional.support.StoreFixtures;
import io.agroal.api.AgroalDataSource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
public class DimensionSetStoreTest {

    @Inject
    DimensionSetStore dimensionSetStore;

    @Inject
    AgroalDataSource dataSource;

    @Inject
    StoreFixtures fixtures;

    @BeforeEach
    void setUp() throws SQLException {
        fixtures.clean();
    }

    private void execute(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            SqlSupport.bind(stmt, List.of(params));
            stmt.executeUpdate();
        }
    }

    private long selectId(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            SqlSupport.bind(stmt, List.of(params));
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    /**
     * 同一组维度取值的任意排列都解析到同一个 set_id
     */
    @Test
    void permutationsResolveToSameSet() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            execute(conn, "INSERT INTO dimension_definition (dimension_key, dimension_name) VALUES (?, ?)",
                    "region", "Region");
            execute(conn, "INSERT INTO dimension_definition (dimension_key, dimension_name) VALUES (?, ?)",
                    "channel", "Channel");
            long regionId = selectId(conn, "SELECT dimension_id FROM dimension_definition WHERE dimension_key = ?", "region");
            long channelId = selectId(conn, "SELECT dimension_id FROM dimension_definition WHERE dimension_key = ?", "channel");
            execute(conn, "INSERT INTO dimension_value (dimension_id, dim_value) VALUES (?, ?)", regionId, "us");
            execute(conn, "INSERT INTO dimension_value (dimension_id, dim_value) VALUES (?, ?)", channelId, "web");
            long usId = selectId(conn, "SELECT value_id FROM dimension_value WHERE dim_value = ?", "us");
            long webId = selectId(conn, "SELECT value_id FROM dimension_value WHERE dim_value = ?", "web");

            DimensionPair region = new DimensionPair("region", regionId, "us", usId);
            DimensionPair channel = new DimensionPair("channel", channelId, "web", webId);

            long first = dimensionSetStore.resolveOrCreate(conn, List.of(region, channel));
            long second = dimensionSetStore.resolveOrCreate(conn, List.of(channel, region));
            assertEquals(first, second);
            assertEquals(1, fixtures.count("dimension_set"));
            assertEquals(2, fixtures.count("dimension_set_value"));

            long regionOnly = dimensionSetStore.resolveOrCreate(conn, List.of(region));
            assertNotEquals(first, regionOnly);
        }
    }

    @Test
    void sameDimensionTwiceWithDifferentValuesIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DimensionSetStore.hashOf(List.of(
                new DimensionPair("region", 1L, "us", 10L),
                new DimensionPair("region", 1L, "eu", 11L))));
    }
}
