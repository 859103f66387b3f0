package com.asiainfo.dimensional.application.query;

import com.asiainfo.dimensional.api.dto.MetricQueryRequest;
import com.asiainfo.dimensional.api.dto.QueryResponses.AggregateResponse;
import com.asiainfo.dimensional.application.ingest.MetricIngestionService;
import com.asiainfo.dimensional.support.StoreFixtures;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 单行上传后按国家分组聚合，结果恰好一组
 */
@QuarkusTest
public class SingleRowRoundTripTest {

    @Inject
    MetricIngestionService ingestionService;

    @Inject
    MetricQueryService queryService;

    @Inject
    StoreFixtures fixtures;

    @BeforeEach
    void setUp() throws SQLException {
        fixtures.clean();
    }

    @Test
    void oneRowInOneGroupOut() {
        ingestionService.upload("signups.csv", StoreFixtures.csv("country",
                "signups,Signups,,count,,,sum,day,2025-01-01T00:00:00Z,,5,,,US"));

        AggregateResponse response = queryService.aggregate(new MetricQueryRequest(List.of("signups"), "day",
                "2025-01-01T00:00:00Z", "2025-01-02T00:00:00Z", List.of("country"), null));

        assertEquals(1, response.groups().size());
        assertEquals("signups", response.groups().get(0).metricKey());
        assertEquals(Map.of("country", "US"), response.groups().get(0).dimensions());
        assertEquals(5.0, response.groups().get(0).value());
    }
}
