package com.asiainfo.dimensional.infrastructure.cache;

import com.asiainfo.dimensional.api.dto.MetricQueryRequest;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
public class QueryResultCacheTest {

    @Inject
    QueryResultCache queryResultCache;

    @Test
    void keysIncludeDataVersion() {
        MetricQueryRequest request = new MetricQueryRequest(List.of("signups"), "day",
                "2024-01-01", "2024-01-15", null, null);
        QueryCacheKey before = queryResultCache.keyFor("aggregate", request);
        long version = queryResultCache.bumpVersion();
        QueryCacheKey after = queryResultCache.keyFor("aggregate", request);

        assertEquals(version, after.dataVersion());
        assertTrue(after.dataVersion() > before.dataVersion());
        assertNotEquals(before.toKey(), after.toKey());
    }

    @Test
    void equalRequestsShareAKey() {
        MetricQueryRequest first = new MetricQueryRequest(List.of("signups"), "day", "2024-01-01", "2024-01-15",
                List.of("region"), null);
        MetricQueryRequest second = new MetricQueryRequest(List.of("signups"), "day", "2024-01-01", "2024-01-15",
                List.of("region"), null);
        assertEquals(queryResultCache.keyFor("timeseries", first).toKey(),
                queryResultCache.keyFor("timeseries", second).toKey());
        assertNotEquals(queryResultCache.keyFor("timeseries", first).toKey(),
                queryResultCache.keyFor("aggregate", first).toKey());
    }

    @Test
    void loaderResultIsReturned() {
        QueryCacheKey key = queryResultCache.keyFor("topk", "request");
        assertEquals("computed", queryResultCache.getOrCompute(key, () -> "computed"));
    }
}
