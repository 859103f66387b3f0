package com.asiainfo.dimensional.domain.query;

import com.asiainfo.dimensional.domain.model.Aggregation;
import com.asiainfo.dimensional.domain.model.Grain;
import com.asiainfo.dimensional.domain.model.GroupByDimension;
import com.asiainfo.dimensional.domain.model.ResolvedFilter;
import com.asiainfo.dimensional.domain.model.SortOrder;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class QueryComposerTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-02-01T00:00:00Z");

    private static int occurrences(String text, String token) {
        int count = 0;
        for (int i = text.indexOf(token); i >= 0; i = text.indexOf(token, i + token.length())) {
            count++;
        }
        return count;
    }

    @Test
    void oneJoinPerFilterDimensionAndTwoPerGroupBy() {
        QuerySpec spec = QuerySpec.aggregate(Aggregation.SUM, List.of(7L), Grain.DAY, START, END,
                List.of(new ResolvedFilter(10L, Set.of(101L, 100L)), new ResolvedFilter(11L, Set.of(200L))),
                List.of(new GroupByDimension("region", 10L)));
        ComposedQuery query = QueryComposer.compose(spec);

        assertEquals(3, occurrences(query.sql(), "JOIN dimension_set_value"));
        assertEquals(1, occurrences(query.sql(), "JOIN dimension_value"));
        assertTrue(query.sql().contains("SUM(o.value_num) AS agg_value"));
        assertTrue(query.sql().contains("gv0.dim_value AS group_0"));
        assertTrue(query.sql().contains("GROUP BY s.metric_id, gv0.dim_value"));
        assertFalse(query.sql().contains("ORDER BY"));
        assertFalse(query.partials());
        assertEquals(1, query.groupColumns());

        // 关联参数在前，随后是指标、粒度与时间范围
        assertEquals(List.of(10L, 100L, 101L, 11L, 200L, 10L, 7L, "day",
                        OffsetDateTime.ofInstant(START, ZoneOffset.UTC), OffsetDateTime.ofInstant(END, ZoneOffset.UTC)),
                query.params());
    }

    @Test
    void timeseriesReturnsMergeablePartials() {
        QuerySpec spec = QuerySpec.timeseries(Aggregation.AVG, List.of(1L, 2L), Grain.HOUR, START, END,
                List.of(), List.of());
        ComposedQuery query = QueryComposer.compose(spec);

        assertTrue(query.partials());
        assertTrue(query.sql().contains("SUM(o.value_num) AS agg_sum"));
        assertTrue(query.sql().contains("COUNT(o.value_num) AS agg_count"));
        assertTrue(query.sql().contains("s.metric_id IN (?, ?)"));
        assertTrue(query.sql().contains("GROUP BY s.metric_id, o.time_start_ts"));
        assertEquals(0, occurrences(query.sql(), "JOIN dimension_set_value"));
    }

    @Test
    void countAggregationIsComposedAsSum() {
        ComposedQuery aggregate = QueryComposer.compose(QuerySpec.aggregate(Aggregation.COUNT, List.of(1L),
                Grain.DAY, START, END, List.of(), List.of()));
        assertTrue(aggregate.sql().contains("SUM(o.value_num)"));
        assertFalse(aggregate.sql().contains("COUNT("));

        ComposedQuery partials = QueryComposer.compose(QuerySpec.timeseries(Aggregation.COUNT, List.of(1L),
                Grain.DAY, START, END, List.of(), List.of()));
        assertTrue(partials.sql().contains("SUM(o.value_num) AS agg_sum"));
        assertFalse(partials.sql().contains("COUNT("));
    }

    @Test
    void timeRangeIsHalfOpen() {
        ComposedQuery query = QueryComposer.compose(QuerySpec.aggregate(Aggregation.MAX, List.of(1L), Grain.DAY,
                START, END, List.of(), List.of()));
        assertTrue(query.sql().contains("o.time_start_ts >= ? AND o.time_start_ts < ?"));
    }

    @Test
    void topKOrdersByValueThenGroupsAndLimits() {
        QuerySpec spec = QuerySpec.topK(Aggregation.SUM, 3L, Grain.DAY, START, END, List.of(),
                List.of(new GroupByDimension("region", 10L), new GroupByDimension("channel", 11L)),
                SortOrder.ASC, 5);
        ComposedQuery query = QueryComposer.compose(spec);

        assertTrue(query.sql().contains("ORDER BY agg_value ASC, gv0.dim_value ASC, gv1.dim_value ASC"));
        assertTrue(query.sql().endsWith("LIMIT ?"));
        assertEquals(5, query.params().get(query.params().size() - 1));
        assertEquals(2, query.groupColumns());
    }

    @Test
    void latestSelectsNewestObservation() {
        ComposedQuery query = QueryComposer.composeLatest(4L, Grain.DAY, List.of(new ResolvedFilter(10L, Set.of(1L))));
        assertTrue(query.sql().contains("ORDER BY o.time_start_ts DESC, o.observation_id DESC"));
        assertTrue(query.sql().endsWith("LIMIT 1"));
        assertEquals(List.of(10L, 1L, 4L, "day"), query.params());
    }

    @Test
    void rejectsEmptyMetricList() {
        assertThrows(IllegalArgumentException.class, () -> QueryComposer.compose(
                QuerySpec.aggregate(Aggregation.SUM, List.of(), Grain.DAY, START, END, List.of(), List.of())));
    }
}
