package com.asiainfo.dimensional.application.query;

import com.asiainfo.dimensional.domain.model.Aggregation;
import com.asiainfo.dimensional.domain.query.AggregateRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AggregateAccumulatorTest {

    private static AggregateRow partial(Double sum, Long count, Double min, Double max) {
        return new AggregateRow(1L, List.of(), null, null, sum, count, min, max);
    }

    /**
     * 平均值按累加和 / 累加计数合并，而不是平均的平均
     */
    @Test
    void averageIsWeightedByCount() {
        AggregateAccumulator acc = new AggregateAccumulator(Aggregation.AVG);
        acc.add(partial(10.0, 1L, null, null));
        acc.add(partial(30.0, 3L, null, null));
        assertEquals(10.0, acc.result());
    }

    @Test
    void sumMinMaxCount() {
        AggregateAccumulator sum = new AggregateAccumulator(Aggregation.SUM);
        sum.add(partial(1.5, null, null, null));
        sum.add(partial(2.5, null, null, null));
        assertEquals(4.0, sum.result());

        AggregateAccumulator min = new AggregateAccumulator(Aggregation.MIN);
        min.add(partial(null, null, 3.0, null));
        min.add(partial(null, null, -1.0, null));
        assertEquals(-1.0, min.result());

        AggregateAccumulator max = new AggregateAccumulator(Aggregation.MAX);
        max.add(partial(null, null, null, 3.0));
        max.add(partial(null, null, null, 7.0));
        assertEquals(7.0, max.result());

        AggregateAccumulator count = new AggregateAccumulator(Aggregation.COUNT);
        count.add(partial(2.0, null, null, null));
        count.add(partial(5.0, null, null, null));
        assertEquals(7.0, count.result());
    }

    @Test
    void emptyAccumulatorHasNoValue() {
        assertNull(new AggregateAccumulator(Aggregation.SUM).result());
    }
}
