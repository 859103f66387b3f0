package com.asiainfo.dimensional.application.query;

import com.asiainfo.dimensional.domain.model.Aggregation;
import com.asiainfo.dimensional.domain.query.AggregateRow;

/**
 * 合并同一时间桶内的部分聚合
 * <p>
 * sum 累加，min/max 取极值，avg = 累加和 / 累加计数。
 */
public class AggregateAccumulator {

    private final Aggregation aggregation;
    private double sum;
    private long count;
    private Double min;
    private Double max;
    private boolean seen;

    public AggregateAccumulator(Aggregation aggregation) {
        this.aggregation = aggregation;
    }

    public void add(AggregateRow row) {
        if (row.sum() != null) {
            sum += row.sum();
            seen = true;
        }
        if (row.count() != null) {
            count += row.count();
            seen = true;
        }
        if (row.min() != null) {
            min = min == null ? row.min() : Math.min(min, row.min());
            seen = true;
        }
        if (row.max() != null) {
            max = max == null ? row.max() : Math.max(max, row.max());
            seen = true;
        }
    }

    public Double result() {
        if (!seen) {
            return null;
        }
        return switch (aggregation) {
            case SUM, COUNT -> sum;
            case AVG -> count == 0 ? null : sum / count;
            case MIN -> min;
            case MAX -> max;
        };
    }
}
