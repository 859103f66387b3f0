package com.asiainfo.dimensional.domain.query;

import com.asiainfo.dimensional.domain.model.Aggregation;
import com.asiainfo.dimensional.domain.model.Grain;
import com.asiainfo.dimensional.domain.model.GroupByDimension;
import com.asiainfo.dimensional.domain.model.ResolvedFilter;
import com.asiainfo.dimensional.domain.model.SortOrder;

import java.time.Instant;
import java.util.List;

/**
 * 单条聚合 SQL 的输入：一个聚合函数 + 一个源粒度下的一组指标
 */
public record QuerySpec(
        QueryMode mode,
        Aggregation aggregation,
        List<Long> metricIds,
        Grain sourceGrain,
        Instant start,
        Instant end,
        List<ResolvedFilter> filters,
        List<GroupByDimension> groupBy,
        SortOrder order,
        int limit) {

    public QuerySpec {
        metricIds = List.copyOf(metricIds);
        filters = filters == null ? List.of() : List.copyOf(filters);
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
    }

    public static QuerySpec timeseries(Aggregation aggregation, List<Long> metricIds, Grain sourceGrain,
                                       Instant start, Instant end,
                                       List<ResolvedFilter> filters, List<GroupByDimension> groupBy) {
        return new QuerySpec(QueryMode.TIMESERIES, aggregation, metricIds, sourceGrain, start, end,
                filters, groupBy, null, 0);
    }

    public static QuerySpec aggregate(Aggregation aggregation, List<Long> metricIds, Grain sourceGrain,
                                      Instant start, Instant end,
                                      List<ResolvedFilter> filters, List<GroupByDimension> groupBy) {
        return new QuerySpec(QueryMode.AGGREGATE, aggregation, metricIds, sourceGrain, start, end,
                filters, groupBy, null, 0);
    }

    public static QuerySpec topK(Aggregation aggregation, long metricId, Grain sourceGrain,
                                 Instant start, Instant end,
                                 List<ResolvedFilter> filters, List<GroupByDimension> groupBy,
                                 SortOrder order, int limit) {
        return new QuerySpec(QueryMode.TOP_K, aggregation, List.of(metricId), sourceGrain, start, end,
                filters, groupBy, order, limit);
    }
}
