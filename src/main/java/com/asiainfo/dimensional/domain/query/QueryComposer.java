package com.asiainfo.dimensional.domain.query;

import com.asiainfo.dimensional.domain.model.Aggregation;
import com.asiainfo.dimensional.domain.model.Grain;
import com.asiainfo.dimensional.domain.model.GroupByDimension;
import com.asiainfo.dimensional.domain.model.ResolvedFilter;
import com.asiainfo.dimensional.domain.model.SortOrder;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 动态过滤 / 分组 / 聚合 SQL 生成器
 * <p>
 * 观测值通过 metric_series 关联到维度集合：
 * <ul>
 *   <li>每个过滤维度关联一次 dimension_set_value，约束 value_id（同维度 OR，跨维度 AND）</li>
 *   <li>每个分组维度关联 dimension_set_value + dimension_value，取值作为 group_i 输出并参与 GROUP BY</li>
 *   <li>时间范围为左闭右开 [start, end)</li>
 * </ul>
 * 时序模式额外按 time_start_ts 分组并输出部分聚合，由调用方按请求粒度合并到桶。
 */
public final class QueryComposer {

    public static final String COL_METRIC_ID = "metric_id";
    public static final String COL_TIME_START = "time_start_ts";
    public static final String COL_VALUE = "agg_value";
    public static final String COL_SUM = "agg_sum";
    public static final String COL_COUNT = "agg_count";
    public static final String COL_MIN = "agg_min";
    public static final String COL_MAX = "agg_max";

    private QueryComposer() {
    }

    public static ComposedQuery compose(QuerySpec spec) {
        if (spec.metricIds().isEmpty()) {
            throw new IllegalArgumentException("at least one metric id is required");
        }
        List<JoinSpec> joins = buildJoins(spec.filters(), spec.groupBy());
        List<Object> params = new ArrayList<>();
        boolean partials = spec.mode() == QueryMode.TIMESERIES;

        StringBuilder sql = new StringBuilder("SELECT s.metric_id AS ").append(COL_METRIC_ID);
        for (JoinSpec join : joins) {
            if (join.role() == JoinSpec.Role.GROUP_BY) {
                sql.append(", ").append(join.valueAlias()).append(".dim_value AS ").append(join.outputColumn());
            }
        }
        if (partials) {
            sql.append(", o.time_start_ts AS ").append(COL_TIME_START);
            sql.append(", ").append(partialExpressions(spec.aggregation()));
        } else {
            sql.append(", ").append(finalExpression(spec.aggregation())).append(" AS ").append(COL_VALUE);
        }

        sql.append("\n FROM metric_observation o");
        sql.append("\n JOIN metric_series s ON s.series_id = o.series_id");
        appendJoins(sql, params, joins);

        sql.append("\n WHERE s.metric_id IN (").append(placeholders(spec.metricIds().size())).append(")");
        params.addAll(spec.metricIds());
        sql.append(" AND s.grain = ?");
        params.add(spec.sourceGrain().code());
        sql.append(" AND o.time_start_ts >= ? AND o.time_start_ts < ?");
        params.add(spec.start().atOffset(ZoneOffset.UTC));
        params.add(spec.end().atOffset(ZoneOffset.UTC));

        List<String> groupColumns = new ArrayList<>();
        groupColumns.add("s.metric_id");
        joins.stream()
                .filter(j -> j.role() == JoinSpec.Role.GROUP_BY)
                .forEach(j -> groupColumns.add(j.valueAlias() + ".dim_value"));
        if (partials) {
            groupColumns.add("o.time_start_ts");
        }
        sql.append("\n GROUP BY ").append(String.join(", ", groupColumns));

        if (spec.mode() == QueryMode.TOP_K) {
            String direction = spec.order() == SortOrder.ASC ? "ASC" : "DESC";
            List<String> orderColumns = new ArrayList<>();
            orderColumns.add(COL_VALUE + " " + direction);
            joins.stream()
                    .filter(j -> j.role() == JoinSpec.Role.GROUP_BY)
                    .forEach(j -> orderColumns.add(j.valueAlias() + ".dim_value ASC"));
            sql.append("\n ORDER BY ").append(String.join(", ", orderColumns));
            sql.append("\n LIMIT ?");
            params.add(spec.limit());
        }

        return new ComposedQuery(sql.toString(), params, spec.mode(), spec.aggregation(),
                spec.groupBy().size(), partials);
    }

    /**
     * 指标在源粒度下的最新一条观测
     */
    public static ComposedQuery composeLatest(long metricId, Grain sourceGrain, List<ResolvedFilter> filters) {
        List<JoinSpec> joins = buildJoins(filters, List.of());
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(
                "SELECT o.time_start_ts AS time_start_ts, o.value_num AS agg_value, o.ingested_ts AS ingested_ts");
        sql.append("\n FROM metric_observation o");
        sql.append("\n JOIN metric_series s ON s.series_id = o.series_id");
        appendJoins(sql, params, joins);
        sql.append("\n WHERE s.metric_id = ? AND s.grain = ?");
        params.add(metricId);
        params.add(sourceGrain.code());
        sql.append("\n ORDER BY o.time_start_ts DESC, o.observation_id DESC");
        sql.append("\n LIMIT 1");
        return new ComposedQuery(sql.toString(), params, QueryMode.AGGREGATE, Aggregation.MAX, 0, false);
    }

    /**
     * 指标在源粒度下观测时间的最小 / 最大值
     */
    public static ComposedQuery composeAvailability(long metricId, Grain sourceGrain, List<ResolvedFilter> filters) {
        List<JoinSpec> joins = buildJoins(filters, List.of());
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(
                "SELECT MIN(o.time_start_ts) AS min_time_start_ts, MAX(o.time_start_ts) AS max_time_start_ts");
        sql.append("\n FROM metric_observation o");
        sql.append("\n JOIN metric_series s ON s.series_id = o.series_id");
        appendJoins(sql, params, joins);
        sql.append("\n WHERE s.metric_id = ? AND s.grain = ?");
        params.add(metricId);
        params.add(sourceGrain.code());
        return new ComposedQuery(sql.toString(), params, QueryMode.AGGREGATE, Aggregation.MIN, 0, false);
    }

    static List<JoinSpec> buildJoins(List<ResolvedFilter> filters, List<GroupByDimension> groupBy) {
        List<JoinSpec> joins = new ArrayList<>();
        int index = 0;
        for (ResolvedFilter filter : filters) {
            joins.add(JoinSpec.filter(index++, filter.dimensionId(), filter.valueIds()));
        }
        int groupIndex = 0;
        for (GroupByDimension dimension : groupBy) {
            joins.add(JoinSpec.groupBy(groupIndex++, dimension.dimensionId()));
        }
        return joins;
    }

    private static void appendJoins(StringBuilder sql, List<Object> params, List<JoinSpec> joins) {
        for (JoinSpec join : joins) {
            String set = join.setAlias();
            sql.append("\n JOIN dimension_set_value ").append(set)
                    .append(" ON ").append(set).append(".set_id = s.set_id")
                    .append(" AND ").append(set).append(".dimension_id = ?");
            params.add(join.dimensionId());
            if (join.role() == JoinSpec.Role.FILTER) {
                List<Long> valueIds = join.valueIds().stream().sorted().toList();
                sql.append(" AND ").append(set).append(".value_id IN (")
                        .append(placeholders(valueIds.size())).append(")");
                params.addAll(valueIds);
            } else {
                String value = join.valueAlias();
                sql.append("\n JOIN dimension_value ").append(value)
                        .append(" ON ").append(value).append(".value_id = ").append(set).append(".value_id");
            }
        }
    }

    private static String finalExpression(Aggregation aggregation) {
        return switch (aggregation) {
            case AVG -> "AVG(o.value_num)";
            case MIN -> "MIN(o.value_num)";
            case MAX -> "MAX(o.value_num)";
            case SUM, COUNT -> "SUM(o.value_num)";
        };
    }

    private static String partialExpressions(Aggregation aggregation) {
        return switch (aggregation) {
            case AVG -> "SUM(o.value_num) AS " + COL_SUM + ", COUNT(o.value_num) AS " + COL_COUNT;
            case MIN -> "MIN(o.value_num) AS " + COL_MIN;
            case MAX -> "MAX(o.value_num) AS " + COL_MAX;
            case SUM, COUNT -> "SUM(o.value_num) AS " + COL_SUM;
        };
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
