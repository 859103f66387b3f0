package com.asiainfo.dimensional.domain.query;

import com.asiainfo.dimensional.domain.model.Aggregation;

import java.util.List;

/**
 * 生成好的参数化 SQL
 *
 * @param groupColumns 分组取值列数（列名 group_0..group_{n-1}）
 * @param partials     true 表示返回可合并的部分聚合（agg_sum/agg_count/agg_min/agg_max），否则返回 agg_value
 */
public record ComposedQuery(
        String sql,
        List<Object> params,
        QueryMode mode,
        Aggregation aggregation,
        int groupColumns,
        boolean partials) {

    public ComposedQuery {
        params = List.copyOf(params);
    }
}
