package com.asiainfo.dimensional.application.catalog;

import com.asiainfo.dimensional.domain.model.ResolvedFilter;

import java.util.List;

/**
 * 过滤条件解析结果
 *
 * @param unsatisfiable 某个过滤维度的取值全部不存在，查询结果必然为空
 */
public record FilterResolution(List<ResolvedFilter> filters, boolean unsatisfiable) {

    public FilterResolution {
        filters = List.copyOf(filters);
    }

    public static FilterResolution none() {
        return new FilterResolution(List.of(), false);
    }
}
