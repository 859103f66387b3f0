package com.asiainfo.dimensional.domain.model;

import java.util.Set;

/**
 * 解析为 id 之后的维度过滤条件：同一维度的多个取值之间是 OR 关系
 */
public record ResolvedFilter(long dimensionId, Set<Long> valueIds) {

    public ResolvedFilter {
        valueIds = Set.copyOf(valueIds);
    }
}
