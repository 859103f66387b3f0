package com.asiainfo.dimensional.domain.query;

import java.util.Set;

/**
 * 一次动态维度关联
 * <p>
 * FILTER：关联 dimension_set_value 并约束 value_id；
 * GROUP_BY：再关联 dimension_value 取出取值作为输出列。
 */
public record JoinSpec(Role role, int index, long dimensionId, Set<Long> valueIds) {

    public enum Role {
        FILTER,
        GROUP_BY
    }

    public static JoinSpec filter(int index, long dimensionId, Set<Long> valueIds) {
        if (valueIds == null || valueIds.isEmpty()) {
            throw new IllegalArgumentException("filter join needs at least one value id, dimension " + dimensionId);
        }
        return new JoinSpec(Role.FILTER, index, dimensionId, Set.copyOf(valueIds));
    }

    public static JoinSpec groupBy(int index, long dimensionId) {
        return new JoinSpec(Role.GROUP_BY, index, dimensionId, Set.of());
    }

    public String setAlias() {
        return role == Role.FILTER ? "fs" + index : "gs" + index;
    }

    public String valueAlias() {
        return "gv" + index;
    }

    public String outputColumn() {
        return "group_" + index;
    }
}
