package com.asiainfo.dimensional.domain.query;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 聚合 SQL 的一行结果
 * <p>
 * 最终值模式只有 value；部分聚合模式（时序）只填充当前聚合函数需要的 sum / count / min / max。
 *
 * @param groupValues 按分组维度顺序排列的取值
 */
public record AggregateRow(
        long metricId,
        List<String> groupValues,
        Instant timeStartTs,
        Double value,
        Double sum,
        Long count,
        Double min,
        Double max) {

    public AggregateRow {
        groupValues = groupValues == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(groupValues));
    }
}
