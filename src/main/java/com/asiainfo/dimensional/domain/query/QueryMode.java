package com.asiainfo.dimensional.domain.query;

public enum QueryMode {
    /** 按请求粒度分桶，每个桶一个点 */
    TIMESERIES,
    /** 整个时间范围聚合为一个值 */
    AGGREGATE,
    /** 单指标，按聚合值排序并截断 */
    TOP_K
}
