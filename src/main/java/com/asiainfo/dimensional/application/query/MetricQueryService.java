package com.asiainfo.dimensional.application.query;

import com.asiainfo.dimensional.api.dto.DimensionFilterRequest;
import com.asiainfo.dimensional.api.dto.MetricQueryRequest;
import com.asiainfo.dimensional.api.dto.QueryResponses.AggregateResponse;
import com.asiainfo.dimensional.api.dto.QueryResponses.AvailabilityResponse;
import com.asiainfo.dimensional.api.dto.QueryResponses.FreshnessResponse;
import com.asiainfo.dimensional.api.dto.QueryResponses.Group;
import com.asiainfo.dimensional.api.dto.QueryResponses.LatestResponse;
import com.asiainfo.dimensional.api.dto.QueryResponses.Point;
import com.asiainfo.dimensional.api.dto.QueryResponses.Series;
import com.asiainfo.dimensional.api.dto.QueryResponses.TimeseriesResponse;
import com.asiainfo.dimensional.api.dto.QueryResponses.TopKItem;
import com.asiainfo.dimensional.api.dto.QueryResponses.TopKResponse;
import com.asiainfo.dimensional.api.dto.TopKQueryRequest;
import com.asiainfo.dimensional.application.catalog.CatalogResolver;
import com.asiainfo.dimensional.application.catalog.CatalogResolver.DimensionContext;
import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import com.asiainfo.dimensional.domain.grain.GrainResolver;
import com.asiainfo.dimensional.domain.model.Aggregation;
import com.asiainfo.dimensional.domain.model.DimensionFilter;
import com.asiainfo.dimensional.domain.model.Grain;
import com.asiainfo.dimensional.domain.model.GroupByDimension;
import com.asiainfo.dimensional.domain.model.LatestObservation;
import com.asiainfo.dimensional.domain.model.ResolvedMetric;
import com.asiainfo.dimensional.domain.model.SortOrder;
import com.asiainfo.dimensional.domain.model.TimeSpan;
import com.asiainfo.dimensional.domain.query.AggregateRow;
import com.asiainfo.dimensional.domain.query.QueryComposer;
import com.asiainfo.dimensional.domain.query.QuerySpec;
import com.asiainfo.dimensional.domain.time.TimeBucketing;
import com.asiainfo.dimensional.infrastructure.cache.QueryResultCache;
import com.asiainfo.dimensional.infrastructure.persistence.ObservationQueryRepository;
import com.asiainfo.dimensional.infrastructure.persistence.SeriesRepository;
import com.asiainfo.dimensional.infrastructure.persistence.UnitOfWork;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * 指标查询服务
 * <p>
 * 执行流程：
 * 1. CatalogResolver 把 metric_key / dimension_key 解析为 id
 * 2. GrainResolver 为每个指标选择源粒度（每个指标只解析一次）
 * 3. 按 (聚合函数, 源粒度) 分组，每组一条 QueryComposer 生成的 SQL
 * 4. 时序模式在内存中把部分聚合合并到请求粒度的时间桶
 * 5. 输出按请求中的指标顺序、分组维度取值排序
 *
 * @author QvQ
 * @date 2026/10/13
 */
@ApplicationScoped
public class MetricQueryService {

    private static final Logger log = LoggerFactory.getLogger(MetricQueryService.class);

    private static final Comparator<List<String>> GROUP_VALUES_ORDER = (a, b) -> {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = nullToEmpty(a.get(i)).compareTo(nullToEmpty(b.get(i)));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    };

    @Inject
    UnitOfWork unitOfWork;

    @Inject
    CatalogResolver catalogResolver;

    @Inject
    SeriesRepository seriesRepository;

    @Inject
    ObservationQueryRepository observationQueryRepository;

    @Inject
    QueryResultCache queryResultCache;

    @Inject
    MeterRegistry registry;

    /**
     * 时序查询：每个 (指标, 分组取值) 一条序列，点按时间桶升序
     */
    public TimeseriesResponse timeseries(MetricQueryRequest request) {
        QueryWindow window = QueryWindow.of(request.grain(), request.startTime(), request.endTime());
        requireMetricKeys(request.metricKeys());
        return timed("timeseries", () -> queryResultCache.getOrCompute(
                queryResultCache.keyFor("timeseries", request),
                () -> unitOfWork.read("timeseries query", conn -> executeTimeseries(conn, request, window))));
    }

    /**
     * 聚合查询：整个时间范围聚合为每个 (指标, 分组取值) 一个值
     */
    public AggregateResponse aggregate(MetricQueryRequest request) {
        QueryWindow window = QueryWindow.of(request.grain(), request.startTime(), request.endTime());
        requireMetricKeys(request.metricKeys());
        return timed("aggregate", () -> queryResultCache.getOrCompute(
                queryResultCache.keyFor("aggregate", request),
                () -> unitOfWork.read("aggregate query", conn -> executeAggregate(conn, request, window))));
    }

    /**
     * Top-K 查询：单指标按聚合值排序后截取前 K 组
     */
    public TopKResponse topK(TopKQueryRequest request) {
        QueryWindow window = QueryWindow.of(request.grain(), request.startTime(), request.endTime());
        if (request.metricKey() == null || request.metricKey().isBlank()) {
            throw new InvalidRequestException("metric_key is required");
        }
        if (request.effectiveK() < 1) {
            throw new InvalidRequestException("k must be at least 1");
        }
        SortOrder order = SortOrder.parse(request.order());
        return timed("topk", () -> queryResultCache.getOrCompute(
                queryResultCache.keyFor("topk", request),
                () -> unitOfWork.read("top-k query", conn -> executeTopK(conn, request, window, order))));
    }

    /**
     * 指标最新一条观测，时间按请求粒度取桶起点
     */
    public LatestResponse latest(String metricKey, String grain, List<String> dimensions) {
        Grain requested = Grain.parse(grain);
        List<DimensionFilter> filters = DimensionPairParser.parse(dimensions);
        return timed("latest", () -> unitOfWork.read("latest query", conn -> {
            SingleMetric target = resolveSingle(conn, metricKey, requested, filters);
            LatestObservation latest = target.hasData() ? observationQueryRepository.latest(conn,
                    QueryComposer.composeLatest(target.metric().metricId(), target.sourceGrain(),
                            target.context().filters().filters())).orElse(null) : null;
            return new LatestResponse(target.metric().metricKey(), requested.code(), target.sourceGrain().code(),
                    latest == null ? null : TimeBucketing.bucketStart(requested, latest.timeStartTs()),
                    latest == null ? null : latest.value());
        }));
    }

    /**
     * 指标数据覆盖范围（按请求粒度取桶起点）
     */
    public AvailabilityResponse availability(String metricKey, String grain, List<String> dimensions) {
        Grain requested = Grain.parse(grain);
        List<DimensionFilter> filters = DimensionPairParser.parse(dimensions);
        return timed("availability", () -> unitOfWork.read("availability query", conn -> {
            SingleMetric target = resolveSingle(conn, metricKey, requested, filters);
            TimeSpan span = target.hasData() ? observationQueryRepository.availability(conn,
                    QueryComposer.composeAvailability(target.metric().metricId(), target.sourceGrain(),
                            target.context().filters().filters())) : TimeSpan.empty();
            return new AvailabilityResponse(target.metric().metricKey(), requested.code(), target.sourceGrain().code(),
                    span.min() == null ? null : TimeBucketing.bucketStart(requested, span.min()),
                    span.max() == null ? null : TimeBucketing.bucketStart(requested, span.max()));
        }));
    }

    /**
     * 指标新鲜度：最新观测的 time_start_ts 及其入库时间
     */
    public FreshnessResponse freshness(String metricKey, String grain, List<String> dimensions) {
        Grain requested = Grain.parse(grain);
        List<DimensionFilter> filters = DimensionPairParser.parse(dimensions);
        return timed("freshness", () -> unitOfWork.read("freshness query", conn -> {
            SingleMetric target = resolveSingle(conn, metricKey, requested, filters);
            LatestObservation latest = target.hasData() ? observationQueryRepository.latest(conn,
                    QueryComposer.composeLatest(target.metric().metricId(), target.sourceGrain(),
                            target.context().filters().filters())).orElse(null) : null;
            return new FreshnessResponse(target.metric().metricKey(), requested.code(), target.sourceGrain().code(),
                    latest == null ? null : latest.timeStartTs(),
                    latest == null ? null : latest.ingestedTs());
        }));
    }

    // ==================== 执行 ====================

    private TimeseriesResponse executeTimeseries(Connection conn, MetricQueryRequest request,
                                                 QueryWindow window) throws SQLException {
        Prepared prepared = prepare(conn, request.metricKeys(), window.grain(), request.groupBy(), request.filters());
        Map<GroupKey, TreeMap<Instant, AggregateAccumulator>> buckets = new HashMap<>();

        if (!prepared.context().filters().unsatisfiable()) {
            for (Map.Entry<Aggregation, Map<Grain, List<Long>>> byAggregation : prepared.partitions().entrySet()) {
                Aggregation aggregation = byAggregation.getKey();
                for (Map.Entry<Grain, List<Long>> byGrain : byAggregation.getValue().entrySet()) {
                    QuerySpec spec = QuerySpec.timeseries(aggregation, byGrain.getValue(), byGrain.getKey(),
                            window.start(), window.end(), prepared.context().filters().filters(),
                            prepared.context().groupBy());
                    for (AggregateRow row : observationQueryRepository.aggregate(conn, QueryComposer.compose(spec))) {
                        Instant bucket = TimeBucketing.bucketStart(window.grain(), row.timeStartTs());
                        buckets.computeIfAbsent(new GroupKey(row.metricId(), row.groupValues()), k -> new TreeMap<>())
                                .computeIfAbsent(bucket, b -> new AggregateAccumulator(aggregation))
                                .add(row);
                    }
                }
            }
        }

        List<GroupKey> keys = new ArrayList<>(buckets.keySet());
        keys.sort(prepared.groupOrder());
        List<Series> series = new ArrayList<>();
        for (GroupKey key : keys) {
            List<Point> points = new ArrayList<>();
            buckets.get(key).forEach((bucket, acc) -> points.add(new Point(bucket, acc.result())));
            series.add(new Series(prepared.metricKeyOf(key.metricId()),
                    prepared.dimensionsOf(key.groupValues()), points));
        }
        log.debug("[Query] timeseries: metrics={}, series={}", prepared.metrics().keySet(), series.size());
        return new TimeseriesResponse(List.copyOf(prepared.metrics().keySet()), window.grain().code(),
                prepared.sourceGrainCodes(), series);
    }

    private AggregateResponse executeAggregate(Connection conn, MetricQueryRequest request,
                                               QueryWindow window) throws SQLException {
        Prepared prepared = prepare(conn, request.metricKeys(), window.grain(), request.groupBy(), request.filters());
        List<AggregateRow> rows = new ArrayList<>();

        if (!prepared.context().filters().unsatisfiable()) {
            for (Map.Entry<Aggregation, Map<Grain, List<Long>>> byAggregation : prepared.partitions().entrySet()) {
                for (Map.Entry<Grain, List<Long>> byGrain : byAggregation.getValue().entrySet()) {
                    QuerySpec spec = QuerySpec.aggregate(byAggregation.getKey(), byGrain.getValue(), byGrain.getKey(),
                            window.start(), window.end(), prepared.context().filters().filters(),
                            prepared.context().groupBy());
                    rows.addAll(observationQueryRepository.aggregate(conn, QueryComposer.compose(spec)));
                }
            }
        }

        rows.sort(Comparator.comparing((AggregateRow r) -> new GroupKey(r.metricId(), r.groupValues()),
                prepared.groupOrder()));
        List<Group> groups = rows.stream()
                .map(r -> new Group(prepared.metricKeyOf(r.metricId()), prepared.dimensionsOf(r.groupValues()), r.value()))
                .toList();
        log.debug("[Query] aggregate: metrics={}, groups={}", prepared.metrics().keySet(), groups.size());
        return new AggregateResponse(List.copyOf(prepared.metrics().keySet()), window.grain().code(),
                prepared.sourceGrainCodes(), groups);
    }

    private TopKResponse executeTopK(Connection conn, TopKQueryRequest request, QueryWindow window,
                                     SortOrder order) throws SQLException {
        Prepared prepared = prepare(conn, List.of(request.metricKey()), window.grain(), request.groupBy(), request.filters());
        ResolvedMetric metric = prepared.metrics().values().iterator().next();
        Grain sourceGrain = prepared.sourceGrains().get(metric.metricId());
        List<TopKItem> items = new ArrayList<>();

        if (!prepared.context().filters().unsatisfiable() && prepared.hasData(metric.metricId())) {
            QuerySpec spec = QuerySpec.topK(metric.aggregation(), metric.metricId(), sourceGrain,
                    window.start(), window.end(), prepared.context().filters().filters(),
                    prepared.context().groupBy(), order, request.effectiveK());
            for (AggregateRow row : observationQueryRepository.aggregate(conn, QueryComposer.compose(spec))) {
                items.add(new TopKItem(prepared.dimensionsOf(row.groupValues()), row.value()));
            }
        }
        return new TopKResponse(metric.metricKey(), window.grain().code(), sourceGrain.code(), items);
    }

    // ==================== 解析 ====================

    private Prepared prepare(Connection conn, List<String> metricKeys, Grain requested,
                             List<String> groupBy, List<DimensionFilterRequest> filters) throws SQLException {
        Map<String, ResolvedMetric> metrics = catalogResolver.resolveMetrics(conn, metricKeys);
        DimensionContext context = catalogResolver.resolveDimensionContext(conn, groupBy,
                DimensionFilterRequest.toDomain(filters));

        List<Long> metricIds = metrics.values().stream().map(ResolvedMetric::metricId).toList();
        Map<Long, Set<Grain>> stored = seriesRepository.findGrainsByMetric(conn, metricIds);
        Map<Long, Grain> sourceGrains = GrainResolver.resolveAll(withEmpty(metricIds, stored), requested);

        Map<Aggregation, Map<Grain, List<Long>>> partitions = new EnumMap<>(Aggregation.class);
        for (ResolvedMetric metric : metrics.values()) {
            if (!stored.containsKey(metric.metricId())) {
                continue;
            }
            partitions.computeIfAbsent(metric.aggregation(), a -> new EnumMap<>(Grain.class))
                    .computeIfAbsent(sourceGrains.get(metric.metricId()), g -> new ArrayList<>())
                    .add(metric.metricId());
        }
        return new Prepared(metrics, context, stored, sourceGrains, partitions);
    }

    private SingleMetric resolveSingle(Connection conn, String metricKey, Grain requested,
                                       List<DimensionFilter> filters) throws SQLException {
        ResolvedMetric metric = catalogResolver.resolveMetric(conn, metricKey);
        DimensionContext context = catalogResolver.resolveDimensionContext(conn, List.of(), filters);
        Set<Grain> stored = seriesRepository.findGrainsByMetric(conn, List.of(metric.metricId()))
                .getOrDefault(metric.metricId(), Set.of());
        Grain sourceGrain = GrainResolver.resolve(stored, requested);
        return new SingleMetric(metric, context, sourceGrain, !stored.isEmpty() && !context.filters().unsatisfiable());
    }

    private static Map<Long, Set<Grain>> withEmpty(List<Long> metricIds, Map<Long, Set<Grain>> stored) {
        Map<Long, Set<Grain>> all = new HashMap<>();
        metricIds.forEach(id -> all.put(id, stored.getOrDefault(id, Set.of())));
        return all;
    }

    private static void requireMetricKeys(List<String> metricKeys) {
        if (metricKeys == null || metricKeys.isEmpty()) {
            throw new InvalidRequestException("metric_keys must contain at least one key");
        }
    }

    private <T> T timed(String mode, Supplier<T> work) {
        return Timer.builder("metrics.query.time")
                .description("Metric query execution time")
                .tag("mode", mode)
                .register(registry)
                .record(work);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record GroupKey(long metricId, List<String> groupValues) {
    }

    private record SingleMetric(ResolvedMetric metric, DimensionContext context, Grain sourceGrain, boolean hasData) {
    }

    /**
     * 一次多指标请求解析后的上下文
     */
    private record Prepared(Map<String, ResolvedMetric> metrics,
                            DimensionContext context,
                            Map<Long, Set<Grain>> storedGrains,
                            Map<Long, Grain> sourceGrains,
                            Map<Aggregation, Map<Grain, List<Long>>> partitions) {

        boolean hasData(long metricId) {
            return storedGrains.containsKey(metricId);
        }

        String metricKeyOf(long metricId) {
            return metrics.values().stream()
                    .filter(m -> m.metricId() == metricId)
                    .map(ResolvedMetric::metricKey)
                    .findFirst()
                    .orElseThrow();
        }

        int positionOf(long metricId) {
            int position = 0;
            for (ResolvedMetric metric : metrics.values()) {
                if (metric.metricId() == metricId) {
                    return position;
                }
                position++;
            }
            return Integer.MAX_VALUE;
        }

        Comparator<GroupKey> groupOrder() {
            return Comparator.comparingInt((GroupKey k) -> positionOf(k.metricId()))
                    .thenComparing(GroupKey::groupValues, GROUP_VALUES_ORDER);
        }

        Map<String, String> dimensionsOf(List<String> groupValues) {
            Map<String, String> dimensions = new LinkedHashMap<>();
            List<GroupByDimension> groupBy = context.groupBy();
            for (int i = 0; i < groupBy.size(); i++) {
                dimensions.put(groupBy.get(i).dimensionKey(), i < groupValues.size() ? groupValues.get(i) : null);
            }
            return dimensions;
        }

        Map<String, String> sourceGrainCodes() {
            Map<String, String> codes = new LinkedHashMap<>();
            metrics.forEach((key, metric) -> codes.put(key, sourceGrains.get(metric.metricId()).code()));
            return codes;
        }
    }
}
