package com.asiainfo.dimensional.application.catalog;

import com.asiainfo.dimensional.common.exception.CatalogNotFoundException;
import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import com.asiainfo.dimensional.common.util.TextNormalizer;
import com.asiainfo.dimensional.domain.model.Aggregation;
import com.asiainfo.dimensional.domain.model.DimensionDefinition;
import com.asiainfo.dimensional.domain.model.DimensionFilter;
import com.asiainfo.dimensional.domain.model.GroupByDimension;
import com.asiainfo.dimensional.domain.model.MetricDefinition;
import com.asiainfo.dimensional.domain.model.ResolvedFilter;
import com.asiainfo.dimensional.domain.model.ResolvedMetric;
import com.asiainfo.dimensional.infrastructure.persistence.CatalogRepository;
import com.asiainfo.dimensional.infrastructure.persistence.DimensionValueRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 目录解析：把 metric_key / dimension_key 解析为内部 id
 * <p>
 * 输入去重保序；只要有 key 不存在就整体失败，异常中列出全部缺失的 key。
 *
 * @author QvQ
 * @date 2026/10/13
 */
@ApplicationScoped
public class CatalogResolver {

    @Inject
    CatalogRepository catalogRepository;

    @Inject
    DimensionValueRepository dimensionValueRepository;

    /**
     * 解析指标 key，结果按请求顺序排列
     */
    public Map<String, ResolvedMetric> resolveMetrics(Connection conn, Collection<String> metricKeys) throws SQLException {
        List<String> keys = normalizeKeys(metricKeys);
        Map<String, MetricDefinition> found = catalogRepository.findMetricsByKeys(conn, keys);
        List<String> missing = keys.stream().filter(k -> !found.containsKey(k)).toList();
        if (!missing.isEmpty()) {
            throw CatalogNotFoundException.metricKeys(missing);
        }
        Map<String, ResolvedMetric> resolved = new LinkedHashMap<>();
        for (String key : keys) {
            MetricDefinition def = found.get(key);
            resolved.put(key, new ResolvedMetric(key, def.metricId(), Aggregation.forQuery(def.aggregation())));
        }
        return resolved;
    }

    public ResolvedMetric resolveMetric(Connection conn, String metricKey) throws SQLException {
        return resolveMetrics(conn, List.of(metricKey)).values().iterator().next();
    }

    /**
     * 解析维度 key -> dimension_id，结果按请求顺序排列
     */
    public Map<String, Long> resolveDimensions(Connection conn, Collection<String> dimensionKeys) throws SQLException {
        List<String> keys = normalizeKeys(dimensionKeys);
        if (keys.isEmpty()) {
            return Map.of();
        }
        Map<String, DimensionDefinition> found = catalogRepository.findDimensionsByKeys(conn, keys);
        List<String> missing = keys.stream().filter(k -> !found.containsKey(k)).toList();
        if (!missing.isEmpty()) {
            throw CatalogNotFoundException.dimensionKeys(missing);
        }
        Map<String, Long> resolved = new LinkedHashMap<>();
        keys.forEach(k -> resolved.put(k, found.get(k).dimensionId()));
        return resolved;
    }

    /**
     * 同时解析分组维度与过滤维度，缺失的 key 一并报告
     */
    public DimensionContext resolveDimensionContext(Connection conn, List<String> groupBy,
                                                    List<DimensionFilter> filters) throws SQLException {
        List<String> groupKeys = normalizeKeys(groupBy == null ? List.of() : groupBy);
        List<String> allKeys = new ArrayList<>(groupKeys);
        if (filters != null) {
            filters.stream().filter(DimensionFilter::isKeyForm).forEach(f -> allKeys.add(f.dimensionKey()));
        }
        Map<String, Long> dimensionIds = resolveDimensions(conn, allKeys);

        List<GroupByDimension> groupByDimensions = groupKeys.stream()
                .map(k -> new GroupByDimension(k, dimensionIds.get(k)))
                .toList();
        return new DimensionContext(groupByDimensions, resolveFilters(conn, filters, dimensionIds));
    }

    /**
     * 过滤条件解析：同一维度多个条件的取值合并（OR），不同维度之间为 AND
     */
    FilterResolution resolveFilters(Connection conn, List<DimensionFilter> filters,
                                    Map<String, Long> dimensionIds) throws SQLException {
        if (filters == null || filters.isEmpty()) {
            return FilterResolution.none();
        }
        Map<Long, Set<Long>> valueIdsByDimension = new LinkedHashMap<>();
        boolean unsatisfiable = false;
        for (DimensionFilter filter : filters) {
            if (filter.isKeyForm()) {
                if (filter.values().isEmpty()) {
                    continue;
                }
                long dimensionId = dimensionIds.get(TextNormalizer.lowerTrim(filter.dimensionKey()));
                Map<String, Long> valueIds = dimensionValueRepository.findValueIds(conn, dimensionId, filter.values());
                Set<Long> target = valueIdsByDimension.computeIfAbsent(dimensionId, k -> new LinkedHashSet<>());
                target.addAll(valueIds.values());
            } else if (filter.dimensionId() != null) {
                if (filter.valueIds().isEmpty()) {
                    continue;
                }
                valueIdsByDimension.computeIfAbsent(filter.dimensionId(), k -> new LinkedHashSet<>())
                        .addAll(filter.valueIds());
            } else {
                throw new InvalidRequestException("filter requires either dimension_key or dimension_id");
            }
        }
        List<ResolvedFilter> resolved = new ArrayList<>();
        for (Map.Entry<Long, Set<Long>> entry : valueIdsByDimension.entrySet()) {
            if (entry.getValue().isEmpty()) {
                unsatisfiable = true;
            } else {
                resolved.add(new ResolvedFilter(entry.getKey(), entry.getValue()));
            }
        }
        return new FilterResolution(resolved, unsatisfiable);
    }

    static List<String> normalizeKeys(Collection<String> keys) {
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (String key : keys) {
            if (key == null || key.isBlank()) {
                throw new InvalidRequestException("keys must not be blank");
            }
            normalized.add(TextNormalizer.lowerTrim(key));
        }
        return new ArrayList<>(normalized);
    }

    /**
     * 一次请求的维度上下文
     */
    public record DimensionContext(List<GroupByDimension> groupBy, FilterResolution filters) {
    }
}
