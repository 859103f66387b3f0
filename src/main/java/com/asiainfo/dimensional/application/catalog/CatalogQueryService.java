package com.asiainfo.dimensional.application.catalog;

import com.asiainfo.dimensional.api.dto.DimensionSearchRequest;
import com.asiainfo.dimensional.api.dto.DimensionValueItem;
import com.asiainfo.dimensional.api.dto.DimensionValueSearchRequest;
import com.asiainfo.dimensional.api.dto.DimensionValuesResponse;
import com.asiainfo.dimensional.api.dto.MetricSearchRequest;
import com.asiainfo.dimensional.api.dto.PageResponse;
import com.asiainfo.dimensional.common.config.MetricsConfig;
import com.asiainfo.dimensional.common.exception.CatalogNotFoundException;
import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import com.asiainfo.dimensional.common.util.TimestampParser;
import com.asiainfo.dimensional.domain.model.DimensionCriteria;
import com.asiainfo.dimensional.domain.model.DimensionDefinition;
import com.asiainfo.dimensional.domain.model.DimensionValueEntry;
import com.asiainfo.dimensional.domain.model.MetricCriteria;
import com.asiainfo.dimensional.domain.model.MetricDefinition;
import com.asiainfo.dimensional.infrastructure.persistence.CatalogRepository;
import com.asiainfo.dimensional.infrastructure.persistence.DimensionValueRepository;
import com.asiainfo.dimensional.infrastructure.persistence.UnitOfWork;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * 目录查询与检索
 *
 * @author QvQ
 * @date 2026/10/14
 */
@ApplicationScoped
public class CatalogQueryService {

    private static final Logger log = LoggerFactory.getLogger(CatalogQueryService.class);

    static final Map<String, Double> METRIC_SEARCH_FIELDS = Map.of(
            "metric_name", SearchScorer.WEIGHT_A,
            "metric_type", SearchScorer.WEIGHT_B,
            "metric_description", SearchScorer.WEIGHT_C);
    static final List<String> DEFAULT_METRIC_SEARCH_FIELDS =
            List.of("metric_name", "metric_description", "metric_type");

    static final Map<String, Double> DIMENSION_SEARCH_FIELDS = Map.of(
            "dimension_name", SearchScorer.WEIGHT_A,
            "dimension_key", SearchScorer.WEIGHT_B,
            "dimension_description", SearchScorer.WEIGHT_C);
    static final List<String> DEFAULT_DIMENSION_SEARCH_FIELDS =
            List.of("dimension_name", "dimension_description");

    @Inject
    UnitOfWork unitOfWork;

    @Inject
    CatalogRepository catalogRepository;

    @Inject
    DimensionValueRepository dimensionValueRepository;

    @Inject
    CatalogResolver catalogResolver;

    @Inject
    MetricsConfig metricsConfig;

    // ==================== 指标 ====================

    public PageResponse<MetricDefinition> listMetrics(MetricCriteria criteria, Paging paging) {
        List<MetricDefinition> items = unitOfWork.read("list metrics",
                conn -> catalogRepository.listMetrics(conn, criteria, paging.limit(), paging.offset()));
        return new PageResponse<>(items, paging.limit(), paging.offset());
    }

    public MetricDefinition getMetric(String metricKey) {
        return unitOfWork.read("get metric", conn -> catalogRepository.findMetric(conn, metricKey))
                .orElseThrow(() -> CatalogNotFoundException.metricKeys(List.of(metricKey)));
    }

    public PageResponse<MetricDefinition> searchMetrics(MetricSearchRequest request) {
        Paging paging = Paging.of(request.limit(), request.offset());
        MetricSearchRequest.Filters f = request.filters();
        MetricCriteria criteria = f == null ? MetricCriteria.none() : new MetricCriteria(
                f.metricId(), f.metricKey(), f.metricName(), f.metricType(),
                f.unit(), f.directionality(), f.aggregation(), f.isActive());
        String query = request.q() == null ? "" : request.q().trim();
        if (query.isEmpty()) {
            return listMetrics(criteria, paging);
        }
        double threshold = similarityThreshold(request.similarity());
        List<String> fields = searchFields(request.searchFields(), METRIC_SEARCH_FIELDS, DEFAULT_METRIC_SEARCH_FIELDS);

        List<MetricDefinition> candidates = unitOfWork.read("search metrics",
                conn -> catalogRepository.listMetrics(conn, criteria, null, null));
        List<MetricDefinition> ranked = rank(candidates, query, threshold,
                def -> fields.stream().map(name -> new SearchScorer.Field(metricField(def, name),
                        METRIC_SEARCH_FIELDS.get(name))).toList(),
                MetricDefinition::metricKey);
        log.debug("[Catalog] metric search q='{}': {} of {} candidates matched", query, ranked.size(), candidates.size());
        return new PageResponse<>(paging.slice(ranked), paging.limit(), paging.offset());
    }

    // ==================== 维度 ====================

    public PageResponse<DimensionDefinition> listDimensions(Boolean isActive, Paging paging) {
        DimensionCriteria criteria = new DimensionCriteria(null, null, null, null,
                isActive == null ? null : List.of(isActive));
        List<DimensionDefinition> items = unitOfWork.read("list dimensions",
                conn -> catalogRepository.listDimensions(conn, criteria, paging.limit(), paging.offset()));
        return new PageResponse<>(items, paging.limit(), paging.offset());
    }

    public DimensionDefinition getDimension(String dimensionKey) {
        return unitOfWork.read("get dimension", conn -> catalogRepository.findDimension(conn, dimensionKey))
                .orElseThrow(() -> CatalogNotFoundException.dimensionKeys(List.of(dimensionKey)));
    }

    /**
     * 维度取值列表，可按指标和观测时间 [start_time, end_time) 限定
     */
    public DimensionValuesResponse dimensionValues(String dimensionKey, String metricKey,
                                                   String startTime, String endTime, Paging paging) {
        Instant start = optionalTime("start_time", startTime);
        Instant end = optionalTime("end_time", endTime);
        List<String> values = unitOfWork.read("list dimension values", conn -> {
            long dimensionId = catalogResolver.resolveDimensions(conn, List.of(dimensionKey)).values().iterator().next();
            Long metricId = metricKey == null || metricKey.isBlank() ? null
                    : catalogResolver.resolveMetric(conn, metricKey).metricId();
            return dimensionValueRepository.listValues(conn, dimensionId, metricId, start, end,
                    paging.limit(), paging.offset());
        });
        return new DimensionValuesResponse(dimensionKey, values, paging.limit(), paging.offset());
    }

    public PageResponse<DimensionDefinition> searchDimensions(DimensionSearchRequest request) {
        Paging paging = Paging.of(request.limit(), request.offset());
        DimensionSearchRequest.Filters f = request.filters();
        DimensionCriteria criteria = f == null ? DimensionCriteria.none() : new DimensionCriteria(
                f.dimensionId(), f.dimensionKey(), f.dimensionName(), f.valueType(), f.isActive());
        String query = request.q() == null ? "" : request.q().trim();
        if (query.isEmpty()) {
            List<DimensionDefinition> items = unitOfWork.read("search dimensions",
                    conn -> catalogRepository.listDimensions(conn, criteria, paging.limit(), paging.offset()));
            return new PageResponse<>(items, paging.limit(), paging.offset());
        }
        double threshold = similarityThreshold(request.similarity());
        List<String> fields = searchFields(request.searchFields(), DIMENSION_SEARCH_FIELDS, DEFAULT_DIMENSION_SEARCH_FIELDS);

        List<DimensionDefinition> candidates = unitOfWork.read("search dimensions",
                conn -> catalogRepository.listDimensions(conn, criteria, null, null));
        List<DimensionDefinition> ranked = rank(candidates, query, threshold,
                def -> fields.stream().map(name -> new SearchScorer.Field(dimensionField(def, name),
                        DIMENSION_SEARCH_FIELDS.get(name))).toList(),
                DimensionDefinition::dimensionKey);
        return new PageResponse<>(paging.slice(ranked), paging.limit(), paging.offset());
    }

    public PageResponse<DimensionValueItem> searchDimensionValues(DimensionValueSearchRequest request) {
        Paging paging = Paging.of(request.limit(), request.offset());
        DimensionValueSearchRequest.Filters f = request.filters();
        List<String> dimensionKeys = f == null || f.dimensionKey() == null ? List.of() : f.dimensionKey();
        String metricKey = f == null ? null : f.metricKey();
        Instant start = f == null ? null : optionalTime("start_time", f.startTime());
        Instant end = f == null ? null : optionalTime("end_time", f.endTime());
        String query = request.q() == null ? "" : request.q().trim();
        double threshold = similarityThreshold(request.similarity());

        List<DimensionValueEntry> candidates = unitOfWork.read("search dimension values", conn -> {
            List<Long> dimensionIds = new ArrayList<>(catalogResolver.resolveDimensions(conn, dimensionKeys).values());
            Long metricId = metricKey == null || metricKey.isBlank() ? null
                    : catalogResolver.resolveMetric(conn, metricKey).metricId();
            return dimensionValueRepository.searchCandidates(conn, dimensionIds, metricId, start, end);
        });
        List<DimensionValueEntry> ranked = query.isEmpty() ? candidates : rank(candidates, query, threshold,
                entry -> List.of(new SearchScorer.Field(entry.value(), SearchScorer.WEIGHT_D)),
                DimensionValueEntry::value);
        List<DimensionValueItem> items = paging.slice(ranked).stream()
                .map(e -> new DimensionValueItem(e.dimensionKey(), e.valueId(), e.value()))
                .toList();
        return new PageResponse<>(items, paging.limit(), paging.offset());
    }

    // ==================== 打分排序 ====================

    /**
     * 按得分降序、自然键升序排序，未命中的候选被剔除
     */
    static <T> List<T> rank(List<T> candidates, String query, double threshold,
                            Function<T, List<SearchScorer.Field>> fields, Function<T, String> naturalKey) {
        Map<T, Double> scores = new LinkedHashMap<>();
        for (T candidate : candidates) {
            OptionalDouble score = SearchScorer.score(query, fields.apply(candidate), threshold);
            if (score.isPresent()) {
                scores.put(candidate, score.getAsDouble());
            }
        }
        List<T> ranked = new ArrayList<>(scores.keySet());
        ranked.sort(Comparator.<T>comparingDouble(scores::get).reversed()
                .thenComparing(naturalKey, Comparator.nullsFirst(Comparator.naturalOrder())));
        return ranked;
    }

    double similarityThreshold(Double requested) {
        if (requested == null) {
            return metricsConfig.getDefaultSimilarity();
        }
        if (requested < 0.0 || requested > 1.0) {
            throw new InvalidRequestException("similarity must be between 0 and 1");
        }
        return requested;
    }

    static List<String> searchFields(List<String> requested, Map<String, Double> allowed, List<String> defaults) {
        if (requested == null) {
            return defaults;
        }
        List<String> fields = requested.stream().filter(allowed::containsKey).distinct().toList();
        return fields.isEmpty() ? defaults : fields;
    }

    private static String metricField(MetricDefinition def, String name) {
        return switch (name) {
            case "metric_name" -> def.metricName();
            case "metric_type" -> def.metricType();
            default -> def.metricDescription();
        };
    }

    private static String dimensionField(DimensionDefinition def, String name) {
        return switch (name) {
            case "dimension_name" -> def.dimensionName();
            case "dimension_key" -> def.dimensionKey();
            default -> def.dimensionDescription();
        };
    }

    private static Instant optionalTime(String field, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return TimestampParser.parse(raw).orElseThrow(() -> new InvalidRequestException("invalid " + field + ": " + raw));
    }
}
