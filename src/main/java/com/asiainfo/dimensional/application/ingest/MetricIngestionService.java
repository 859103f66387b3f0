package com.asiainfo.dimensional.application.ingest;

import com.asiainfo.dimensional.common.config.MetricsConfig;
import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import com.asiainfo.dimensional.common.exception.MetricsException;
import com.asiainfo.dimensional.common.util.TextNormalizer;
import com.asiainfo.dimensional.domain.model.DimensionDraft;
import com.asiainfo.dimensional.domain.model.DimensionPair;
import com.asiainfo.dimensional.domain.model.ObservationDraft;
import com.asiainfo.dimensional.domain.model.ObservationDraft.ObservationKey;
import com.asiainfo.dimensional.domain.model.SeriesKey;
import com.asiainfo.dimensional.infrastructure.cache.QueryResultCache;
import com.asiainfo.dimensional.infrastructure.persistence.CatalogRepository;
import com.asiainfo.dimensional.infrastructure.persistence.DimensionSetStore;
import com.asiainfo.dimensional.infrastructure.persistence.DimensionValueRepository;
import com.asiainfo.dimensional.infrastructure.persistence.DimensionValueRepository.ValueKey;
import com.asiainfo.dimensional.infrastructure.persistence.IdAssignment;
import com.asiainfo.dimensional.infrastructure.persistence.ObservationRepository;
import com.asiainfo.dimensional.infrastructure.persistence.SeriesRepository;
import com.asiainfo.dimensional.infrastructure.persistence.UnitOfWork;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * CSV 批量入库
 * <p>
 * 流程：解析表头 -> 逐行校验 -> 按指标归并目录字段 -> 单事务写入
 * （指标/维度定义 -> 维度取值 -> 维度集合 -> 序列 -> 观测值）。
 * 任一步失败整体回滚；已存在的观测值跳过不覆盖。
 *
 * @author QvQ
 * @date 2026/10/14
 */
@ApplicationScoped
public class MetricIngestionService {

    private static final Logger log = LoggerFactory.getLogger(MetricIngestionService.class);

    @Inject
    UnitOfWork unitOfWork;

    @Inject
    CatalogRepository catalogRepository;

    @Inject
    DimensionValueRepository dimensionValueRepository;

    @Inject
    DimensionSetStore dimensionSetStore;

    @Inject
    SeriesRepository seriesRepository;

    @Inject
    ObservationRepository observationRepository;

    @Inject
    QueryResultCache queryResultCache;

    @Inject
    MetricsConfig metricsConfig;

    @Inject
    MeterRegistry registry;

    /**
     * 上传入口：校验文件名与大小后入库
     */
    public IngestionReport upload(String fileName, byte[] content) {
        if (fileName == null || !fileName.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            reject("not a csv file");
            throw new InvalidRequestException("only .csv uploads are supported");
        }
        if (content == null || content.length == 0) {
            reject("empty file");
            throw new InvalidRequestException("uploaded file is empty");
        }
        if (content.length > metricsConfig.getUploadMaxBytes()) {
            reject("file too large");
            throw new InvalidRequestException("uploaded file exceeds " + metricsConfig.getUploadMaxBytes() + " bytes");
        }
        return ingest(content);
    }

    /**
     * 解析、校验并单事务写入
     */
    public IngestionReport ingest(byte[] content) {
        long start = System.currentTimeMillis();
        ValidatedUpload upload;
        try {
            upload = UploadValidator.validate(CsvUploadReader.read(content));
        } catch (MetricsException e) {
            reject(e.getDetail());
            throw e;
        }

        IngestionReport report;
        try {
            report = unitOfWork.write("csv ingestion", conn -> persist(conn, upload));
        } catch (MetricsException e) {
            reject(e.getDetail());
            throw e;
        }

        queryResultCache.bumpVersion();
        registry.counter("metrics.ingest.rows").increment(report.rows());
        registry.counter("metrics.ingest.observations.inserted").increment(report.observationsInserted());
        log.info("[Ingest] {} rows in {} ms: metrics {}/{}, series {}/{}, observations inserted={}, skipped={}",
                report.rows(), System.currentTimeMillis() - start,
                report.metricsCreated(), report.metricsMatched(),
                report.seriesCreated(), report.seriesMatched(),
                report.observationsInserted(), report.observationsSkipped());
        return report;
    }

    IngestionReport persist(Connection conn, ValidatedUpload upload) throws SQLException {
        // 1. 目录 upsert
        IdAssignment<String> metricIds = catalogRepository.upsertMetrics(conn, upload.metrics());
        List<DimensionDraft> dimensionDrafts = upload.dimensionKeys().stream()
                .map(key -> new DimensionDraft(key, TextNormalizer.displayName(key)))
                .toList();
        IdAssignment<String> dimensionIds = catalogRepository.upsertDimensions(conn, dimensionDrafts);

        // 2. 维度取值
        Map<Long, Set<String>> valuesByDimension = new LinkedHashMap<>();
        for (UploadRow row : upload.rows()) {
            row.dimensions().forEach((key, value) -> valuesByDimension
                    .computeIfAbsent(dimensionIds.idOf(key), k -> new LinkedHashSet<>())
                    .add(value));
        }
        IdAssignment<ValueKey> valueIds = dimensionValueRepository.ensureValues(conn, valuesByDimension);

        // 3. 维度集合：整个文件先在内存中按 hash 去重
        Map<String, List<DimensionPair>> setsByHash = new LinkedHashMap<>();
        for (UploadRow row : upload.rows()) {
            setsByHash.computeIfAbsent(row.setHash(), h -> pairsOf(row, dimensionIds, valueIds));
        }
        IdAssignment<String> setIds = dimensionSetStore.resolveAll(conn, setsByHash);

        // 4. 序列
        Map<UploadRow, SeriesKey> seriesKeyByRow = new HashMap<>();
        for (UploadRow row : upload.rows()) {
            seriesKeyByRow.put(row, new SeriesKey(metricIds.idOf(row.metricKey()), row.grain(),
                    setIds.idOf(row.setHash())));
        }
        IdAssignment<SeriesKey> seriesIds = seriesRepository.ensureSeries(conn, new LinkedHashSet<>(seriesKeyByRow.values()));

        // 5. 观测值：已存在的跳过
        List<ObservationDraft> drafts = new ArrayList<>();
        for (UploadRow row : upload.rows()) {
            drafts.add(new ObservationDraft(seriesIds.idOf(seriesKeyByRow.get(row)), row.timeStartTs(),
                    row.timeEndTs(), row.valueNum(), row.sampleSize(), row.isEstimated()));
        }
        Set<ObservationKey> existing = observationRepository.findExisting(conn,
                drafts.stream().map(ObservationDraft::key).toList());
        List<ObservationDraft> fresh = drafts.stream().filter(d -> !existing.contains(d.key())).toList();
        observationRepository.insertAll(conn, fresh);

        return new IngestionReport(
                upload.rows().size(),
                metricIds.created(), metricIds.matched(),
                dimensionIds.created(), dimensionIds.matched(),
                valueIds.created(), valueIds.matched(),
                setIds.created(), setIds.matched(),
                seriesIds.created(), seriesIds.matched(),
                fresh.size(), drafts.size() - fresh.size());
    }

    private static List<DimensionPair> pairsOf(UploadRow row, IdAssignment<String> dimensionIds,
                                               IdAssignment<ValueKey> valueIds) {
        List<DimensionPair> pairs = new ArrayList<>();
        row.dimensions().forEach((key, value) -> {
            long dimensionId = dimensionIds.idOf(key);
            pairs.add(new DimensionPair(key, dimensionId, value, valueIds.idOf(new ValueKey(dimensionId, value))));
        });
        return pairs;
    }

    private void reject(String reason) {
        registry.counter("metrics.ingest.rejected").increment();
        log.warn("[Ingest] upload rejected: {}", reason);
    }
}
