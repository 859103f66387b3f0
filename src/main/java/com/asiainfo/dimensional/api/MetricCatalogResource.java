package com.asiainfo.dimensional.api;

import com.asiainfo.dimensional.api.dto.MetricSearchRequest;
import com.asiainfo.dimensional.api.dto.PageResponse;
import com.asiainfo.dimensional.api.dto.QueryResponses.AvailabilityResponse;
import com.asiainfo.dimensional.api.dto.QueryResponses.FreshnessResponse;
import com.asiainfo.dimensional.application.catalog.CatalogQueryService;
import com.asiainfo.dimensional.application.catalog.Paging;
import com.asiainfo.dimensional.application.ingest.IngestionReport;
import com.asiainfo.dimensional.application.ingest.MetricIngestionService;
import com.asiainfo.dimensional.application.query.MetricQueryService;
import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import com.asiainfo.dimensional.common.exception.StoreUnavailableException;
import com.asiainfo.dimensional.common.util.TextNormalizer;
import com.asiainfo.dimensional.domain.model.MetricCriteria;
import com.asiainfo.dimensional.domain.model.MetricDefinition;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.jboss.resteasy.reactive.RestForm;
import org.jboss.resteasy.reactive.multipart.FileUpload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;

/**
 * 指标目录 REST API
 * 列表、详情、检索、数据覆盖范围、新鲜度与 CSV 上传
 */
@ApplicationScoped
@Path("/v1/metrics")
@Produces(MediaType.APPLICATION_JSON)
public class MetricCatalogResource {

    private static final Logger log = LoggerFactory.getLogger(MetricCatalogResource.class);

    @Inject
    CatalogQueryService catalogQueryService;

    @Inject
    MetricQueryService queryService;

    @Inject
    MetricIngestionService ingestionService;

    /**
     * 指标列表，各过滤参数可重复或用 "|" 分隔多个取值
     */
    @GET
    public PageResponse<MetricDefinition> list(@QueryParam("metric_id") List<String> metricId,
                                               @QueryParam("metric_key") List<String> metricKey,
                                               @QueryParam("metric_name") List<String> metricName,
                                               @QueryParam("metric_type") List<String> metricType,
                                               @QueryParam("unit") List<String> unit,
                                               @QueryParam("directionality") List<String> directionality,
                                               @QueryParam("aggregation") List<String> aggregation,
                                               @QueryParam("is_active") @DefaultValue("true") Boolean isActive,
                                               @QueryParam("limit") Integer limit,
                                               @QueryParam("offset") Integer offset) {
        MetricCriteria criteria = new MetricCriteria(
                parseIds(TextNormalizer.splitPipes(metricId)),
                TextNormalizer.splitPipes(metricKey),
                TextNormalizer.splitPipes(metricName),
                TextNormalizer.splitPipes(metricType),
                TextNormalizer.splitPipes(unit),
                TextNormalizer.splitPipes(directionality),
                TextNormalizer.splitPipes(aggregation),
                isActive == null ? null : List.of(isActive));
        return catalogQueryService.listMetrics(criteria, Paging.of(limit, offset));
    }

    @GET
    @Path("/{metric_key}")
    public MetricDefinition get(@PathParam("metric_key") String metricKey) {
        return catalogQueryService.getMetric(metricKey);
    }

    @POST
    @Path("/search")
    @Consumes(MediaType.APPLICATION_JSON)
    public PageResponse<MetricDefinition> search(MetricSearchRequest request) {
        if (request == null) {
            throw new InvalidRequestException("request body is required");
        }
        return catalogQueryService.searchMetrics(request);
    }

    @GET
    @Path("/{metric_key}/availability")
    public AvailabilityResponse availability(@PathParam("metric_key") String metricKey,
                                             @QueryParam("grain") String grain,
                                             @QueryParam("dimensions") List<String> dimensions) {
        return queryService.availability(metricKey, grain, dimensions);
    }

    @GET
    @Path("/{metric_key}/freshness")
    public FreshnessResponse freshness(@PathParam("metric_key") String metricKey,
                                       @QueryParam("grain") String grain,
                                       @QueryParam("dimensions") List<String> dimensions) {
        return queryService.freshness(metricKey, grain, dimensions);
    }

    /**
     * CSV 上传（multipart 字段 file）
     */
    @POST
    @Path("/upload")
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    public IngestionReport upload(@RestForm("file") FileUpload file) {
        if (file == null) {
            throw new InvalidRequestException("multipart field 'file' is required");
        }
        log.info("[Ingest] upload received: {} ({} bytes)", file.fileName(), file.size());
        byte[] content;
        try {
            content = Files.readAllBytes(file.uploadedFile());
        } catch (IOException e) {
            throw new StoreUnavailableException("unable to read uploaded file: " + e.getMessage(), e);
        }
        return ingestionService.upload(file.fileName(), content);
    }

    private static List<Long> parseIds(List<String> raw) {
        try {
            return raw.stream().map(Long::parseLong).toList();
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("metric_id must be numeric: " + raw);
        }
    }
}
