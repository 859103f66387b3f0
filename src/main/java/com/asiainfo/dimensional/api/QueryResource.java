package com.asiainfo.dimensional.api;

import com.asiainfo.dimensional.api.dto.MetricQueryRequest;
import com.asiainfo.dimensional.api.dto.QueryResponses.AggregateResponse;
import com.asiainfo.dimensional.api.dto.QueryResponses.LatestResponse;
import com.asiainfo.dimensional.api.dto.QueryResponses.TimeseriesResponse;
import com.asiainfo.dimensional.api.dto.QueryResponses.TopKResponse;
import com.asiainfo.dimensional.api.dto.TopKQueryRequest;
import com.asiainfo.dimensional.application.query.MetricQueryService;
import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 指标查询 REST API
 * 时序、聚合、Top-K 与最新值查询
 */
@ApplicationScoped
@Path("/v1/query")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class QueryResource {

    private static final Logger log = LoggerFactory.getLogger(QueryResource.class);

    @Inject
    MetricQueryService queryService;

    @POST
    @Path("/timeseries")
    public TimeseriesResponse timeseries(MetricQueryRequest request) {
        log.info("[Query] timeseries request: {}", request);
        return queryService.timeseries(requireBody(request));
    }

    @POST
    @Path("/aggregate")
    public AggregateResponse aggregate(MetricQueryRequest request) {
        log.info("[Query] aggregate request: {}", request);
        return queryService.aggregate(requireBody(request));
    }

    @POST
    @Path("/topk")
    public TopKResponse topK(TopKQueryRequest request) {
        log.info("[Query] top-k request: {}", request);
        return queryService.topK(requireBody(request));
    }

    /**
     * 最新观测
     *
     * @param dimensions dimension_id:value_id[|value_id] 形式的过滤条件，可重复
     */
    @GET
    @Path("/latest")
    public LatestResponse latest(@QueryParam("metric_key") String metricKey,
                                 @QueryParam("grain") String grain,
                                 @QueryParam("dimensions") List<String> dimensions) {
        if (metricKey == null || metricKey.isBlank()) {
            throw new InvalidRequestException("metric_key is required");
        }
        return queryService.latest(metricKey, grain, dimensions);
    }

    private static <T> T requireBody(T request) {
        if (request == null) {
            throw new InvalidRequestException("request body is required");
        }
        return request;
    }
}
