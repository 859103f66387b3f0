package com.asiainfo.dimensional.api;

import com.asiainfo.dimensional.api.dto.DimensionSearchRequest;
import com.asiainfo.dimensional.api.dto.DimensionValueItem;
import com.asiainfo.dimensional.api.dto.DimensionValueSearchRequest;
import com.asiainfo.dimensional.api.dto.DimensionValuesResponse;
import com.asiainfo.dimensional.api.dto.PageResponse;
import com.asiainfo.dimensional.application.catalog.CatalogQueryService;
import com.asiainfo.dimensional.application.catalog.Paging;
import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import com.asiainfo.dimensional.domain.model.DimensionDefinition;
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

/**
 * 维度目录 REST API
 */
@ApplicationScoped
@Path("/v1/dimensions")
@Produces(MediaType.APPLICATION_JSON)
public class DimensionCatalogResource {

    @Inject
    CatalogQueryService catalogQueryService;

    @GET
    public PageResponse<DimensionDefinition> list(@QueryParam("is_active") @DefaultValue("true") Boolean isActive,
                                                  @QueryParam("limit") Integer limit,
                                                  @QueryParam("offset") Integer offset) {
        return catalogQueryService.listDimensions(isActive, Paging.of(limit, offset));
    }

    @GET
    @Path("/{dimension_key}")
    public DimensionDefinition get(@PathParam("dimension_key") String dimensionKey) {
        return catalogQueryService.getDimension(dimensionKey);
    }

    /**
     * 维度取值，可按指标和观测时间 [start_time, end_time) 限定
     */
    @GET
    @Path("/{dimension_key}/values")
    public DimensionValuesResponse values(@PathParam("dimension_key") String dimensionKey,
                                          @QueryParam("metric_key") String metricKey,
                                          @QueryParam("start_time") String startTime,
                                          @QueryParam("end_time") String endTime,
                                          @QueryParam("limit") Integer limit,
                                          @QueryParam("offset") Integer offset) {
        return catalogQueryService.dimensionValues(dimensionKey, metricKey, startTime, endTime,
                Paging.of(limit, offset));
    }

    @POST
    @Path("/search")
    @Consumes(MediaType.APPLICATION_JSON)
    public PageResponse<DimensionDefinition> search(DimensionSearchRequest request) {
        if (request == null) {
            throw new InvalidRequestException("request body is required");
        }
        return catalogQueryService.searchDimensions(request);
    }

    @POST
    @Path("/values/search")
    @Consumes(MediaType.APPLICATION_JSON)
    public PageResponse<DimensionValueItem> searchValues(DimensionValueSearchRequest request) {
        if (request == null) {
            throw new InvalidRequestException("request body is required");
        }
        return catalogQueryService.searchDimensionValues(request);
    }
}
