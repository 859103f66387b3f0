package com.asiainfo.dimensional.api;

import com.asiainfo.dimensional.infrastructure.cache.QueryResultCache;
import com.asiainfo.dimensional.infrastructure.persistence.UnitOfWork;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 健康检查：存储可达返回 200，否则 503
 */
@ApplicationScoped
@Path("/health")
@Produces(MediaType.APPLICATION_JSON)
public class HealthResource {

    @Inject
    UnitOfWork unitOfWork;

    @Inject
    QueryResultCache queryResultCache;

    @GET
    public Response health() {
        boolean reachable = unitOfWork.isReachable();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", reachable ? "ok" : "unavailable");
        body.put("store", reachable ? "reachable" : "unreachable");
        body.put("data_version", queryResultCache.currentVersion());
        body.put("query_cache", queryResultCache.getStats());
        return Response.status(reachable ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE)
                .entity(body)
                .build();
    }
}
