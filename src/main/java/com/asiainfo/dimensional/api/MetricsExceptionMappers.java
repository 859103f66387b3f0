package com.asiainfo.dimensional.api;

import com.asiainfo.dimensional.api.dto.ErrorResponse;
import com.asiainfo.dimensional.common.exception.ErrorKind;
import com.asiainfo.dimensional.common.exception.MetricsException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * 业务异常到 HTTP 响应的映射
 * NOT_FOUND -> 404，INVALID -> 400，CONFLICT -> 409，STORE_UNAVAILABLE -> 503
 */
public class MetricsExceptionMappers {

    private static final Logger log = LoggerFactory.getLogger(MetricsExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapMetricsException(MetricsException e) {
        if (e.getKind() == ErrorKind.STORE_UNAVAILABLE) {
            log.error("[API] store failure: {}", e.getDetail(), e);
        } else {
            log.debug("[API] {}: {}", e.getKind(), e.getDetail());
        }
        return Response.status(statusOf(e.getKind()))
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(e.getKind().name().toLowerCase(Locale.ROOT), e.getDetail()))
                .build();
    }

    static int statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> 404;
            case INVALID -> 400;
            case CONFLICT -> 409;
            case STORE_UNAVAILABLE -> 503;
        };
    }
}
