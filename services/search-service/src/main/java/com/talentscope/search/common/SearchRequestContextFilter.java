package com.talentscope.search.common;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds request and trace ids for the duration of a call, echoes them as response headers and
 * writes the access log line.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class SearchRequestContextFilter extends OncePerRequestFilter {
    static final String REQUEST_ID_HEADER = "x-request-id";
    static final String TRACE_ID_HEADER = "x-trace-id";

    private static final Logger accessLog = LoggerFactory.getLogger(SearchRequestContextFilter.class);

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        RequestContext context = new RequestContext(
            IdGenerator.resolveRequestId(request.getHeader(REQUEST_ID_HEADER)),
            IdGenerator.resolveTraceId(request.getHeader(TRACE_ID_HEADER)),
            System.nanoTime()
        );
        RequestContextHolder.bind(context);
        response.setHeader(REQUEST_ID_HEADER, context.requestId());
        response.setHeader(TRACE_ID_HEADER, context.traceId());
        try {
            filterChain.doFilter(request, response);
        } finally {
            accessLog.info(
                "{} {} status={} latency_ms={} request_id={} trace_id={}",
                request.getMethod(),
                request.getRequestURI(),
                response.getStatus(),
                context.elapsedMs(),
                context.requestId(),
                context.traceId()
            );
            RequestContextHolder.unbind();
        }
    }
}
