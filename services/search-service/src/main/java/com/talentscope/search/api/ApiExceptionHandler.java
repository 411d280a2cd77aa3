package com.talentscope.search.api;

import com.talentscope.search.api.dto.ErrorResponse;
import com.talentscope.search.common.RequestContext;
import com.talentscope.search.common.RequestContextHolder;
import com.talentscope.search.ratelimit.RateLimitExceededException;
import com.talentscope.search.security.UnauthorizedException;
import com.talentscope.search.validation.InvalidSearchRequestException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidSearchRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidSearchRequestException ex) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", "invalid JSON");
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException ex) {
        return respond(HttpStatus.UNAUTHORIZED, "unauthorized", ex.getMessage());
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimited(RateLimitExceededException ex) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
            .body(ErrorResponse.of("rate_limit_exceeded", "Too many requests"));
    }

    /**
     * Store failures, deadline overruns and anything else unexpected. Details stay in the log.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        RequestContext context = RequestContextHolder.current().orElse(null);
        logger.error(
            "unexpected_exception request_id={} trace_id={} method={} path={}",
            context == null ? null : context.requestId(),
            context == null ? null : context.traceId(),
            request.getMethod(),
            request.getRequestURI(),
            ex
        );
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(code, message));
    }
}
