package com.talentscope.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.talentscope.search.common.RequestContext;
import com.talentscope.search.common.RequestContextHolder;

/**
 * Error envelope shared by every failing endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    Detail error,
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("request_id") String requestId
) {
    public static ErrorResponse of(String code, String message) {
        RequestContext context = RequestContextHolder.current().orElse(null);
        return new ErrorResponse(
            new Detail(code, message),
            context == null ? null : context.traceId(),
            context == null ? null : context.requestId()
        );
    }

    public record Detail(String code, String message) {
    }
}
