package me.internalizable.socialflood.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Problem-style error body returned for orchestration failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
        String type,
        String title,
        int status,
        String detail,
        boolean success,
        Long retryAfter
) {

    private static final String TYPE_BASE = "https://socialflood.com/problems/";

    public static ApiErrorResponse rateLimited(String detail, long retryAfterSeconds) {
        return new ApiErrorResponse(TYPE_BASE + "rate_limit_exceeded", "Too Many Requests", 429, detail, false, retryAfterSeconds);
    }

    public static ApiErrorResponse badGateway(String detail) {
        return new ApiErrorResponse(TYPE_BASE + "upstream_error", "Bad Gateway", 502, detail, false, null);
    }

    public static ApiErrorResponse gatewayTimeout(String detail) {
        return new ApiErrorResponse(TYPE_BASE + "upstream_timeout", "Gateway Timeout", 504, detail, false, null);
    }

    public static ApiErrorResponse badRequest(String detail) {
        return new ApiErrorResponse(TYPE_BASE + "invalid_request", "Bad Request", 400, detail, false, null);
    }
}
