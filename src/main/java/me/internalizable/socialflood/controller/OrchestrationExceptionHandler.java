package me.internalizable.socialflood.controller;

import me.internalizable.socialflood.dto.ApiErrorResponse;
import me.internalizable.socialflood.orchestrator.OrchestrationTimeoutException;
import me.internalizable.socialflood.orchestrator.RateLimitedException;
import me.internalizable.socialflood.orchestrator.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps orchestration failures raised by endpoint handlers to HTTP responses.
 */
@RestControllerAdvice
public class OrchestrationExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(OrchestrationExceptionHandler.class);

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ApiErrorResponse> handleRateLimited(RateLimitedException e) {
        long retryAfter = e.getRetryAfterSeconds();
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter))
                .header("X-RateLimit-Reset", String.valueOf(retryAfter))
                .body(ApiErrorResponse.rateLimited(e.getMessage(), retryAfter));
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ApiErrorResponse> handleUpstream(UpstreamException e) {
        logger.warn("Upstream failure for {}: {}", e.getOperation(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ApiErrorResponse.badGateway(e.getMessage()));
    }

    @ExceptionHandler(OrchestrationTimeoutException.class)
    public ResponseEntity<ApiErrorResponse> handleTimeout(OrchestrationTimeoutException e) {
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(ApiErrorResponse.gatewayTimeout(e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .body(ApiErrorResponse.badRequest(e.getMessage()));
    }
}
