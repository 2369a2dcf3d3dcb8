package me.internalizable.socialflood.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import me.internalizable.socialflood.ratelimit.RateLimitService;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Resolves the caller identity for every API request and publishes it as a request
 * attribute, along with the caller's current rate limit headers.
 *
 * Counting happens in the orchestrator, so this never consumes from the caller's allowance.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    public static final String IDENTITY_ATTRIBUTE = "socialflood.identity";
    public static final String API_KEY_HEADER = "X-API-Key";

    private final RateLimitService rateLimitService;

    public RateLimitInterceptor(RateLimitService rateLimitService) {
        this.rateLimitService = rateLimitService;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String identity = resolveIdentity(request);
        request.setAttribute(IDENTITY_ATTRIBUTE, identity);

        if (rateLimitService.isEnabled()) {
            RateLimitService.RateLimitInfo info = rateLimitService.getRateLimitInfo(identity);
            response.setHeader("X-RateLimit-Limit", String.valueOf(info.limit()));
            response.setHeader("X-RateLimit-Remaining", String.valueOf(info.remaining()));
        }
        return true;
    }

    /**
     * API key when present, otherwise the client address.
     */
    public static String resolveIdentity(HttpServletRequest request) {
        String apiKey = request.getHeader(API_KEY_HEADER);
        if (apiKey != null && !apiKey.isBlank()) {
            return "api_key:" + apiKey.trim();
        }
        return "ip:" + getClientIp(request);
    }

    private static String getClientIp(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }

        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp;
        }

        return request.getRemoteAddr();
    }
}
