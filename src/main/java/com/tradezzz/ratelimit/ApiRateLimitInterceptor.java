package com.tradezzz.ratelimit;

import com.tradezzz.domain.enums.RateLimitCategory;
import com.tradezzz.exception.RateLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies the per-minute API budget to every {@code /api/**} request that carries a user id and
 * exposes the window as {@code X-RateLimit-*} headers.
 *
 * <p>Denials are raised as {@link com.tradezzz.exception.RateLimitExceededException} so the
 * global handler renders them (429 with {@code Retry-After}).
 */
@Component
public class ApiRateLimitInterceptor implements HandlerInterceptor {

    public static final String USER_HEADER = "X-User-Id";

    private final RateLimiter rateLimiter;

    public ApiRateLimitInterceptor(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String userId = request.getHeader(USER_HEADER);
        if (userId == null || userId.isBlank()) {
            return true;
        }

        RateLimitResult result = rateLimiter.consume(userId, RateLimitCategory.API);
        response.setHeader("X-RateLimit-Limit", String.valueOf(result.getLimit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(result.getRemaining()));
        response.setHeader("X-RateLimit-Reset", String.valueOf(result.getReset()));

        if (!result.isAllowed()) {
            throw new RateLimitExceededException(
                    "API rate limit exceeded. Retry after " + result.getRetryAfter() + "s",
                    "api",
                    result.getLimit(),
                    result.getRetryAfter());
        }
        return true;
    }
}
