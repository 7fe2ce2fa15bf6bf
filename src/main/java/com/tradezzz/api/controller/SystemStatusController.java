package com.tradezzz.api.controller;

import com.tradezzz.exception.ResourceNotFoundException;
import com.tradezzz.ratelimit.ApiRateLimitInterceptor;
import com.tradezzz.ratelimit.ExchangeCallStatus;
import com.tradezzz.ratelimit.RateLimitStatus;
import com.tradezzz.ratelimit.RateLimiter;
import com.tradezzz.resilience.CircuitBreaker;
import com.tradezzz.resilience.CircuitBreakerRegistry;
import com.tradezzz.resilience.CircuitBreakerStats;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Rate-limit usage and circuit breaker state.
 */
@RestController
@RequestMapping("/api/system")
public class SystemStatusController {

    private static final Logger log = LoggerFactory.getLogger(SystemStatusController.class);

    private final RateLimiter rateLimiter;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public SystemStatusController(RateLimiter rateLimiter, CircuitBreakerRegistry circuitBreakerRegistry) {
        this.rateLimiter = rateLimiter;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    @GetMapping("/rate-limits")
    public ResponseEntity<RateLimitStatus> getRateLimits(@RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        return ResponseEntity.ok(rateLimiter.getStatus(userId));
    }

    @GetMapping("/rate-limits/exchange/{exchange}")
    public ResponseEntity<ExchangeCallStatus> getExchangeBudget(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId, @PathVariable String exchange) {
        return ResponseEntity.ok(rateLimiter.getExchangeStatus(userId, exchange.toLowerCase()));
    }

    @GetMapping("/usage")
    public ResponseEntity<Map<String, Integer>> getDailyUsage(@RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        return ResponseEntity.ok(rateLimiter.getDailyUsage(userId));
    }

    @GetMapping("/circuit-breakers")
    public ResponseEntity<Map<String, CircuitBreakerStats>> getCircuitBreakers() {
        return ResponseEntity.ok(circuitBreakerRegistry.getAllStats());
    }

    @PostMapping("/circuit-breakers/{name}/reset")
    public ResponseEntity<CircuitBreakerStats> resetCircuitBreaker(@PathVariable String name) {
        CircuitBreaker breaker = circuitBreakerRegistry.get(name)
                .orElseThrow(() -> new ResourceNotFoundException("Circuit breaker", name));
        breaker.reset();
        log.info("Circuit breaker {} reset via API", name);
        return ResponseEntity.ok(breaker.getStats());
    }
}
