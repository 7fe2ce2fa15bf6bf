package com.tradezzz.unit.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

import com.tradezzz.domain.enums.RateLimitCategory;
import com.tradezzz.event.EventPublisherHelper;
import com.tradezzz.exception.RateLimitExceededException;
import com.tradezzz.ratelimit.ApiRateLimitInterceptor;
import com.tradezzz.ratelimit.InMemoryTierLookup;
import com.tradezzz.ratelimit.RateLimitGuard;
import com.tradezzz.ratelimit.RateLimited;
import com.tradezzz.ratelimit.RateLimiter;
import com.tradezzz.unit.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

/**
 * Tests for the two places the per-minute budgets are enforced: the HTTP interceptor for the
 * API category and the {@link RateLimited} aspect for annotated service methods.
 */
@ExtendWith(MockitoExtension.class)
class RateLimitEnforcementTest {

    private static final String USER = "user-1";

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private MutableClock clock;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        rateLimiter = new RateLimiter(new InMemoryTierLookup(), clock, eventPublisherHelper);
    }

    @Nested
    @DisplayName("API interceptor")
    class Interceptor {

        private ApiRateLimitInterceptor interceptor;

        @BeforeEach
        void setUp() {
            interceptor = new ApiRateLimitInterceptor(rateLimiter);
        }

        private MockHttpServletRequest request(String userId) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/trading/state");
            if (userId != null) {
                request.addHeader(ApiRateLimitInterceptor.USER_HEADER, userId);
            }
            return request;
        }

        @Test
        @DisplayName("Admitted requests carry the window headers")
        void headers() {
            MockHttpServletResponse response = new MockHttpServletResponse();

            assertThat(interceptor.preHandle(request(USER), response, new Object())).isTrue();

            assertThat(response.getHeader("X-RateLimit-Limit")).isEqualTo("60");
            assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("59");
            assertThat(response.getHeader("X-RateLimit-Reset")).isEqualTo("60");
        }

        @Test
        @DisplayName("The 61st request in a minute on FREE is refused with the wait time")
        void exhausted() {
            for (int i = 0; i < 60; i++) {
                interceptor.preHandle(request(USER), new MockHttpServletResponse(), new Object());
            }
            clock.advance(Duration.ofSeconds(20));

            MockHttpServletResponse response = new MockHttpServletResponse();
            assertThatThrownBy(() -> interceptor.preHandle(request(USER), response, new Object()))
                    .isInstanceOf(RateLimitExceededException.class)
                    .hasMessage("API rate limit exceeded. Retry after 40s");
            assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("0");
        }

        @Test
        @DisplayName("Anonymous and preflight requests are not metered")
        void unmetered() {
            MockHttpServletRequest preflight = request(USER);
            preflight.setMethod("OPTIONS");

            assertThat(interceptor.preHandle(request(null), new MockHttpServletResponse(), new Object())).isTrue();
            assertThat(interceptor.preHandle(preflight, new MockHttpServletResponse(), new Object())).isTrue();

            assertThat(rateLimiter.getStatus(USER).categories())
                    .filteredOn(status -> status.category() == RateLimitCategory.API)
                    .singleElement()
                    .satisfies(status -> assertThat(status.used()).isZero());
        }
    }

    @Nested
    @DisplayName("@RateLimited aspect")
    class Aspect {

        private OrderDesk desk;

        @BeforeEach
        void setUp() {
            AspectJProxyFactory factory = new AspectJProxyFactory(new OrderDesk());
            factory.setProxyTargetClass(true);
            factory.addAspect(new RateLimitGuard(rateLimiter));
            desk = factory.getProxy();
        }

        @Test
        @DisplayName("Calls are counted against the first String argument")
        void countsPerUser() {
            for (int i = 0; i < 10; i++) {
                assertThat(desk.place(USER, i)).isEqualTo("placed " + i);
            }

            assertThatThrownBy(() -> desk.place(USER, 10))
                    .isInstanceOf(RateLimitExceededException.class)
                    .hasMessageStartingWith("Rate limit exceeded for orders (10 per window)");
            verify(eventPublisherHelper).publishRateLimitExceeded(rateLimiter, USER, "orders");

            assertThat(desk.place("user-2", 0)).isEqualTo("placed 0");
        }

        @Test
        @DisplayName("Annotated methods without a user id fail loudly")
        void missingUserId() {
            assertThatThrownBy(() -> desk.anonymous(1))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("has no user id argument");
        }
    }

    public static class OrderDesk {

        @RateLimited(RateLimitCategory.ORDERS)
        public String place(String userId, int sequence) {
            return "placed " + sequence;
        }

        @RateLimited(RateLimitCategory.ORDERS)
        public String anonymous(int sequence) {
            return "placed " + sequence;
        }
    }
}
