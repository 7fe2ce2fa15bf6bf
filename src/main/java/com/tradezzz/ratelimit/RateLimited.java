package com.tradezzz.ratelimit;

import com.tradezzz.domain.enums.RateLimitCategory;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Counts each invocation against the caller's fixed-window budget for {@link #value()}.
 *
 * <p>The first {@code String} argument of the annotated method is the user id. Enforced by
 * {@link RateLimitGuard}; an exhausted window raises
 * {@link com.tradezzz.exception.RateLimitExceededException}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimited {

    RateLimitCategory value();
}
