package com.tradezzz.ratelimit;

import java.lang.reflect.Method;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * AOP aspect that enforces the {@link RateLimited} annotation.
 *
 * <p>Resolves the user id from the first String argument and counts the call against that
 * user's window before the method body runs. A method without a String argument is a
 * programming error and fails with {@link IllegalStateException}.
 */
@Aspect
@Component
public class RateLimitGuard {

    private static final Logger log = LoggerFactory.getLogger(RateLimitGuard.class);

    private final RateLimiter rateLimiter;

    public RateLimitGuard(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Around("@annotation(com.tradezzz.ratelimit.RateLimited)")
    public Object guardRateLimit(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        RateLimited annotation = method.getAnnotation(RateLimited.class);

        String userId = resolveUserId(joinPoint.getArgs(), method);
        RateLimitResult result = rateLimiter.enforce(userId, annotation.value());
        log.debug(
                "Method {} admitted for user {}: {} {} remaining",
                method.getName(),
                userId,
                result.getRemaining(),
                annotation.value());

        return joinPoint.proceed();
    }

    private String resolveUserId(Object[] args, Method method) {
        for (Object arg : args) {
            if (arg instanceof String userId) {
                return userId;
            }
        }
        throw new IllegalStateException("@RateLimited method " + method.getName() + " has no user id argument");
    }
}
