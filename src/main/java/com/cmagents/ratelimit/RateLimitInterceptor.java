package com.cmagents.ratelimit;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private final SlidingWindowRateLimiter requestRateLimiter;
    private final ClientIdentityResolver identityResolver;

    public RateLimitInterceptor(@Qualifier("requestRateLimiter") SlidingWindowRateLimiter requestRateLimiter,
                                ClientIdentityResolver identityResolver) {
        this.requestRateLimiter = requestRateLimiter;
        this.identityResolver = identityResolver;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String identity = identityResolver.resolve(request);
        if (!requestRateLimiter.check(identity)) {
            throw new CapacityExceededException("Rate limit exceeded. Try again later.");
        }
        return true;
    }
}
