package com.cmagents.session;

import com.cmagents.ratelimit.SlidingWindowRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic liveness probing, idle eviction and limiter housekeeping.
 */
@Component
@Slf4j
public class SessionMaintenanceTask {

    private final SessionRegistry sessionRegistry;
    private final SlidingWindowRateLimiter requestRateLimiter;
    private final SlidingWindowRateLimiter messageRateLimiter;

    public SessionMaintenanceTask(SessionRegistry sessionRegistry,
                                  @Qualifier("requestRateLimiter") SlidingWindowRateLimiter requestRateLimiter,
                                  @Qualifier("messageRateLimiter") SlidingWindowRateLimiter messageRateLimiter) {
        this.sessionRegistry = sessionRegistry;
        this.requestRateLimiter = requestRateLimiter;
        this.messageRateLimiter = messageRateLimiter;
    }

    @Scheduled(fixedDelayString = "${cmagents.sessions.ping-interval:PT30S}",
            initialDelayString = "${cmagents.sessions.ping-interval:PT30S}")
    public void probeConnections() {
        sessionRegistry.probeConnections();
    }

    // Runs at the probe cadence so sessions leave shortly after their grace expires.
    @Scheduled(fixedDelayString = "${cmagents.sessions.ping-interval:PT30S}",
            initialDelayString = "${cmagents.sessions.ping-interval:PT30S}")
    public void evictIdleSessions() {
        sessionRegistry.evictIdle();
    }

    @Scheduled(fixedDelayString = "${cmagents.rate-limit.purge-interval:PT5M}",
            initialDelayString = "${cmagents.rate-limit.purge-interval:PT5M}")
    public void purgeRateLimiters() {
        int purged = requestRateLimiter.purgeIdle() + messageRateLimiter.purgeIdle();
        if (purged > 0) {
            log.debug("Purged {} idle rate limit windows", purged);
        }
    }
}
