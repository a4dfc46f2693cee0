package com.cmagents.config;

import com.cmagents.ratelimit.SlidingWindowRateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RateLimitConfig {

    @Bean
    public SlidingWindowRateLimiter requestRateLimiter(CampaignAgentsProperties properties, Clock clock) {
        CampaignAgentsProperties.RateLimitConfig config = properties.getRateLimit();
        return new SlidingWindowRateLimiter("requests", config.getRequestsPerMinute(), config.getWindow(), clock);
    }

    @Bean
    public SlidingWindowRateLimiter messageRateLimiter(CampaignAgentsProperties properties, Clock clock) {
        CampaignAgentsProperties.RateLimitConfig config = properties.getRateLimit();
        return new SlidingWindowRateLimiter("messages", config.getMessagesPerMinute(), config.getWindow(), clock);
    }
}
