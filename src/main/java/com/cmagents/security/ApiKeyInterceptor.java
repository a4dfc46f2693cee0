package com.cmagents.security;

import com.cmagents.config.CampaignAgentsProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Requires the configured key in {@code X-API-Key} on REST calls. Does nothing while no
 * key is configured.
 */
@Component
@Slf4j
public class ApiKeyInterceptor implements HandlerInterceptor {

    public static final String HEADER = "X-API-Key";

    private final CampaignAgentsProperties properties;

    public ApiKeyInterceptor(CampaignAgentsProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String expected = properties.getApiKey();
        if (!StringUtils.hasText(expected)) {
            return true;
        }
        String presented = request.getHeader(HEADER);
        if (!StringUtils.hasText(presented)) {
            throw new ApiKeyRequiredException("API key required");
        }
        // constant-time comparison
        if (!MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected {} {} with an invalid API key", request.getMethod(), request.getRequestURI());
            throw new ApiKeyRequiredException("Invalid API key");
        }
        return true;
    }
}
