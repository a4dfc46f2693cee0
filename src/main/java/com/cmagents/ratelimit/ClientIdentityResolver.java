package com.cmagents.ratelimit;

import com.cmagents.config.CampaignAgentsProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the rate-limit identity of an HTTP caller. The transport peer address is
 * used unless forwarded headers are explicitly trusted.
 */
@Component
public class ClientIdentityResolver {

    static final String FORWARDED_FOR = "X-Forwarded-For";

    private final CampaignAgentsProperties properties;

    public ClientIdentityResolver(CampaignAgentsProperties properties) {
        this.properties = properties;
    }

    public String resolve(HttpServletRequest request) {
        if (properties.getRateLimit().isTrustForwardedHeader()) {
            String forwarded = request.getHeader(FORWARDED_FOR);
            if (StringUtils.hasText(forwarded)) {
                String first = forwarded.split(",")[0].trim();
                if (!first.isEmpty()) {
                    return first;
                }
            }
        }
        String remote = request.getRemoteAddr();
        return StringUtils.hasText(remote) ? remote : "unknown";
    }
}
