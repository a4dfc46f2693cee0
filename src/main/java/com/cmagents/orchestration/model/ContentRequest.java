package com.cmagents.orchestration.model;

import com.cmagents.orchestration.InvalidRequestException;
import lombok.Builder;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.List;

@Builder(toBuilder = true)
public record ContentRequest(
        String objective,
        String brandId,
        @Nullable String campaignId,
        int days,
        boolean build,
        boolean includeText,
        boolean styleRefPresent,
        int maxRetries,
        String constraints,
        List<String> productIds
) {

    public static final int MIN_DAYS = 1;
    public static final int MAX_DAYS = 14;

    public ContentRequest {
        if (!StringUtils.hasText(objective)) {
            throw new InvalidRequestException("Objective is required.");
        }
        if (!StringUtils.hasText(brandId)) {
            throw new InvalidRequestException("Brand id is required.");
        }
        if (days < MIN_DAYS || days > MAX_DAYS) {
            throw new InvalidRequestException("Days must be between " + MIN_DAYS + " and " + MAX_DAYS + ".");
        }
        if (maxRetries < 0) {
            throw new InvalidRequestException("maxRetries must be zero or positive.");
        }
        objective = objective.trim();
        brandId = brandId.trim();
        campaignId = StringUtils.hasText(campaignId) ? campaignId.trim() : null;
        constraints = constraints == null ? "" : constraints.trim();
        productIds = productIds == null ? List.of() : productIds.stream()
                .filter(StringUtils::hasText)
                .map(String::trim)
                .distinct()
                .toList();
    }

    /**
     * Objective and constraints together, as scanned for intent phrases.
     */
    public String freeText() {
        return constraints.isEmpty() ? objective : objective + "\n" + constraints;
    }

    public static class ContentRequestBuilder {
        private int days = 3;
        private boolean includeText = true;
        private int maxRetries = 1;
    }
}
