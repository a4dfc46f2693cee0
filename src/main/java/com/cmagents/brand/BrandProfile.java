package com.cmagents.brand;

import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brand facts the orchestrator and the built-in workers rely on.
 *
 * @param products product id to display name, in catalog order
 */
public record BrandProfile(
        String id,
        String name,
        @Nullable String industry,
        List<String> preferredStyles,
        List<String> avoidStyles,
        Map<String, String> products,
        int referenceCount
) {

    public static final String KEY_BRAND = "brand";
    public static final String KEY_NAME = "name";
    public static final String KEY_INDUSTRY = "industry";
    public static final String KEY_PREFERRED_STYLES = "preferred_styles";
    public static final String KEY_AVOID_STYLES = "avoid_styles";
    public static final String KEY_PRODUCTS = "products";
    public static final String KEY_REFERENCES = "references";

    public BrandProfile {
        preferredStyles = preferredStyles == null ? List.of() : List.copyOf(preferredStyles);
        avoidStyles = avoidStyles == null ? List.of() : List.copyOf(avoidStyles);
        products = products == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(products));
    }

    public static BrandProfile unknown(String brandId) {
        return new BrandProfile(brandId, brandId, null, List.of(), List.of(), Map.of(), 0);
    }

    public boolean hasReferences() {
        return referenceCount > 0;
    }

    /**
     * Opaque configuration handed to workers.
     */
    public Map<String, Object> asContext() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(KEY_BRAND, id);
        context.put(KEY_NAME, name);
        context.put(KEY_INDUSTRY, industry == null ? "generic" : industry);
        context.put(KEY_PREFERRED_STYLES, preferredStyles);
        context.put(KEY_AVOID_STYLES, avoidStyles);
        context.put(KEY_PRODUCTS, products);
        context.put(KEY_REFERENCES, referenceCount);
        return context;
    }
}
