package com.cmagents.brand;

import java.util.Optional;

/**
 * Read access to brand configuration.
 */
public interface BrandCatalog {

    /**
     * Loads a brand.
     *
     * @param brandId The brand slug.
     * @return The brand profile, or empty if the brand is unknown or unreadable.
     */
    Optional<BrandProfile> find(String brandId);
}
