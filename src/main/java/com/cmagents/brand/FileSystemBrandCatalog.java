package com.cmagents.brand;

import com.cmagents.config.CampaignAgentsProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads brands from {@code <root>/<brand>/brand.json}, with reference images under
 * {@code references/} and products under {@code products/<product>/}.
 */
@Component
@Slf4j
public class FileSystemBrandCatalog implements BrandCatalog {

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "webp");

    private final Path root;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileSystemBrandCatalog(CampaignAgentsProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getBrands().getRoot()), objectMapper);
    }

    public FileSystemBrandCatalog(Path root, ObjectMapper objectMapper) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<BrandProfile> find(String brandId) {
        if (!StringUtils.hasText(brandId)) {
            return Optional.empty();
        }
        Path brandDir = root.resolve(brandId).normalize();
        if (!brandDir.startsWith(root) || !Files.isDirectory(brandDir)) {
            return Optional.empty();
        }
        Path brandFile = brandDir.resolve("brand.json");
        JsonNode brand = objectMapper.createObjectNode();
        if (Files.isRegularFile(brandFile)) {
            try {
                brand = objectMapper.readTree(brandFile.toFile());
            } catch (IOException ex) {
                log.warn("Failed to read brand {}: {}", brandId, ex.getMessage());
                return Optional.empty();
            }
        }
        JsonNode style = brand.path("style");
        return Optional.of(new BrandProfile(
                brandId,
                brand.path("name").asText(brandId),
                brand.hasNonNull("industry") ? brand.get("industry").asText() : null,
                texts(style.path("preferred_design_styles")),
                texts(style.path("avoid")),
                products(brandDir.resolve("products")),
                countImages(brandDir.resolve("references"))));
    }

    private List<String> texts(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> {
                if (StringUtils.hasText(item.asText())) {
                    values.add(item.asText().trim());
                }
            });
        }
        return values;
    }

    private Map<String, String> products(Path productsDir) {
        Map<String, String> products = new LinkedHashMap<>();
        if (!Files.isDirectory(productsDir)) {
            return products;
        }
        try (Stream<Path> entries = Files.list(productsDir)) {
            entries.filter(Files::isDirectory)
                    .sorted()
                    .forEach(productDir -> products.put(productDir.getFileName().toString(), productName(productDir)));
        } catch (IOException ex) {
            log.warn("Failed to list products in {}: {}", productsDir, ex.getMessage());
        }
        return products;
    }

    private String productName(Path productDir) {
        Path productFile = productDir.resolve("product.json");
        String fallback = productDir.getFileName().toString();
        if (!Files.isRegularFile(productFile)) {
            return fallback;
        }
        try {
            return objectMapper.readTree(productFile.toFile()).path("name").asText(fallback);
        } catch (IOException ex) {
            log.debug("Unreadable product file {}: {}", productFile, ex.getMessage());
            return fallback;
        }
    }

    private int countImages(Path referencesDir) {
        if (!Files.isDirectory(referencesDir)) {
            return 0;
        }
        try (Stream<Path> entries = Files.list(referencesDir)) {
            return (int) entries.filter(Files::isRegularFile)
                    .filter(this::isImage)
                    .count();
        } catch (IOException ex) {
            log.warn("Failed to list references in {}: {}", referencesDir, ex.getMessage());
            return 0;
        }
    }

    private boolean isImage(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
