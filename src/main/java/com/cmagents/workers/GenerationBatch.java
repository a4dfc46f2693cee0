package com.cmagents.workers;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record GenerationBatch(
        @JsonProperty("style") String style,
        @JsonProperty("renders") List<RenderSpec> renders,
        @JsonProperty("attempt") int attempt
) {

    public GenerationBatch {
        renders = renders == null ? List.of() : List.copyOf(renders);
    }
}
