package com.cmagents.orchestration.model;

public record ProposedStep(
        String name,
        Boolean run,
        String reason
) {
}
