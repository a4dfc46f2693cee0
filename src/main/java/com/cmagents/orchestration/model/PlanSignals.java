package com.cmagents.orchestration.model;

/**
 * Context facts the planner weighs alongside the request itself.
 */
public record PlanSignals(
        boolean styleReferencePresent,
        boolean brandReferencesPresent,
        boolean trendRequested,
        boolean noTextRequested
) {
}
