package com.cmagents.orchestration.model;

import java.util.List;

/**
 * Run/skip decision over all five workers. Always holds exactly one step per
 * {@link WorkerName}, in execution order.
 */
public record WorkerPlan(
        List<WorkerStep> steps,
        PlanMode mode,
        String reason
) {

    public WorkerPlan {
        if (steps == null || steps.size() != WorkerName.values().length) {
            throw new IllegalArgumentException("A worker plan needs exactly "
                    + WorkerName.values().length + " steps.");
        }
        for (int index = 0; index < steps.size(); index++) {
            WorkerStep step = steps.get(index);
            if (step == null || step.order() != index) {
                throw new IllegalArgumentException("Worker plan steps are out of order at index " + index + ".");
            }
        }
        if (mode == null) {
            throw new IllegalArgumentException("Worker plan mode is required.");
        }
        steps = List.copyOf(steps);
        reason = reason == null ? "" : reason;
    }

    public WorkerStep step(WorkerName name) {
        return steps.get(name.order());
    }

    public boolean willRun(WorkerName name) {
        return step(name).willRun();
    }

    public List<String> sequence() {
        return steps.stream()
                .filter(WorkerStep::willRun)
                .map(step -> step.name().key())
                .toList();
    }
}
