package com.cmagents.orchestration.worker;

import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.WorkerName;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view handed to a worker. Each step produces a new context carrying its output.
 */
public record WorkerContext(
        String runId,
        ContentRequest request,
        Map<String, Object> brandContext,
        Map<WorkerName, Object> outputs,
        List<String> qaFeedback,
        int attempt
) {

    public WorkerContext {
        brandContext = brandContext == null ? Map.of() : Collections.unmodifiableMap(brandContext);
        EnumMap<WorkerName, Object> copy = new EnumMap<>(WorkerName.class);
        if (outputs != null) {
            outputs.forEach((key, value) -> {
                if (value != null) {
                    copy.put(key, value);
                }
            });
        }
        outputs = Collections.unmodifiableMap(copy);
        qaFeedback = qaFeedback == null ? List.of() : List.copyOf(qaFeedback);
    }

    public static WorkerContext initial(String runId, ContentRequest request, Map<String, Object> brandContext) {
        return new WorkerContext(runId, request, brandContext, Map.of(), List.of(), 1);
    }

    public @Nullable Object output(WorkerName step) {
        return outputs.get(step);
    }

    public <T> @Nullable T output(WorkerName step, Class<T> type) {
        Object value = outputs.get(step);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    public WorkerContext withOutput(WorkerName step, @Nullable Object payload) {
        if (payload == null) {
            return this;
        }
        Map<WorkerName, Object> next = new EnumMap<>(WorkerName.class);
        next.putAll(outputs);
        next.put(step, payload);
        return new WorkerContext(runId, request, brandContext, next, qaFeedback, attempt);
    }

    public WorkerContext withFeedback(List<String> feedback) {
        List<String> merged = new ArrayList<>(qaFeedback);
        if (feedback != null) {
            feedback.stream().filter(item -> !merged.contains(item)).forEach(merged::add);
        }
        return new WorkerContext(runId, request, brandContext, outputs, merged, attempt);
    }

    public WorkerContext forAttempt(int nextAttempt) {
        return new WorkerContext(runId, request, brandContext, outputs, qaFeedback, nextAttempt);
    }
}
