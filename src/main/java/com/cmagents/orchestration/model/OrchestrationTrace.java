package com.cmagents.orchestration.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered outcomes of one run. Appendable until sealed with a terminal status,
 * read-only afterwards.
 */
public final class OrchestrationTrace {

    private final String runId;
    private final List<WorkerOutcome> entries = new ArrayList<>();
    private RunStatus status = RunStatus.RUNNING;

    public OrchestrationTrace(String runId) {
        this.runId = runId;
    }

    @JsonProperty("run_id")
    public String runId() {
        return runId;
    }

    public synchronized void append(WorkerOutcome outcome) {
        if (status.terminal()) {
            throw new IllegalStateException("Trace for run " + runId + " is sealed.");
        }
        entries.add(outcome);
    }

    public synchronized void seal(RunStatus finalStatus) {
        if (!finalStatus.terminal()) {
            throw new IllegalArgumentException("A trace must be sealed with a terminal status.");
        }
        if (status.terminal()) {
            throw new IllegalStateException("Trace for run " + runId + " is already sealed as " + status + ".");
        }
        status = finalStatus;
    }

    @JsonProperty("status")
    public synchronized RunStatus status() {
        return status;
    }

    public synchronized boolean sealed() {
        return status.terminal();
    }

    @JsonProperty("entries")
    public synchronized List<WorkerOutcome> entries() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long count(WorkerName step, OutcomeStatus outcomeStatus) {
        return entries.stream()
                .filter(entry -> entry.step() == step && entry.status() == outcomeStatus)
                .count();
    }

    /**
     * Number of calls made to a worker, retried transient failures included.
     */
    public synchronized long invocations(WorkerName step) {
        return entries.stream()
                .filter(entry -> entry.step() == step)
                .filter(entry -> entry.status() != OutcomeStatus.SKIPPED && entry.status() != OutcomeStatus.CANCELLED)
                .count();
    }

    public synchronized long failures() {
        return entries.stream()
                .filter(entry -> entry.status() == OutcomeStatus.FAILED)
                .count();
    }

    public synchronized double totalCostUsd() {
        return entries.stream().mapToDouble(WorkerOutcome::costUsd).sum();
    }
}
