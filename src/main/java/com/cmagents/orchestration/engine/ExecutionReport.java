package com.cmagents.orchestration.engine;

import com.cmagents.orchestration.model.OrchestrationTrace;
import com.cmagents.orchestration.model.RunStatus;
import com.cmagents.orchestration.worker.WorkerContext;

public record ExecutionReport(OrchestrationTrace trace, RunStatus status, double totalCostUsd, WorkerContext context) {
}
