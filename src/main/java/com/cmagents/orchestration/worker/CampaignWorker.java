package com.cmagents.orchestration.worker;

import com.cmagents.orchestration.model.WorkerName;

/**
 * Uniform contract for the pluggable campaign workers.
 * <p>
 * Implementations signal recoverable problems (timeouts, network errors) with
 * {@link TransientWorkerException} and unrecoverable ones with
 * {@link FatalWorkerException}. Any other runtime exception is treated as fatal.
 * Calls past their deadline are interrupted and abandoned, so a call may still be
 * running when the next one starts.
 */
public interface CampaignWorker {

    /**
     * @return the plan step this worker fulfills
     */
    WorkerName name();

    /**
     * Runs the worker against the accumulated context of the run.
     *
     * @param context prior outputs, brand configuration and qa feedback
     * @return the worker's result; a qa worker reports its verdict through {@link WorkerResult#success()}
     */
    WorkerResult run(WorkerContext context);
}
