package com.cmagents.orchestration.api;

import com.cmagents.entity.CampaignRun;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.RunResult;
import com.cmagents.orchestration.model.WorkerPlan;

import java.util.List;
import java.util.Optional;

/**
 * Service interface for indexing campaign runs in the database. Recording is best-effort:
 * a ledger failure never affects the outcome of a run.
 */
public interface RunLedgerService {

    /**
     * Records that a run has started with a resolved plan.
     *
     * @param runId The identifier of the run.
     * @param request The request being executed.
     * @param plan The resolved worker plan.
     */
    void recordStarted(String runId, ContentRequest request, WorkerPlan plan);

    /**
     * Records the terminal result of a run, including its artifact location.
     *
     * @param result The terminal {@link RunResult}.
     */
    void recordCompleted(RunResult result);

    /**
     * Records a run that ended with an unexpected error before producing a result.
     *
     * @param runId The identifier of the run.
     * @param request The request being executed.
     * @param message A description of the error.
     */
    void recordFailed(String runId, ContentRequest request, String message);

    /**
     * Finds a run by its identifier.
     *
     * @param runId The identifier of the run.
     * @return An {@link Optional} containing the {@link CampaignRun} if found, otherwise empty.
     */
    Optional<CampaignRun> find(String runId);

    /**
     * Lists the most recent runs of a brand, newest first.
     *
     * @param brandId The brand slug.
     * @return Up to twenty runs.
     */
    List<CampaignRun> recent(String brandId);
}
