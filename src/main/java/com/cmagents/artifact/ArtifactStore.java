package com.cmagents.artifact;

import com.cmagents.orchestration.model.RunResult;
import com.cmagents.orchestration.model.WorkerOutcome;

import java.util.Optional;

/**
 * Durable, append-only record of campaign runs. A run's artifact becomes visible to
 * readers only once sealed, and then completely.
 */
public interface ArtifactStore {

    /**
     * Opens the staging area of a run. The handle must be closed; closing a handle that
     * was never sealed discards everything staged through it.
     *
     * @param runId The identifier of the run.
     * @return A handle scoped to the run. If the run is already sealed, the handle is
     *         sealed as well and {@link #seal(ArtifactHandle, RunResult)} returns the
     *         existing reference.
     * @throws ArtifactStoreException if the run id is invalid or the run is already open.
     */
    ArtifactHandle open(String runId);

    /**
     * Appends one outcome to the run's journal. Earlier entries are never rewritten.
     *
     * @param handle The open handle of the run.
     * @param outcome The outcome to append.
     * @throws IllegalStateException if the handle is sealed or closed.
     * @throws ArtifactStoreException if the journal cannot be written.
     */
    void appendTrace(ArtifactHandle handle, WorkerOutcome outcome);

    /**
     * Writes the final plan, trace, cost snapshot and summary, then publishes the run
     * atomically. Sealing twice is a no-op returning the first reference.
     *
     * @param handle The handle of the run.
     * @param result The terminal result of the run.
     * @return The reference of the published artifact.
     * @throws ArtifactStoreException if the artifact cannot be written or published.
     */
    ArtifactReference seal(ArtifactHandle handle, RunResult result);

    /**
     * Looks up a sealed run.
     *
     * @param runId The identifier of the run.
     * @return The reference if the run is sealed, otherwise empty.
     */
    Optional<ArtifactReference> find(String runId);
}
