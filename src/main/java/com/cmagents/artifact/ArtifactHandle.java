package com.cmagents.artifact;

/**
 * Scoped access to one run's staging area.
 */
public interface ArtifactHandle extends AutoCloseable {

    String runId();

    boolean isSealed();

    @Override
    void close();
}
