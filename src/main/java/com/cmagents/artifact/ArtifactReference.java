package com.cmagents.artifact;

/**
 * Location of a sealed run artifact.
 *
 * @param runId     run the artifact belongs to
 * @param directory directory holding the run documents
 * @param document  path of {@code artifacts.json}
 * @param summary   path of {@code report.md}
 */
public record ArtifactReference(String runId, String directory, String document, String summary) {
}
