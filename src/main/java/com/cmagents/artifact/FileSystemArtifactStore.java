package com.cmagents.artifact;

import com.cmagents.config.CampaignAgentsProperties;
import com.cmagents.orchestration.model.RunResult;
import com.cmagents.orchestration.model.WorkerOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Stores each run under {@code <output-dir>/<runId>/}. Writes go to a hidden staging
 * directory that is renamed into place on seal, so a run directory is either absent
 * or complete.
 */
@Component
@Slf4j
public class FileSystemArtifactStore implements ArtifactStore {

    static final String DOCUMENT_FILE = "artifacts.json";
    static final String SUMMARY_FILE = "report.md";
    static final String JOURNAL_FILE = "trace.jsonl";
    static final String STAGING_PREFIX = ".staging-";

    private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final Path root;
    private final ObjectMapper objectMapper;
    private final RunSummaryRenderer summaryRenderer;
    private final Clock clock;

    @Autowired
    public FileSystemArtifactStore(CampaignAgentsProperties properties,
                                   ObjectMapper objectMapper,
                                   RunSummaryRenderer summaryRenderer,
                                   Clock clock) {
        this(Paths.get(properties.getArtifacts().getOutputDir()), objectMapper, summaryRenderer, clock);
    }

    public FileSystemArtifactStore(Path root, ObjectMapper objectMapper, RunSummaryRenderer summaryRenderer,
                                   Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        this.summaryRenderer = summaryRenderer;
        this.clock = clock;
    }

    @Override
    public ArtifactHandle open(String runId) {
        validateRunId(runId);
        Path finalDir = root.resolve(runId);
        if (Files.isDirectory(finalDir)) {
            return new FileArtifactHandle(runId, null, reference(runId));
        }
        Path staging = root.resolve(STAGING_PREFIX + runId);
        try {
            Files.createDirectories(root);
            Files.createDirectory(staging);
        } catch (FileAlreadyExistsException ex) {
            throw new ArtifactStoreException("Run " + runId + " is already open.", ex);
        } catch (IOException ex) {
            throw new ArtifactStoreException("Failed to create staging area for run " + runId, ex);
        }
        return new FileArtifactHandle(runId, staging, null);
    }

    @Override
    public void appendTrace(ArtifactHandle handle, WorkerOutcome outcome) {
        FileArtifactHandle fileHandle = cast(handle);
        synchronized (fileHandle) {
            fileHandle.requireWritable();
            try {
                String line = objectMapper.writeValueAsString(ArtifactDocument.TraceEntry.of(outcome))
                        + System.lineSeparator();
                Files.writeString(fileHandle.staging.resolve(JOURNAL_FILE), line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            } catch (IOException ex) {
                throw new ArtifactStoreException("Failed to append trace for run " + handle.runId(), ex);
            }
        }
    }

    @Override
    public ArtifactReference seal(ArtifactHandle handle, RunResult result) {
        FileArtifactHandle fileHandle = cast(handle);
        synchronized (fileHandle) {
            if (fileHandle.reference != null) {
                return fileHandle.reference;
            }
            fileHandle.requireWritable();
            Path finalDir = root.resolve(handle.runId());
            if (Files.isDirectory(finalDir)) {
                fileHandle.reference = reference(handle.runId());
                return fileHandle.reference;
            }
            try {
                ArtifactDocument document = ArtifactDocument.of(result, clock.instant());
                Files.writeString(fileHandle.staging.resolve(DOCUMENT_FILE),
                        objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document),
                        StandardCharsets.UTF_8);
                Files.writeString(fileHandle.staging.resolve(SUMMARY_FILE), summaryRenderer.render(result),
                        StandardCharsets.UTF_8);
                Files.move(fileHandle.staging, finalDir, StandardCopyOption.ATOMIC_MOVE);
            } catch (JsonProcessingException ex) {
                throw new ArtifactStoreException("Failed to serialize artifact of run " + handle.runId(), ex);
            } catch (IOException ex) {
                throw new ArtifactStoreException("Failed to seal artifact of run " + handle.runId(), ex);
            }
            fileHandle.reference = reference(handle.runId());
            log.info("Sealed artifact of run {} at {}", handle.runId(), finalDir);
            return fileHandle.reference;
        }
    }

    @Override
    public Optional<ArtifactReference> find(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            return Optional.empty();
        }
        Path finalDir = root.resolve(runId);
        if (!Files.isRegularFile(finalDir.resolve(DOCUMENT_FILE))) {
            return Optional.empty();
        }
        return Optional.of(reference(runId));
    }

    private ArtifactReference reference(String runId) {
        Path finalDir = root.resolve(runId);
        return new ArtifactReference(runId, finalDir.toString(),
                finalDir.resolve(DOCUMENT_FILE).toString(), finalDir.resolve(SUMMARY_FILE).toString());
    }

    private void validateRunId(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            throw new ArtifactStoreException("Invalid run id: " + runId);
        }
    }

    private FileArtifactHandle cast(ArtifactHandle handle) {
        if (handle instanceof FileArtifactHandle fileHandle && fileHandle.owner() == this) {
            return fileHandle;
        }
        throw new IllegalArgumentException("Handle was not opened by this store.");
    }

    private final class FileArtifactHandle implements ArtifactHandle {

        private final String runId;
        private final @Nullable Path staging;
        private @Nullable ArtifactReference reference;
        private boolean closed;

        private FileArtifactHandle(String runId, @Nullable Path staging, @Nullable ArtifactReference reference) {
            this.runId = runId;
            this.staging = staging;
            this.reference = reference;
        }

        private FileSystemArtifactStore owner() {
            return FileSystemArtifactStore.this;
        }

        @Override
        public String runId() {
            return runId;
        }

        @Override
        public synchronized boolean isSealed() {
            return reference != null;
        }

        private void requireWritable() {
            if (closed) {
                throw new IllegalStateException("Artifact handle of run " + runId + " is closed.");
            }
            if (reference != null || staging == null) {
                throw new IllegalStateException("Artifact of run " + runId + " is sealed.");
            }
        }

        @Override
        public synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (reference == null && staging != null) {
                try {
                    FileSystemUtils.deleteRecursively(staging);
                    log.debug("Discarded unsealed staging area of run {}", runId);
                } catch (IOException ex) {
                    log.warn("Failed to discard staging area of run {}: {}", runId, ex.getMessage());
                }
            }
        }
    }
}
