package com.cmagents.stream;

import com.cmagents.artifact.ArtifactDocument;
import com.cmagents.orchestration.CampaignOrchestrator;
import com.cmagents.orchestration.InvalidRequestException;
import com.cmagents.orchestration.engine.RunCancellation;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.InputTranslation;
import com.cmagents.orchestration.model.RunResult;
import com.cmagents.orchestration.model.WorkerPlan;
import com.cmagents.orchestration.service.IntentDetectionService;
import com.cmagents.orchestration.service.RequestTranslationService;
import com.cmagents.session.ChatMessage;
import com.cmagents.session.ConnectionHandle;
import com.cmagents.session.SessionRegistry;
import com.cmagents.config.CampaignAgentsProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Handles inbound chat envelopes ({@code ping}, {@code chat}, {@code build_orchestrator})
 * and turns build requests into campaign runs owned by the session.
 */
@Service
@Slf4j
public class ChatChannelService {

    static final String TYPE_PING = "ping";
    static final String TYPE_CHAT = "chat";
    static final String TYPE_BUILD = "build_orchestrator";

    static final String ERROR_RATE_LIMITED = "Too many messages. Slow down and try again in a minute.";
    static final String ERROR_INVALID_JSON = "Invalid JSON message";
    static final String ERROR_EMPTY = "Empty message";
    static final String ERROR_UNKNOWN_TYPE = "Unknown message type: ";
    static final String ERROR_BUILD_NEEDS_BRAND = "Select a brand before running a build.";
    static final String ERROR_NO_PENDING_REQUEST = "No pending request to build. Send a campaign request first.";
    static final String ERROR_BUILD_RUNNING = "A build is already running for this session.";

    private final SessionRegistry sessionRegistry;
    private final CampaignOrchestrator orchestrator;
    private final IntentDetectionService intentDetectionService;
    private final RequestTranslationService requestTranslationService;
    private final ObjectMapper objectMapper;
    private final ExecutorService orchestrationExecutor;
    private final CampaignAgentsProperties properties;
    private final Clock clock;

    public ChatChannelService(SessionRegistry sessionRegistry,
                              CampaignOrchestrator orchestrator,
                              IntentDetectionService intentDetectionService,
                              RequestTranslationService requestTranslationService,
                              ObjectMapper objectMapper,
                              @Qualifier("orchestrationExecutor") ExecutorService orchestrationExecutor,
                              CampaignAgentsProperties properties,
                              Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.orchestrator = orchestrator;
        this.intentDetectionService = intentDetectionService;
        this.requestTranslationService = requestTranslationService;
        this.objectMapper = objectMapper;
        this.orchestrationExecutor = orchestrationExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public void handle(ConnectionHandle handle, String payload) {
        if (!sessionRegistry.allowMessage(handle)) {
            sendError(handle, ERROR_RATE_LIMITED);
            return;
        }
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(payload);
        } catch (JsonProcessingException ex) {
            sendError(handle, ERROR_INVALID_JSON);
            return;
        }
        if (envelope == null || !envelope.isObject()) {
            sendError(handle, ERROR_INVALID_JSON);
            return;
        }
        String type = envelope.path("type").asText(TYPE_CHAT);
        JsonNode data = envelope.path("data");
        switch (type) {
            case TYPE_PING -> send(handle, ChannelEvent.of(ChannelEvent.PONG, Map.of(), clock.instant()));
            case TYPE_CHAT -> handleChat(handle, data);
            case TYPE_BUILD -> handleBuildRequest(handle, data);
            default -> sendError(handle, ERROR_UNKNOWN_TYPE + type);
        }
    }

    private void handleChat(ConnectionHandle handle, JsonNode data) {
        String sessionId = handle.sessionId();
        String content = text(data, "content");
        String brand = text(data, "brand");
        if (brand != null) {
            sessionRegistry.setActiveBrand(sessionId, brand);
        }
        if (content == null) {
            sendError(handle, ERROR_EMPTY);
            return;
        }
        sessionRegistry.record(sessionId, ChatMessage.user(content, clock.instant()));

        boolean confirmation = intentDetectionService.isBuildConfirmation(content);
        if (!confirmation) {
            sessionRegistry.setPendingRequest(sessionId, content);
        }
        String activeBrand = sessionRegistry.activeBrand(sessionId);
        if (confirmation || data.path("build").asBoolean(false)) {
            String request = confirmation ? sessionRegistry.pendingRequest(sessionId) : content;
            requestBuild(handle, activeBrand, request);
            return;
        }
        reply(sessionId, previewReply(activeBrand, content));
    }

    private void handleBuildRequest(ConnectionHandle handle, JsonNode data) {
        String sessionId = handle.sessionId();
        String brand = text(data, "brand");
        if (brand == null) {
            brand = sessionRegistry.activeBrand(sessionId);
        }
        String request = text(data, "request");
        if (request == null) {
            request = sessionRegistry.pendingRequest(sessionId);
        }
        requestBuild(handle, brand, request);
    }

    private void requestBuild(ConnectionHandle handle, @Nullable String brand, @Nullable String request) {
        if (brand == null) {
            sendError(handle, ERROR_BUILD_NEEDS_BRAND);
            return;
        }
        if (request == null) {
            sendError(handle, ERROR_NO_PENDING_REQUEST);
            return;
        }
        if (sessionRegistry.hasRunningBuild(handle.sessionId())) {
            sendError(handle, ERROR_BUILD_RUNNING);
            return;
        }
        startBuild(handle, brand, request);
    }

    /**
     * Runs the request in the background. The run is owned by the session and is
     * cancelled if the session is closed or evicted before it finishes.
     */
    private void startBuild(ConnectionHandle handle, String brand, String request) {
        String sessionId = handle.sessionId();
        String runId = orchestrator.newRunId();
        RunCancellation cancellation = new RunCancellation(runId);
        // the earlier check is only a shortcut, ownership is decided here
        if (!sessionRegistry.attachRun(sessionId, cancellation)) {
            sendError(handle, ERROR_BUILD_RUNNING);
            return;
        }
        orchestrator.track(cancellation);
        Map<String, Object> started = new LinkedHashMap<>();
        started.put("message", "Orchestrator started. Running workers...");
        started.put("brand", brand);
        started.put("run_id", runId);
        broadcast(sessionId, ChannelEvent.of(ChannelEvent.BUILD_STARTED, started, clock.instant()));
        log.info("Session {} started build {} for brand {}", sessionId, runId, brand);

        CompletableFuture.runAsync(() -> {
            try {
                RunResult result = orchestrator.runFromUserInput(runId, brand, request, cancellation);
                broadcast(sessionId, ChannelEvent.of(ChannelEvent.BUILD_COMPLETED, completed(result),
                        clock.instant()));
                sessionRegistry.record(sessionId, ChatMessage.assistant(summary(result), clock.instant()));
            } catch (Exception ex) {
                log.error("Build {} of session {} failed", runId, sessionId, ex);
                broadcast(sessionId, ChannelEvent.error("Build failed: " + ex.getMessage(), clock.instant()));
            } finally {
                sessionRegistry.detachRun(sessionId, runId);
            }
        }, orchestrationExecutor);
    }

    private Map<String, Object> completed(RunResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", summary(result));
        data.put("run_id", result.runId());
        data.put("run_dir", result.artifact() != null ? result.artifact().directory() : null);
        data.put("status", result.status().name());
        data.put("generated", result.generatedCount());
        data.put("errors", result.errorCount());
        data.put("worker_plan", ArtifactDocument.Plan.of(result.plan()));
        return data;
    }

    private String summary(RunResult result) {
        return "Build " + result.status().name().toLowerCase(Locale.ROOT) + ". Workers: "
                + String.join(", ", result.plan().sequence()) + ". Generated: " + result.generatedCount()
                + ". Errors: " + result.errorCount() + ".";
    }

    /**
     * Plans a chat request for the brand without running it. Requests that cannot be
     * planned yet are answered with the reason instead of a plan.
     */
    public ChatReply preview(@Nullable String brand, String content) {
        if (brand == null) {
            return new ChatReply("Request noted. Select a brand to preview and build the campaign.", null);
        }
        try {
            InputTranslation translation = requestTranslationService.fallback(content);
            ContentRequest request = translation.toRequest(brand,
                    properties.getExecution().getDefaultMaxRetries(), false);
            WorkerPlan plan = orchestrator.plan(request);
            return new ChatReply("Request noted for " + brand + ". Planned workers: "
                    + String.join(", ", plan.sequence()) + ". Reply /build to run it.", ArtifactDocument.Plan.of(plan));
        } catch (InvalidRequestException ex) {
            return new ChatReply("Request noted, but it cannot be planned yet: " + ex.getMessage(), null);
        }
    }

    private Map<String, Object> previewReply(@Nullable String brand, String content) {
        ChatReply preview = preview(brand, content);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("role", ChatMessage.ASSISTANT);
        data.put("content", preview.content());
        if (preview.plan() != null) {
            data.put("worker_plan", preview.plan());
        }
        return data;
    }

    private void reply(String sessionId, Map<String, Object> data) {
        Object content = data.get("content");
        sessionRegistry.record(sessionId, ChatMessage.assistant(String.valueOf(content), clock.instant()));
        broadcast(sessionId, ChannelEvent.of(ChannelEvent.CHAT, data, clock.instant()));
    }

    public String errorPayload(String message) {
        return serialize(ChannelEvent.error(message, clock.instant()));
    }

    private void sendError(ConnectionHandle handle, String message) {
        send(handle, ChannelEvent.error(message, clock.instant()));
    }

    private void send(ConnectionHandle handle, ChannelEvent event) {
        String payload = serialize(event);
        if (payload != null) {
            sessionRegistry.send(handle, payload);
        }
    }

    private void broadcast(String sessionId, ChannelEvent event) {
        String payload = serialize(event);
        if (payload != null) {
            sessionRegistry.broadcast(sessionId, payload);
        }
    }

    private @Nullable String serialize(ChannelEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            log.warn("Failed to serialize {} event: {}", event.type(), ex.getMessage());
            return null;
        }
    }

    private static @Nullable String text(JsonNode data, String field) {
        JsonNode value = data.path(field);
        if (!value.isTextual() || !StringUtils.hasText(value.asText())) {
            return null;
        }
        return value.asText().trim();
    }
}
