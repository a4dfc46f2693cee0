package com.cmagents.session;

import com.cmagents.orchestration.engine.RunCancellation;
import com.cmagents.ratelimit.CapacityExceededException;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one chat session. Every mutation happens under the session's own monitor;
 * {@link #lastActivity()} is readable without it so the registry can scan for the LRU entry.
 */
final class ChatSession {

    private final String id;
    private final long sequence;
    private final Deque<ChatMessage> history = new ArrayDeque<>();
    private final Map<String, ConnectionState> connections = new LinkedHashMap<>();
    private final Map<String, RunCancellation> runs = new LinkedHashMap<>();
    private volatile Instant lastActivity;
    private SessionState state = SessionState.CREATED;
    private Instant idleSince;
    private String pendingRequest;
    private String activeBrand;

    ChatSession(String id, long sequence, Instant createdAt) {
        this.id = id;
        this.sequence = sequence;
        this.lastActivity = createdAt;
    }

    String id() {
        return id;
    }

    long sequence() {
        return sequence;
    }

    Instant lastActivity() {
        return lastActivity;
    }

    synchronized SessionState state() {
        return state;
    }

    synchronized void attach(ChatConnection connection, int maxConnections, Instant now) {
        if (state.terminal()) {
            throw new IllegalStateException("Session " + id + " is " + state);
        }
        if (connections.size() >= maxConnections) {
            throw new CapacityExceededException("Session " + id + " already has " + maxConnections + " connections.");
        }
        connections.put(connection.id(), new ConnectionState(connection, now));
        state = SessionState.ACTIVE;
        idleSince = null;
        lastActivity = now;
    }

    /**
     * @return the removed connection, or {@code null} if it was not attached
     */
    synchronized @Nullable ChatConnection detach(String connectionId, Instant now) {
        ConnectionState removed = connections.remove(connectionId);
        if (removed != null && connections.isEmpty() && !state.terminal()) {
            state = SessionState.IDLE;
            idleSince = now;
        }
        return removed == null ? null : removed.connection();
    }

    synchronized @Nullable ChatConnection connection(String connectionId) {
        ConnectionState current = connections.get(connectionId);
        return current == null ? null : current.connection();
    }

    synchronized List<ChatConnection> connections() {
        List<ChatConnection> snapshot = new ArrayList<>(connections.size());
        connections.values().forEach(current -> snapshot.add(current.connection()));
        return snapshot;
    }

    synchronized int connectionCount() {
        return connections.size();
    }

    synchronized void touch(Instant now) {
        if (state.terminal()) {
            return;
        }
        lastActivity = now;
        if (state != SessionState.IDLE) {
            state = SessionState.ACTIVE;
        }
    }

    synchronized void markSeen(String connectionId, Instant now) {
        ConnectionState current = connections.get(connectionId);
        if (current != null) {
            current.seen(now);
        }
    }

    /**
     * Connections whose last sign of life is at or before {@code deadline}.
     */
    synchronized List<ChatConnection> staleConnections(Instant deadline) {
        List<ChatConnection> stale = new ArrayList<>();
        connections.values().stream()
                .filter(current -> !current.lastSeen().isAfter(deadline) || !current.connection().isOpen())
                .forEach(current -> stale.add(current.connection()));
        return stale;
    }

    synchronized void appendHistory(ChatMessage message, int limit, Instant now) {
        history.addLast(message);
        while (history.size() > limit) {
            history.pollFirst();
        }
        touch(now);
    }

    synchronized List<ChatMessage> history() {
        return List.copyOf(history);
    }

    synchronized int clearHistory() {
        int cleared = history.size();
        history.clear();
        return cleared;
    }

    synchronized boolean idleBefore(Instant deadline) {
        return state == SessionState.IDLE && connections.isEmpty()
                && idleSince != null && !idleSince.isAfter(deadline);
    }

    /**
     * Attaches a build unless the session is closed or another build is still running.
     */
    synchronized boolean tryAttachRun(RunCancellation cancellation) {
        if (state.terminal() || !runs.isEmpty()) {
            return false;
        }
        runs.put(cancellation.runId(), cancellation);
        return true;
    }

    synchronized void detachRun(String runId) {
        runs.remove(runId);
    }

    synchronized boolean hasRunningBuild() {
        return !runs.isEmpty();
    }

    synchronized @Nullable String pendingRequest() {
        return pendingRequest;
    }

    synchronized void pendingRequest(@Nullable String request) {
        this.pendingRequest = request;
    }

    synchronized @Nullable String activeBrand() {
        return activeBrand;
    }

    synchronized void activeBrand(@Nullable String brand) {
        this.activeBrand = brand;
    }

    /**
     * Moves the session to a terminal state and hands back what has to be released
     * outside the monitor. Returns an empty teardown when already terminal.
     */
    synchronized Teardown terminate(SessionState terminalState) {
        if (state.terminal()) {
            return new Teardown(List.of(), List.of());
        }
        state = terminalState;
        List<ChatConnection> open = new ArrayList<>();
        connections.values().forEach(current -> open.add(current.connection()));
        connections.clear();
        List<RunCancellation> running = List.copyOf(runs.values());
        runs.clear();
        return new Teardown(open, running);
    }

    record Teardown(List<ChatConnection> connections, List<RunCancellation> runs) {
    }

    private static final class ConnectionState {
        private final ChatConnection connection;
        private Instant lastSeen;

        private ConnectionState(ChatConnection connection, Instant lastSeen) {
            this.connection = connection;
            this.lastSeen = lastSeen;
        }

        ChatConnection connection() {
            return connection;
        }

        Instant lastSeen() {
            return lastSeen;
        }

        void seen(Instant now) {
            lastSeen = now;
        }
    }
}
