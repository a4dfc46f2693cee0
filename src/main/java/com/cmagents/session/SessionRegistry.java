package com.cmagents.session;

import com.cmagents.config.CampaignAgentsProperties;
import com.cmagents.orchestration.engine.RunCancellation;
import com.cmagents.ratelimit.SlidingWindowRateLimiter;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded set of live chat sessions.
 * <p>
 * The capacity check, LRU eviction and insertion of a new session form one critical
 * section guarded by the admission lock. Closing connections of evicted sessions and
 * all socket writes happen outside of it. History and connection sets are guarded by
 * the monitor of their own session.
 */
@Component
@Slf4j
public class SessionRegistry {

    static final String EVICTED_REASON = "Session evicted: server at capacity";
    static final String IDLE_REASON = "Session expired";
    static final String SHUTDOWN_REASON = "Server shutting down";

    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();
    private final ReentrantLock admissionLock = new ReentrantLock();
    private final AtomicLong sequence = new AtomicLong();
    private final CampaignAgentsProperties.SessionConfig config;
    private final SlidingWindowRateLimiter messageRateLimiter;
    private final Clock clock;

    public SessionRegistry(CampaignAgentsProperties properties,
                           @Qualifier("messageRateLimiter") SlidingWindowRateLimiter messageRateLimiter,
                           Clock clock) {
        this.config = properties.getSessions();
        if (config.getCapacity() <= 0 || config.getHistoryLimit() <= 0 || config.getMaxConnectionsPerSession() <= 0) {
            throw new IllegalStateException("Session capacity, history limit and connection limit must be positive.");
        }
        this.messageRateLimiter = messageRateLimiter;
        this.clock = clock;
    }

    /**
     * Attaches a connection to a session, creating the session on first use. When the
     * registry is full and the id is new, the least-recently-active session is evicted
     * first and its connections are force-closed.
     *
     * @throws com.cmagents.ratelimit.CapacityExceededException if the session already
     *         holds the maximum number of connections
     */
    public ConnectionHandle admit(String sessionId, ChatConnection connection) {
        Instant now = clock.instant();
        List<ChatSession.Teardown> evicted = new ArrayList<>();
        admissionLock.lock();
        try {
            ChatSession session = sessions.get(sessionId);
            if (session == null) {
                while (sessions.size() >= config.getCapacity()) {
                    ChatSession victim = leastRecentlyActive();
                    if (victim == null) {
                        break;
                    }
                    sessions.remove(victim.id());
                    evicted.add(victim.terminate(SessionState.EVICTED));
                    log.info("Evicted session {} (last activity {})", victim.id(), victim.lastActivity());
                }
                session = new ChatSession(sessionId, sequence.incrementAndGet(), now);
                sessions.put(sessionId, session);
                log.debug("Created session {}", sessionId);
            }
            session.attach(connection, config.getMaxConnectionsPerSession(), now);
        } finally {
            admissionLock.unlock();
        }
        evicted.forEach(teardown -> release(teardown, EVICTED_REASON));
        return new ConnectionHandle(sessionId, connection.id());
    }

    private @Nullable ChatSession leastRecentlyActive() {
        return sessions.values().stream()
                .min(Comparator.comparing(ChatSession::lastActivity).thenComparingLong(ChatSession::sequence))
                .orElse(null);
    }

    public boolean record(String sessionId, ChatMessage message) {
        ChatSession session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        session.appendHistory(message, config.getHistoryLimit(), clock.instant());
        return true;
    }

    public List<ChatMessage> history(String sessionId) {
        ChatSession session = sessions.get(sessionId);
        return session == null ? List.of() : session.history();
    }

    /**
     * @return number of messages removed
     */
    public int clearHistory(String sessionId) {
        ChatSession session = sessions.get(sessionId);
        return session == null ? 0 : session.clearHistory();
    }

    /**
     * Delivers a payload to every live connection of a session. Connections failing on
     * write are removed.
     *
     * @return number of connections the payload reached
     */
    public int broadcast(String sessionId, String payload) {
        ChatSession session = sessions.get(sessionId);
        if (session == null) {
            return 0;
        }
        session.touch(clock.instant());
        int delivered = 0;
        for (ChatConnection connection : session.connections()) {
            if (deliver(session, connection, payload)) {
                delivered++;
            }
        }
        return delivered;
    }

    public boolean send(ConnectionHandle handle, String payload) {
        ChatSession session = sessions.get(handle.sessionId());
        if (session == null) {
            return false;
        }
        ChatConnection connection = session.connection(handle.connectionId());
        if (connection == null) {
            return false;
        }
        session.touch(clock.instant());
        return deliver(session, connection, payload);
    }

    private boolean deliver(ChatSession session, ChatConnection connection, String payload) {
        if (connection.isOpen()) {
            try {
                connection.send(payload);
                return true;
            } catch (IOException | RuntimeException ex) {
                log.debug("Dropping connection {} of session {}: {}", connection.id(), session.id(), ex.getMessage());
            }
        }
        dropConnection(session, connection, "Write failed");
        return false;
    }

    /**
     * Per-connection admission of an inbound message. An admitted message also counts
     * as session activity.
     */
    public boolean allowMessage(ConnectionHandle handle) {
        if (!messageRateLimiter.check(handle.rateKey())) {
            return false;
        }
        ChatSession session = sessions.get(handle.sessionId());
        if (session != null) {
            Instant now = clock.instant();
            session.touch(now);
            session.markSeen(handle.connectionId(), now);
        }
        return true;
    }

    public void markAlive(ConnectionHandle handle) {
        ChatSession session = sessions.get(handle.sessionId());
        if (session != null) {
            session.markSeen(handle.connectionId(), clock.instant());
        }
    }

    public void closeConnection(ConnectionHandle handle) {
        ChatSession session = sessions.get(handle.sessionId());
        messageRateLimiter.reset(handle.rateKey());
        if (session == null) {
            return;
        }
        ChatConnection removed = session.detach(handle.connectionId(), clock.instant());
        if (removed != null && removed.isOpen()) {
            removed.close("Connection closed");
        }
    }

    public boolean close(String sessionId) {
        ChatSession session;
        admissionLock.lock();
        try {
            session = sessions.remove(sessionId);
        } finally {
            admissionLock.unlock();
        }
        if (session == null) {
            return false;
        }
        release(session.terminate(SessionState.CLOSED), "Session closed");
        log.info("Closed session {}", sessionId);
        return true;
    }

    /**
     * Pings every connection and removes those silent past the connection timeout.
     *
     * @return number of connections removed
     */
    public int probeConnections() {
        Instant now = clock.instant();
        Instant deadline = now.minus(config.getConnectionTimeout());
        int removed = 0;
        for (ChatSession session : sessions.values()) {
            for (ChatConnection stale : session.staleConnections(deadline)) {
                dropConnection(session, stale, "Keep-alive timeout");
                removed++;
            }
            for (ChatConnection connection : session.connections()) {
                try {
                    connection.sendPing();
                } catch (IOException | RuntimeException ex) {
                    dropConnection(session, connection, "Ping failed");
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("Removed {} dead connections", removed);
        }
        return removed;
    }

    /**
     * Evicts sessions that have had no connection for longer than the idle grace.
     *
     * @return number of sessions evicted
     */
    public int evictIdle() {
        Instant deadline = clock.instant().minus(config.getIdleGrace());
        List<ChatSession.Teardown> expired = new ArrayList<>();
        admissionLock.lock();
        try {
            for (ChatSession session : List.copyOf(sessions.values())) {
                if (session.idleBefore(deadline)) {
                    sessions.remove(session.id());
                    expired.add(session.terminate(SessionState.EVICTED));
                    log.info("Evicted idle session {}", session.id());
                }
            }
        } finally {
            admissionLock.unlock();
        }
        expired.forEach(teardown -> release(teardown, IDLE_REASON));
        return expired.size();
    }

    /**
     * Makes the session the owner of a build. A session owns at most one running build.
     *
     * @return {@code false} if the session is unknown, closed or already running a build
     */
    public boolean attachRun(String sessionId, RunCancellation cancellation) {
        ChatSession session = sessions.get(sessionId);
        return session != null && session.tryAttachRun(cancellation);
    }

    public void detachRun(String sessionId, String runId) {
        ChatSession session = sessions.get(sessionId);
        if (session != null) {
            session.detachRun(runId);
        }
    }

    public boolean hasRunningBuild(String sessionId) {
        ChatSession session = sessions.get(sessionId);
        return session != null && session.hasRunningBuild();
    }

    public void setPendingRequest(String sessionId, @Nullable String request) {
        ChatSession session = sessions.get(sessionId);
        if (session != null) {
            session.pendingRequest(request);
        }
    }

    public @Nullable String pendingRequest(String sessionId) {
        ChatSession session = sessions.get(sessionId);
        return session == null ? null : session.pendingRequest();
    }

    public void setActiveBrand(String sessionId, @Nullable String brand) {
        ChatSession session = sessions.get(sessionId);
        if (session != null) {
            session.activeBrand(brand);
        }
    }

    public @Nullable String activeBrand(String sessionId) {
        ChatSession session = sessions.get(sessionId);
        return session == null ? null : session.activeBrand();
    }

    public @Nullable SessionState state(String sessionId) {
        ChatSession session = sessions.get(sessionId);
        return session == null ? null : session.state();
    }

    public int connectionCount(String sessionId) {
        ChatSession session = sessions.get(sessionId);
        return session == null ? 0 : session.connectionCount();
    }

    public boolean contains(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public int size() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        List<ChatSession.Teardown> closing = new ArrayList<>();
        admissionLock.lock();
        try {
            sessions.values().forEach(session -> closing.add(session.terminate(SessionState.CLOSED)));
            sessions.clear();
        } finally {
            admissionLock.unlock();
        }
        closing.forEach(teardown -> release(teardown, SHUTDOWN_REASON));
    }

    private void dropConnection(ChatSession session, ChatConnection connection, String reason) {
        ChatConnection removed = session.detach(connection.id(), clock.instant());
        messageRateLimiter.reset(new ConnectionHandle(session.id(), connection.id()).rateKey());
        if (removed != null) {
            closeQuietly(removed, reason);
        }
    }

    private void release(ChatSession.Teardown teardown, String reason) {
        teardown.runs().forEach(run -> {
            if (run.cancel(reason)) {
                log.info("Cancelled run {}: {}", run.runId(), reason);
            }
        });
        teardown.connections().forEach(connection -> closeQuietly(connection, reason));
    }

    private void closeQuietly(ChatConnection connection, String reason) {
        try {
            connection.close(reason);
        } catch (RuntimeException ex) {
            log.debug("Failed to close connection {}: {}", connection.id(), ex.getMessage());
        }
    }
}
