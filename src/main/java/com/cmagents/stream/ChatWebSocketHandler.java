package com.cmagents.stream;

import com.cmagents.ratelimit.CapacityExceededException;
import com.cmagents.session.ConnectionHandle;
import com.cmagents.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    static final String HANDLE_ATTRIBUTE = "cmagents.connectionHandle";
    private static final int MAX_SESSION_ID_LENGTH = 128;

    private final SessionRegistry sessionRegistry;
    private final ChatChannelService channelService;

    public ChatWebSocketHandler(SessionRegistry sessionRegistry, ChatChannelService channelService) {
        this.sessionRegistry = sessionRegistry;
        this.channelService = channelService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        String sessionId = sessionId(session.getUri());
        if (sessionId == null) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        WebSocketChatConnection connection = new WebSocketChatConnection(session);
        try {
            ConnectionHandle handle = sessionRegistry.admit(sessionId, connection);
            session.getAttributes().put(HANDLE_ATTRIBUTE, handle);
            log.debug("Connection {} joined chat session {}", session.getId(), sessionId);
        } catch (CapacityExceededException ex) {
            connection.send(channelService.errorPayload(ex.getMessage()));
            session.close(CloseStatus.POLICY_VIOLATION.withReason("capacity exceeded"));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ConnectionHandle handle = handle(session);
        if (handle == null) {
            return;
        }
        channelService.handle(handle, message.getPayload());
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        ConnectionHandle handle = handle(session);
        if (handle != null) {
            sessionRegistry.markAlive(handle);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on websocket {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ConnectionHandle handle = handle(session);
        if (handle != null) {
            sessionRegistry.closeConnection(handle);
        }
    }

    private @Nullable ConnectionHandle handle(WebSocketSession session) {
        Object value = session.getAttributes().get(HANDLE_ATTRIBUTE);
        return value instanceof ConnectionHandle handle ? handle : null;
    }

    static @Nullable String sessionId(@Nullable URI uri) {
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String path = uri.getPath();
        int slash = path.lastIndexOf('/');
        String segment = URLDecoder.decode(path.substring(slash + 1), StandardCharsets.UTF_8).trim();
        if (segment.isEmpty() || segment.length() > MAX_SESSION_ID_LENGTH) {
            return null;
        }
        return segment;
    }
}
