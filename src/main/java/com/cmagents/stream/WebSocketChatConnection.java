package com.cmagents.stream;

import com.cmagents.session.ChatConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * {@link ChatConnection} over a servlet WebSocket session. Writes are serialized on the
 * session because the underlying endpoint does not allow concurrent sends.
 */
@Slf4j
class WebSocketChatConnection implements ChatConnection {

    private static final int MAX_CLOSE_REASON = 120;

    private final WebSocketSession session;

    WebSocketChatConnection(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String payload) throws IOException {
        synchronized (session) {
            session.sendMessage(new TextMessage(payload));
        }
    }

    @Override
    public void sendPing() throws IOException {
        synchronized (session) {
            session.sendMessage(new PingMessage(ByteBuffer.wrap(new byte[0])));
        }
    }

    @Override
    public void close(String reason) {
        if (!session.isOpen()) {
            return;
        }
        String trimmed = reason.length() > MAX_CLOSE_REASON ? reason.substring(0, MAX_CLOSE_REASON) : reason;
        try {
            session.close(CloseStatus.GOING_AWAY.withReason(trimmed));
        } catch (IOException ex) {
            log.debug("Failed to close websocket {}: {}", session.getId(), ex.getMessage());
        }
    }
}
