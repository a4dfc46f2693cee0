package com.cmagents.session;

import java.io.IOException;

/**
 * One live bidirectional connection backing a chat session.
 */
public interface ChatConnection {

    String id();

    boolean isOpen();

    void send(String payload) throws IOException;

    /**
     * Sends a transport-level keep-alive probe. The peer answers with a pong.
     */
    void sendPing() throws IOException;

    void close(String reason);
}
