package com.cmagents.api;

import com.cmagents.session.SessionRegistry;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/chat/history")
public class ChatHistoryController {

    private final SessionRegistry sessionRegistry;

    public ChatHistoryController(SessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    @GetMapping("/{sessionId}")
    public ChatHistoryResponse history(@PathVariable String sessionId) {
        return new ChatHistoryResponse(sessionId, sessionRegistry.history(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ClearHistoryResponse clear(@PathVariable String sessionId) {
        return new ClearHistoryResponse(sessionId, sessionRegistry.clearHistory(sessionId));
    }
}
