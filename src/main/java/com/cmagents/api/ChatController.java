package com.cmagents.api;

import com.cmagents.stream.ChatChannelService;
import com.cmagents.stream.ChatReply;
import com.cmagents.session.ChatMessage;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Request/response chat for clients without a WebSocket. Answers with the plan preview
 * and never starts a build.
 */
@RestController
@RequestMapping("/api/v1/chat")
@Slf4j
public class ChatController {

    private final ChatChannelService chatChannelService;
    private final Clock clock;

    public ChatController(ChatChannelService chatChannelService, Clock clock) {
        this.chatChannelService = chatChannelService;
        this.clock = clock;
    }

    @PostMapping
    public ChatResponse chat(@Valid @RequestBody ChatRequest request) {
        String brand = StringUtils.hasText(request.brand()) ? request.brand().trim() : null;
        log.debug("REST chat for brand {}", brand);
        ChatReply reply = chatChannelService.preview(brand, request.message().trim());
        return new ChatResponse(ChatMessage.assistant(reply.content(), clock.instant()), reply.plan());
    }
}
