package com.cmagents.orchestration.service;

import com.cmagents.brand.BrandProfile;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.InputTranslation;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

import static com.cmagents.orchestration.OrchestrationConstants.*;

/**
 * Turns a free-text chat request into run parameters. Uses the chat model when one is
 * configured and falls back to fixed defaults plus intent detection otherwise.
 */
@Service
@Slf4j
public class RequestTranslationService {

    private final @Nullable ChatClient chatClient;
    private final JsonProcessingService jsonProcessingService;
    private final IntentDetectionService intentDetectionService;

    @Autowired
    public RequestTranslationService(@Qualifier("planningChatClient") ObjectProvider<ChatClient> chatClientProvider,
                                     JsonProcessingService jsonProcessingService,
                                     IntentDetectionService intentDetectionService) {
        this(chatClientProvider.getIfAvailable(), jsonProcessingService, intentDetectionService);
    }

    public RequestTranslationService(@Nullable ChatClient chatClient,
                                     JsonProcessingService jsonProcessingService,
                                     IntentDetectionService intentDetectionService) {
        this.chatClient = chatClient;
        this.jsonProcessingService = jsonProcessingService;
        this.intentDetectionService = intentDetectionService;
    }

    public InputTranslation translate(BrandProfile brand, String userRequest) {
        InputTranslation fallback = fallback(userRequest);
        if (chatClient == null) {
            return fallback;
        }
        List<String> available = List.copyOf(brand.products().keySet());
        String raw;
        try {
            raw = chatClient.prompt()
                    .system(TRANSLATOR_SYSTEM_PROMPT)
                    .user(user -> user.text(TRANSLATOR_USER_TEMPLATE)
                            .param("brand", brand.id())
                            .param("products", available.isEmpty() ? "none" : String.join(", ", available))
                            .param("request", userRequest))
                    .call()
                    .content();
        } catch (RuntimeException ex) {
            log.warn("Request translation failed, using defaults: {}", ex.getMessage());
            return fallback;
        }
        Optional<TranslationResponse> parsed = jsonProcessingService.parseJsonResponse(PURPOSE_TRANSLATION, raw,
                TranslationResponse.class);
        if (parsed.isEmpty()) {
            return fallback;
        }
        TranslationResponse response = parsed.get();
        String objective = StringUtils.hasText(response.objective()) ? response.objective().trim() : fallback.objective();
        int days = clampDays(response.days() != null ? response.days() : DEFAULT_DAYS);
        boolean build = response.build() == null || response.build();
        boolean includeText = response.includeText() != null ? response.includeText() : fallback.includeText();
        if (intentDetectionService.requestsNoText(userRequest)) {
            includeText = false;
        }
        List<String> products = response.products() == null ? List.of() : response.products().stream()
                .filter(available::contains)
                .distinct()
                .toList();
        String reason = StringUtils.hasText(response.reason()) ? response.reason() : TRANSLATION_REASON_LLM;
        return new InputTranslation(objective, days, build, includeText, products, reason, TRANSLATION_MODE_LLM);
    }

    public InputTranslation fallback(String userRequest) {
        String objective = StringUtils.hasText(userRequest) ? userRequest.trim() : DEFAULT_OBJECTIVE;
        boolean includeText = !intentDetectionService.requestsNoText(userRequest);
        return new InputTranslation(objective, DEFAULT_DAYS, true, includeText, List.of(),
                TRANSLATION_REASON_FALLBACK, TRANSLATION_MODE_FALLBACK);
    }

    static int clampDays(int days) {
        return Math.max(ContentRequest.MIN_DAYS, Math.min(ContentRequest.MAX_DAYS, days));
    }

    record TranslationResponse(
            String objective,
            Integer days,
            Boolean build,
            @JsonProperty("include_text") Boolean includeText,
            List<String> products,
            String reason
    ) {
    }
}
