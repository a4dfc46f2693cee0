package com.cmagents.orchestration.service;

import com.cmagents.brand.BrandProfile;
import com.cmagents.config.CampaignAgentsProperties;
import com.cmagents.orchestration.model.InputTranslation;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static com.cmagents.orchestration.OrchestrationConstants.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RequestTranslationServiceTest {

    private final JsonProcessingService jsonProcessingService =
            new JsonProcessingService(Jackson2ObjectMapperBuilder.json().build());
    private final IntentDetectionService intentDetectionService =
            new IntentDetectionService(new CampaignAgentsProperties());
    private final BrandProfile brand = new BrandProfile("cafe-sol", "Cafe Sol", "food", List.of(), List.of(),
            Map.of("latte", "Latte", "croissant", "Croissant"), 2);

    private static ChatClient respondingWith(String content) {
        ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        when(chatClient.prompt().system(anyString()).user(ArgumentMatchers.<Consumer<ChatClient.PromptUserSpec>>any())
                .call().content()).thenReturn(content);
        return chatClient;
    }

    @Test
    void fallbackUsesDefaultsAndIntentDetection() {
        RequestTranslationService service = new RequestTranslationService((ChatClient) null, jsonProcessingService,
                intentDetectionService);

        InputTranslation translation = service.translate(brand, "Promo de latte sin texto");

        assertEquals("Promo de latte sin texto", translation.objective());
        assertEquals(DEFAULT_DAYS, translation.days());
        assertTrue(translation.build());
        assertFalse(translation.includeText());
        assertEquals(List.of(), translation.products());
        assertEquals(TRANSLATION_REASON_FALLBACK, translation.reason());
        assertEquals(TRANSLATION_MODE_FALLBACK, translation.mode());
    }

    @Test
    void blankRequestGetsDefaultObjective() {
        RequestTranslationService service = new RequestTranslationService((ChatClient) null, jsonProcessingService,
                intentDetectionService);

        assertEquals(DEFAULT_OBJECTIVE, service.fallback("   ").objective());
    }

    @Test
    void usesModelTranslationAndClampsValues() {
        ChatClient chatClient = respondingWith("""
                Sure:
                {"objective":"Latte week","days":30,"build":false,"include_text":true,
                 "products":["latte","espresso","latte"],"reason":"weekly promo"}
                """);
        RequestTranslationService service = new RequestTranslationService(chatClient, jsonProcessingService,
                intentDetectionService);

        InputTranslation translation = service.translate(brand, "Una semana de latte");

        assertEquals("Latte week", translation.objective());
        assertEquals(14, translation.days());
        assertFalse(translation.build());
        assertTrue(translation.includeText());
        assertEquals(List.of("latte"), translation.products());
        assertEquals("weekly promo", translation.reason());
        assertEquals(TRANSLATION_MODE_LLM, translation.mode());
    }

    @Test
    void noTextWordingOverridesTheModel() {
        ChatClient chatClient = respondingWith("{\"objective\":\"Latte\",\"days\":2,\"include_text\":true}");
        RequestTranslationService service = new RequestTranslationService(chatClient, jsonProcessingService,
                intentDetectionService);

        InputTranslation translation = service.translate(brand, "Latte, solo producto");

        assertFalse(translation.includeText());
        assertTrue(translation.build());
        assertEquals(2, translation.days());
        assertEquals(TRANSLATION_REASON_LLM, translation.reason());
    }

    @Test
    void unparsableModelOutputFallsBack() {
        RequestTranslationService service = new RequestTranslationService(respondingWith("I cannot help with that"),
                jsonProcessingService, intentDetectionService);

        assertEquals(TRANSLATION_MODE_FALLBACK, service.translate(brand, "Latte promo").mode());
    }

    @Test
    void modelErrorsFallBack() {
        ChatClient chatClient = mock(ChatClient.class);
        when(chatClient.prompt()).thenThrow(new IllegalStateException("401 Unauthorized"));
        RequestTranslationService service = new RequestTranslationService(chatClient, jsonProcessingService,
                intentDetectionService);

        InputTranslation translation = service.translate(brand, "Latte promo");

        assertEquals(TRANSLATION_MODE_FALLBACK, translation.mode());
        assertEquals("Latte promo", translation.objective());
    }

    @Test
    void clampsDaysIntoRange() {
        assertEquals(1, RequestTranslationService.clampDays(0));
        assertEquals(7, RequestTranslationService.clampDays(7));
        assertEquals(14, RequestTranslationService.clampDays(99));
    }
}
