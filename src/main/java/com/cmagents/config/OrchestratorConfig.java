package com.cmagents.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@Slf4j
public class OrchestratorConfig {

    @Bean
    public ChatClient planningChatClient(CampaignAgentsProperties properties,
                                         ObjectProvider<GoogleGenAiChatModel> googleChatModelProvider,
                                         ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        return switch (properties.getAiProvider()) {
            case GOOGLE -> googleChatModelProvider.getIfAvailable() != null
                    ? ChatClient.builder(googleChatModelProvider.getIfAvailable()).build()
                    : missingModel("google");
            case OPENAI -> openAiChatModelProvider.getIfAvailable() != null
                    ? ChatClient.builder(openAiChatModelProvider.getIfAvailable()).build()
                    : missingModel("openai");
            case NONE -> null;
        };
    }

    private ChatClient missingModel(String provider) {
        log.warn("AI provider {} selected but no chat model is configured; planning and translation use rules only.",
                provider);
        return null;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService workerExecutor(CampaignAgentsProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerConcurrency());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService orchestrationExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
