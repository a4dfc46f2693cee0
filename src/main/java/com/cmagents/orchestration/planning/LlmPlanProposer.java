package com.cmagents.orchestration.planning;

import com.cmagents.config.CampaignAgentsProperties;
import com.cmagents.orchestration.api.PlanProposer;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.PlanSignals;
import com.cmagents.orchestration.model.ProposedStep;
import com.cmagents.orchestration.service.JsonProcessingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.cmagents.orchestration.OrchestrationConstants.PLANNER_SYSTEM_PROMPT;
import static com.cmagents.orchestration.OrchestrationConstants.PLANNER_USER_TEMPLATE;
import static com.cmagents.orchestration.OrchestrationConstants.PURPOSE_PLAN;

/**
 * Planning delegate backed by the configured chat model.
 */
@Component
@Slf4j
public class LlmPlanProposer implements PlanProposer {

    private final @Nullable ChatClient chatClient;
    private final JsonProcessingService jsonProcessingService;
    private final CampaignAgentsProperties properties;

    public LlmPlanProposer(@Qualifier("planningChatClient") ObjectProvider<ChatClient> chatClientProvider,
                           JsonProcessingService jsonProcessingService,
                           CampaignAgentsProperties properties) {
        this.chatClient = chatClientProvider.getIfAvailable();
        this.jsonProcessingService = jsonProcessingService;
        this.properties = properties;
    }

    @Override
    public boolean available() {
        return chatClient != null && properties.getPlanning().isDelegateEnabled();
    }

    @Override
    public List<ProposedStep> proposePlan(ContentRequest request, PlanSignals signals) {
        if (chatClient == null) {
            throw new PlanningDelegateException("No chat model configured for planning.");
        }
        String raw;
        try {
            raw = chatClient.prompt()
                    .system(PLANNER_SYSTEM_PROMPT)
                    .user(user -> user.text(PLANNER_USER_TEMPLATE)
                            .param("objective", request.objective())
                            .param("constraints", request.constraints().isEmpty() ? "none" : request.constraints())
                            .param("build", request.build())
                            .param("includeText", request.includeText())
                            .param("maxRetries", request.maxRetries())
                            .param("styleReference", signals.styleReferencePresent())
                            .param("brandReferences", signals.brandReferencesPresent())
                            .param("trendRequested", signals.trendRequested())
                            .param("noTextRequested", signals.noTextRequested()))
                    .call()
                    .content();
        } catch (RuntimeException ex) {
            throw new PlanningDelegateException("Planning model call failed: " + ex.getMessage(), ex);
        }
        PlanProposal proposal = jsonProcessingService.parseJsonResponse(PURPOSE_PLAN, raw, PlanProposal.class)
                .orElseThrow(() -> new PlanningDelegateException("Planning model returned no parsable plan."));
        if (proposal.workers() == null || proposal.workers().isEmpty()) {
            throw new PlanningDelegateException("Planning model returned an empty plan.");
        }
        log.debug("Planning delegate proposed {}", proposal.workers());
        return proposal.workers();
    }

    record PlanProposal(List<ProposedStep> workers) {
    }
}
