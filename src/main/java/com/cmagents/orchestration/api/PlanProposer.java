package com.cmagents.orchestration.api;

import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.PlanSignals;
import com.cmagents.orchestration.model.ProposedStep;
import com.cmagents.orchestration.planning.PlanningDelegateException;

import java.util.List;

/**
 * Source of worker plan proposals. The rule-based implementation is always present and
 * never fails; other implementations are optional delegates whose output is validated
 * and repaired before use.
 */
public interface PlanProposer {

    /**
     * Indicates whether this proposer can currently be asked for a plan.
     *
     * @return {@code true} when {@link #proposePlan(ContentRequest, PlanSignals)} may be called.
     */
    boolean available();

    /**
     * Proposes which workers should run for a request.
     *
     * @param request The content request being planned.
     * @param signals Context signals derived from the request and the brand configuration.
     * @return The proposed steps, in the order the proposer intends them to run. The list may be
     *         incomplete or inconsistent; callers validate it.
     * @throws PlanningDelegateException if no proposal could be produced.
     */
    List<ProposedStep> proposePlan(ContentRequest request, PlanSignals signals);
}
