package com.missionforge.core.agent;

import com.missionforge.core.error.GenerationFailureException;
import com.missionforge.core.state.Feedback;
import com.missionforge.llm.Conversation;
import com.missionforge.llm.LLMClient;
import com.missionforge.llm.LLMClientException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * MissionPlannerAgent: asks the model for an XML mission plan.
 *
 * Every request/answer pair is kept in the conversation, so a corrected plan
 * is asked for with the rejected one still in view.
 */
@Component
public class MissionPlannerAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(MissionPlannerAgent.class);

    private final LLMClient llmClient;

    public MissionPlannerAgent(LLMClient llmClient) {
        this.llmClient = llmClient;
    }

    @Override
    public String getAgentId() { return "mission-planner-1"; }

    @Override
    public AgentType getAgentType() { return AgentType.MISSION_PLANNER; }

    /**
     * @param feedback diagnostic of the previous attempt, or null for the first one
     * @return the XML document inside the answer's ```xml block
     */
    public String generateMission(Conversation conversation, String missionRequest, Feedback feedback)
            throws GenerationFailureException {

        String prompt = buildPrompt(missionRequest, feedback);
        log.info("[MissionPlanner] Requesting mission plan (feedback={})",
                feedback != null ? feedback.getKind() : "none");

        String answer;
        try {
            answer = llmClient.generateWithRole(
                    AgentType.MISSION_PLANNER,
                    conversation,
                    prompt,
                    llmClient.getTemperatureForRole(AgentType.MISSION_PLANNER)
            );
        } catch (LLMClientException e) {
            throw new GenerationFailureException("Mission planner call failed: " + e.getMessage(), e);
        }

        conversation.addTurn(prompt, answer);
        log.debug("[MissionPlanner] Answer:\n{}", answer);

        return CodeBlockExtractor.extract(answer, "xml");
    }

    private String buildPrompt(String missionRequest, Feedback feedback) {
        if (feedback == null) {
            return missionRequest;
        }

        return switch (feedback.getKind()) {
            case PROPERTY_VIOLATED -> "SPIN found a counterexample: this mission plan violates the temporal "
                    + "property derived from the request. Revise the plan so the property holds and return "
                    + "the full XML mission plan. Counterexample trail:\n" + feedback.getDiagnostic();
            default -> "I got this error on validation. Please fix and return to me the full XML mission plan:\n"
                    + feedback.getDiagnostic();
        };
    }
}
