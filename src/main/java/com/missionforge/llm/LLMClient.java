package com.missionforge.llm;

import com.missionforge.core.agent.AgentType;

/**
 * LLMClient: single interface for all model interactions.
 *
 * Implementations are stateless: the history lives in the Conversation the
 * caller passes in, and the caller decides whether the new turn is kept.
 *
 * getTemperatureForRole(AgentType) is a default method so the canonical
 * temperatures live here, not scattered across agents.
 */
public interface LLMClient {

    /**
     * @param role         agent role; selects the system prompt (and possibly the model)
     * @param conversation history sent ahead of the prompt; not modified
     * @param prompt       new user message
     * @param temperature  sampling temperature
     * @return raw model answer; never null
     * @throws LLMClientException when no answer could be obtained
     */
    String generateWithRole(AgentType role, Conversation conversation, String prompt, double temperature);

    /**
     * MISSION_PLANNER    0.2   schema-bound XML
     * PROPERTY_GENERATOR 0.2   SPIN LTL syntax
     * ARBITER            0.0   yes/no judgement
     */
    default double getTemperatureForRole(AgentType role) {
        return switch (role) {
            case MISSION_PLANNER    -> 0.2;
            case PROPERTY_GENERATOR -> 0.2;
            case ARBITER            -> 0.0;
        };
    }
}
