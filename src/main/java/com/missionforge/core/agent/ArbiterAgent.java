package com.missionforge.core.agent;

import com.missionforge.core.automaton.AcceptingRun;
import com.missionforge.core.error.GenerationFailureException;
import com.missionforge.llm.Conversation;
import com.missionforge.llm.LLMClient;
import com.missionforge.llm.LLMClientException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * ArbiterAgent: shows sampled executions of the property to a second model
 * and asks whether they are faithful to the original request.
 *
 * Questions are self-contained; nothing is added to the conversation.
 */
@Component
public class ArbiterAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(ArbiterAgent.class);

    private final LLMClient llmClient;

    public ArbiterAgent(LLMClient llmClient) {
        this.llmClient = llmClient;
    }

    @Override
    public String getAgentId() { return "arbiter-1"; }

    @Override
    public AgentType getAgentType() { return AgentType.ARBITER; }

    public ArbiterVerdict judge(Conversation conversation, String missionRequest, List<AcceptingRun> runs)
            throws GenerationFailureException {

        String examples = runs.stream()
                .map(AcceptingRun::toString)
                .collect(Collectors.joining("\n"));

        String prompt = "Please answer this with one word: \"Yes\" or \"No\". "
                + "Here is a mission plan request along with examples of how this mission would be carried out. "
                + "In your opinion, would you say that ALL of these examples are faithful to the requested mission?\n"
                + "Mission request:\n" + missionRequest + "\n"
                + "Example runs:\n" + examples;

        log.debug("[Arbiter] Asking:\n{}", prompt);

        String answer;
        try {
            answer = llmClient.generateWithRole(
                    AgentType.ARBITER,
                    conversation,
                    prompt,
                    llmClient.getTemperatureForRole(AgentType.ARBITER)
            );
        } catch (LLMClientException e) {
            throw new GenerationFailureException("Arbiter call failed: " + e.getMessage(), e);
        }

        boolean accepted = answer.toLowerCase(Locale.ROOT).contains("yes");
        log.info("[Arbiter] Verdict: {}", accepted ? "accepted" : "rejected");

        String rationale = accepted
                ? answer
                : answer + "\nRejected example runs:\n" + examples;
        return new ArbiterVerdict(accepted, rationale);
    }
}
