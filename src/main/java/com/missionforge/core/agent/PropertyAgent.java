package com.missionforge.core.agent;

import com.missionforge.core.compiler.CompiledProgram;
import com.missionforge.core.error.GenerationFailureException;
import com.missionforge.core.state.Feedback;
import com.missionforge.llm.Conversation;
import com.missionforge.llm.LLMClient;
import com.missionforge.llm.LLMClientException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * PropertyAgent: asks the model for the LTL property a mission must satisfy.
 *
 * Before the first request of a mission the conversation is primed with the
 * task and variable names of the compiled model, which are the only names
 * SPIN will accept in the property.
 */
@Component
public class PropertyAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(PropertyAgent.class);

    private final LLMClient llmClient;

    public PropertyAgent(LLMClient llmClient) {
        this.llmClient = llmClient;
    }

    @Override
    public String getAgentId() { return "property-generator-1"; }

    @Override
    public AgentType getAgentType() { return AgentType.PROPERTY_GENERATOR; }

    public void primeWithModel(Conversation conversation, CompiledProgram program) {
        conversation.addContext(
                "You MUST use these Promela object names when generating the LTL. "
                + "Otherwise syntax will be incorrect and SPIN will fail:\n"
                + "Tasks:\n" + String.join("\n", program.getTaskNames()) + "\n"
                + "Sample returns:\n" + String.join("\n", program.getGlobalNames()));
    }

    /**
     * @param feedback diagnostic of the previous attempt, or null for the first one
     * @return the property inside the answer's ```ltl block
     */
    public String generateProperty(Conversation conversation, String missionRequest, Feedback feedback)
            throws GenerationFailureException {

        String prompt = buildPrompt(missionRequest, feedback);
        log.info("[PropertyAgent] Requesting property (feedback={})",
                feedback != null ? feedback.getKind() : "none");

        String answer;
        try {
            answer = llmClient.generateWithRole(
                    AgentType.PROPERTY_GENERATOR,
                    conversation,
                    prompt,
                    llmClient.getTemperatureForRole(AgentType.PROPERTY_GENERATOR)
            );
        } catch (LLMClientException e) {
            throw new GenerationFailureException("Property generator call failed: " + e.getMessage(), e);
        }

        conversation.addTurn(prompt, answer);
        log.debug("[PropertyAgent] Answer:\n{}", answer);

        return CodeBlockExtractor.extract(answer, "ltl");
    }

    private String buildPrompt(String missionRequest, Feedback feedback) {
        if (feedback == null) {
            return "Generate SPIN LTL based on this mission plan: " + missionRequest;
        }

        String diagnostic = feedback.getDiagnostic();
        return switch (feedback.getKind()) {
            case MODEL_CHECKER_EXECUTION -> "Failure occurred in SPIN validation output. Generate a new LTL:\n"
                    + diagnostic;
            case DRIFT -> diagnostic + " Generate a new LTL that covers every task of the mission exactly once.";
            case ARBITER_REJECTION -> "A reviewer judged example executions of your LTL unfaithful to the "
                    + "mission request. Their answer:\n" + diagnostic + "\nGenerate a new LTL.";
            case PROPERTY_SYNTAX -> "The LTL could not be translated into an automaton:\n" + diagnostic
                    + "\nGenerate a new LTL in SPIN syntax.";
            case SAMPLING_FAILURE -> "No finite execution satisfies your LTL: " + diagnostic
                    + "\nGenerate a new LTL.";
            default -> "Generate a new LTL. The previous one failed:\n" + diagnostic;
        };
    }
}
