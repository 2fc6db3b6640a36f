package com.missionforge.core.agent;

import com.missionforge.core.automaton.AcceptingRun;
import com.missionforge.core.compiler.CompiledProgram;
import com.missionforge.core.error.FailureKind;
import com.missionforge.core.error.GenerationFailureException;
import com.missionforge.core.state.Feedback;
import com.missionforge.llm.ChatMessage;
import com.missionforge.llm.Conversation;
import com.missionforge.llm.LLMClient;
import com.missionforge.llm.LLMClientException;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AgentsTest {

    /** Answers with a fixed text and records the prompts it saw. */
    static class CannedClient implements LLMClient {
        final List<String> prompts = new ArrayList<>();
        final String answer;
        boolean fail;

        CannedClient(String answer) {
            this.answer = answer;
        }

        @Override
        public String generateWithRole(AgentType role, Conversation conversation, String prompt, double temperature) {
            if (fail) throw new LLMClientException("connection refused");
            prompts.add(prompt);
            return answer;
        }
    }

    @Test
    void testPlannerKeepsTurnAndExtractsXml() throws Exception {
        CannedClient client = new CannedClient("```xml\n<Mission/>\n```");
        MissionPlannerAgent planner = new MissionPlannerAgent(client);
        Conversation conversation = new Conversation(List.of(ChatMessage.user("schema")));

        String xml = planner.generateMission(conversation, "survey the orchard", null);

        assertEquals("<Mission/>", xml);
        assertEquals("survey the orchard", client.prompts.get(0));
        assertEquals(3, conversation.size());
        assertEquals(ChatMessage.ASSISTANT, conversation.getMessages().get(2).getRole());
    }

    @Test
    void testPlannerFeedbackPrompts() throws Exception {
        CannedClient client = new CannedClient("```xml\n<Mission/>\n```");
        MissionPlannerAgent planner = new MissionPlannerAgent(client);

        planner.generateMission(Conversation.empty(), "req",
                new Feedback(FailureKind.SCHEMA_VIOLATION, "cvc-complex-type.2.4.a"));
        planner.generateMission(Conversation.empty(), "req",
                new Feedback(FailureKind.PROPERTY_VIOLATED, "trail ends after 3 steps"));

        assertTrue(client.prompts.get(0).startsWith("I got this error on validation."));
        assertTrue(client.prompts.get(0).endsWith("cvc-complex-type.2.4.a"));
        assertTrue(client.prompts.get(1).contains("counterexample"));
        assertTrue(client.prompts.get(1).endsWith("trail ends after 3 steps"));
    }

    @Test
    void testClientFailureBecomesGenerationFailure() {
        CannedClient client = new CannedClient("");
        client.fail = true;

        assertThrows(GenerationFailureException.class,
                () -> new MissionPlannerAgent(client).generateMission(Conversation.empty(), "req", null));
        assertThrows(GenerationFailureException.class,
                () -> new PropertyAgent(client).generateProperty(Conversation.empty(), "req", null));
    }

    @Test
    void testPropertyAgentPrimingAndDriftPrompt() throws Exception {
        CannedClient client = new CannedClient("```ltl\nltl m { <>x }\n```");
        PropertyAgent agent = new PropertyAgent(client);
        Conversation conversation = Conversation.empty();
        CompiledProgram program = new CompiledProgram("", List.of("T1", "T2"), List.of("temp"), Set.of(), "");

        agent.primeWithModel(conversation, program);
        String property = agent.generateProperty(conversation, "req",
                new Feedback(FailureKind.DRIFT, "The property describes 2 more task(s) than the mission plan."));

        assertEquals("ltl m { <>x }", property);
        String priming = conversation.getMessages().get(0).getContent();
        assertTrue(priming.contains("Tasks:\nT1\nT2\n"));
        assertTrue(priming.contains("Sample returns:\ntemp"));
        assertTrue(client.prompts.get(0).startsWith("The property describes 2 more task(s)"));
    }

    @Test
    void testArbiterAcceptsOnYes() throws Exception {
        CannedClient client = new CannedClient("Yes, all runs match.");
        ArbiterAgent arbiter = new ArbiterAgent(client);
        Conversation conversation = Conversation.empty();

        ArbiterVerdict verdict = arbiter.judge(conversation, "visit tree 1",
                List.of(new AcceptingRun(List.of("a", "b"))));

        assertTrue(verdict.isAccepted());
        assertTrue(client.prompts.get(0).contains("Example runs:\na b"));
        assertEquals(0, conversation.size());
    }

    @Test
    void testArbiterRejectionCarriesRuns() throws Exception {
        ArbiterAgent arbiter = new ArbiterAgent(new CannedClient("No."));

        ArbiterVerdict verdict = arbiter.judge(Conversation.empty(), "visit tree 1",
                List.of(new AcceptingRun(List.of("a"))));

        assertFalse(verdict.isAccepted());
        assertTrue(verdict.getRationale().startsWith("No."));
        assertTrue(verdict.getRationale().contains("Rejected example runs:\na"));
    }
}
