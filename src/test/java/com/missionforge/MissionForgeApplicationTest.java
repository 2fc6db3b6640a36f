package com.missionforge;

import com.missionforge.core.automaton.Automaton;
import com.missionforge.core.automaton.LtlTranslator;
import com.missionforge.core.checker.ModelChecker;
import com.missionforge.core.checker.VerifyResult;
import com.missionforge.orchestrator.VerificationOrchestrator;
import com.missionforge.orchestrator.dto.MissionResult;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full context on the "test" profile: canned model answers, SPIN and the
 * LTL translator replaced by in-process stubs.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class MissionForgeApplicationTest {

    @TestConfiguration
    static class StubTools {

        /** Five progress transitions, matching the five tasks of the canned mission. */
        @Bean
        @Primary
        LtlTranslator chainTranslator() {
            return formula -> {
                List<Automaton.Edge> edges = new ArrayList<>();
                for (int s = 0; s < 5; s++) {
                    edges.add(new Automaton.Edge(s, s + 1, "step" + s));
                }
                edges.add(new Automaton.Edge(5, 5, "1"));
                return new Automaton(6, 0, Set.of(5), List.of(), edges);
            };
        }

        @Bean
        @Primary
        ModelChecker passingChecker() {
            return (program, property, workDir) -> VerifyResult.passed(workDir.resolve("mission.pml"));
        }
    }

    @Autowired
    private VerificationOrchestrator orchestrator;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testMockMissionVerifies() {
        MissionResult result = orchestrator.verify("Visit tree 1, measure temperature, then head to the end tree");

        assertTrue(result.isSuccess(), result.getDiagnostic());
        assertEquals("DONE", result.getFinalState());
        assertEquals(0, result.getRetries());
        assertNotNull(result.getMissionPath());
        assertEquals(5, result.getSampledRuns().size());
    }

    @Test
    void testVerifyEndpoint() throws Exception {
        mockMvc.perform(post("/missions/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"Survey the orchard\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.finalState").value("DONE"));
    }

    @Test
    void testBlankRequestRejected() throws Exception {
        mockMvc.perform(post("/missions/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"  \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testSchemasEndpoint() throws Exception {
        mockMvc.perform(get("/missions/schemas"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("mission.xsd"));
    }
}
