package com.missionforge.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.missionforge.core.agent.AgentType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OllamaLLMClient: default LLMClient backed by a local Ollama server's chat API.
 *
 * The arbiter may run on a different model than the generators
 * (ollama.arbiter-model); when unset it shares ollama.model.
 */
@Component
@Profile("!gemini & !mock & !test")
public class OllamaLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLLMClient.class);

    @Value("${ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${ollama.model:llama3:8b}")
    private String model;

    @Value("${ollama.arbiter-model:}")
    private String arbiterModel;

    private final RestTemplate restTemplate = new RestTemplate();
    private final ObjectMapper objectMapper  = new ObjectMapper();

    // =========================================================================
    // LLMClient contract
    // =========================================================================

    @Override
    public String generateWithRole(AgentType role, Conversation conversation, String prompt, double temperature) {
        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(message("system", SystemPrompts.forRole(role)));
        for (ChatMessage m : conversation.getMessages()) {
            messages.add(message(m.getRole(), m.getContent()));
        }
        messages.add(message(ChatMessage.USER, prompt));

        String target = modelFor(role);
        log.debug("[Ollama] role={} model={} temperature={} messages={}",
                role, target, temperature, messages.size());

        return callOllama(target, messages, temperature);
    }

    private String modelFor(AgentType role) {
        if (role == AgentType.ARBITER && arbiterModel != null && !arbiterModel.isBlank()) {
            return arbiterModel;
        }
        return model;
    }

    // =========================================================================
    // HTTP client
    // =========================================================================

    private String callOllama(String targetModel, List<Map<String, String>> messages, double temperature) {
        try {
            String url = baseUrl + "/api/chat";

            Map<String, Object> body = new HashMap<>();
            body.put("model",    targetModel);
            body.put("messages", messages);
            body.put("options",  Map.of("temperature", temperature));
            body.put("stream",   false);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            ResponseEntity<String> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

            JsonNode root = objectMapper.readTree(response.getBody());

            String result = root.path("message").path("content").asText("");
            log.debug("[Ollama] responseLen={}", result.length());
            return result;

        } catch (RestClientException | JsonProcessingException e) {
            log.error("[Ollama] Call failed: {}", e.getMessage());
            throw new LLMClientException("Ollama LLM call failed: " + e.getMessage(), e);
        }
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> m = new HashMap<>();
        m.put("role",    role);
        m.put("content", content);
        return m;
    }
}
