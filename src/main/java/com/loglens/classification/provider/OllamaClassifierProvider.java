package com.loglens.classification.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Ollama {@code /api/generate} endpoint, non-streaming.
 */
public class OllamaClassifierProvider extends AbstractHttpClassifierProvider {
    
    public OllamaClassifierProvider(WebClient webClient, ObjectMapper objectMapper,
                                    String endpoint, String model, Duration timeout) {
        super(webClient, objectMapper, endpoint, model, timeout);
    }
    
    @Override
    public String getName() {
        return "ollama";
    }
    
    @Override
    public ObjectNode buildPayload(String prompt) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", getModel());
        payload.put("prompt", prompt);
        payload.put("stream", false);
        ObjectNode options = payload.putObject("options");
        options.put("temperature", TEMPERATURE);
        options.put("num_predict", MAX_TOKENS);
        options.putArray("stop").add("</s>").add("Human:").add("Assistant:");
        options.put("repeat_penalty", 1.1);
        return payload;
    }
    
    @Override
    public String extractText(JsonNode response) {
        checkError(response);
        JsonNode reply = response.get("response");
        if (reply == null || reply.isNull()) {
            throw missing("response");
        }
        return reply.asText().trim();
    }
    
    @Override
    public long extractTokenUsage(JsonNode response) {
        return response.path("prompt_eval_count").asLong(0) + response.path("eval_count").asLong(0);
    }
}
