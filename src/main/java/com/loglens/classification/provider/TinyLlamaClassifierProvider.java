package com.loglens.classification.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Small local models served behind an Ollama-compatible generate endpoint,
 * called without sampling options.
 */
public class TinyLlamaClassifierProvider extends AbstractHttpClassifierProvider {
    
    public TinyLlamaClassifierProvider(WebClient webClient, ObjectMapper objectMapper,
                                       String endpoint, String model, Duration timeout) {
        super(webClient, objectMapper, endpoint, model, timeout);
    }
    
    @Override
    public String getName() {
        return "tinyllama";
    }
    
    @Override
    public ObjectNode buildPayload(String prompt) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", getModel());
        payload.put("prompt", prompt);
        payload.put("stream", false);
        return payload;
    }
    
    @Override
    public String extractText(JsonNode response) {
        return response.path("response").asText("").trim();
    }
}
