package com.loglens.classification.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Anthropic text completion endpoint (Human/Assistant prompt framing).
 */
public class AnthropicClassifierProvider extends AbstractHttpClassifierProvider {
    
    public AnthropicClassifierProvider(WebClient webClient, ObjectMapper objectMapper,
                                       String endpoint, String model, Duration timeout) {
        super(webClient, objectMapper, endpoint, model, timeout);
    }
    
    @Override
    public String getName() {
        return "anthropic";
    }
    
    @Override
    public ObjectNode buildPayload(String prompt) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", getModel());
        payload.put("prompt", "\n\nHuman: " + prompt + "\n\nAssistant:");
        payload.put("temperature", TEMPERATURE);
        payload.put("max_tokens_to_sample", MAX_TOKENS);
        return payload;
    }
    
    @Override
    public String extractText(JsonNode response) {
        checkError(response);
        JsonNode completion = response.get("completion");
        if (completion == null || completion.isNull()) {
            throw missing("completion");
        }
        return completion.asText().trim();
    }
}
