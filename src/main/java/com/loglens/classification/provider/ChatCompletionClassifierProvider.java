package com.loglens.classification.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Chat-completions style endpoints (OpenAI, Mistral and compatible servers
 * such as vLLM): a single user message in, {@code choices[0].message.content} out.
 */
public class ChatCompletionClassifierProvider extends AbstractHttpClassifierProvider {
    
    private final String name;
    
    public ChatCompletionClassifierProvider(String name, WebClient webClient, ObjectMapper objectMapper,
                                            String endpoint, String model, Duration timeout) {
        super(webClient, objectMapper, endpoint, model, timeout);
        this.name = name;
    }
    
    @Override
    public String getName() {
        return name;
    }
    
    @Override
    public ObjectNode buildPayload(String prompt) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", getModel());
        ObjectNode message = payload.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", prompt);
        payload.put("temperature", TEMPERATURE);
        payload.put("max_tokens", MAX_TOKENS);
        return payload;
    }
    
    @Override
    public String extractText(JsonNode response) {
        checkError(response);
        JsonNode choices = response.get("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw missing("choices");
        }
        JsonNode content = choices.get(0).path("message").get("content");
        if (content == null || content.isNull()) {
            throw missing("choices[0].message.content");
        }
        return content.asText().trim();
    }
    
    @Override
    public long extractTokenUsage(JsonNode response) {
        return response.path("usage").path("total_tokens").asLong(0);
    }
}
