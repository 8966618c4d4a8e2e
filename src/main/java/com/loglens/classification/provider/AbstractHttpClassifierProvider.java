package com.loglens.classification.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Shared HTTP transport for classifier providers.
 * 
 * Posts the JSON payload with a per-call timeout and maps failures to
 * {@link ClassifierException}s whose messages the retry policy understands:
 * timeouts mention "timeout", HTTP errors carry "HTTP &lt;status&gt;", and
 * blank replies raise "empty response".
 */
public abstract class AbstractHttpClassifierProvider implements ClassifierProvider {
    
    private static final Logger log = LoggerFactory.getLogger(AbstractHttpClassifierProvider.class);
    
    protected static final double TEMPERATURE = 0.7;
    protected static final int MAX_TOKENS = 150;
    
    protected final ObjectMapper objectMapper;
    private final WebClient webClient;
    private final String endpoint;
    private final String model;
    private final Duration timeout;
    
    protected AbstractHttpClassifierProvider(WebClient webClient, ObjectMapper objectMapper,
                                             String endpoint, String model, Duration timeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
        this.model = model;
        this.timeout = timeout;
    }
    
    @Override
    public String getModel() {
        return model;
    }
    
    public String getEndpoint() {
        return endpoint;
    }
    
    @Override
    public ClassifierReply complete(String prompt) {
        ObjectNode payload = buildPayload(prompt);
        JsonNode body;
        try {
            body = webClient.post()
                .uri(endpoint)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .block();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            log.debug("{} returned HTTP {}: {}", getName(), status, e.getResponseBodyAsString());
            throw new ClassifierException("HTTP " + status + " " + describe(status), getName(), status, e);
        } catch (WebClientRequestException e) {
            throw new ClassifierException("connection failed: " + e.getMessage(), getName(), null, e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new ClassifierException("timeout after " + timeout.toMillis() + "ms", getName(), null, e);
            }
            throw e;
        }
        
        if (body == null || body.isNull() || body.isMissingNode()) {
            throw new ClassifierException("empty response body", getName());
        }
        String text = extractText(body);
        if (text == null || text.isBlank()) {
            throw new ClassifierException("empty response from model", getName());
        }
        return new ClassifierReply(text.trim(), extractTokenUsage(body));
    }
    
    /**
     * Raises a {@link ClassifierException} if the body carries an {@code error}
     * member, as OpenAI-style and Ollama endpoints do.
     */
    protected void checkError(JsonNode response) {
        JsonNode error = response.get("error");
        if (error == null || error.isNull()) {
            return;
        }
        String message = error.isTextual() ? error.asText() : error.path("message").asText("Unknown error");
        Integer status = null;
        JsonNode code = error.has("status_code") ? error.get("status_code") : error.get("code");
        if (code != null && code.canConvertToInt()) {
            status = code.asInt();
        }
        throw new ClassifierException(message, getName(), status);
    }
    
    protected ClassifierException missing(String member) {
        return new ClassifierException("invalid response format: missing " + member, getName());
    }
    
    private static String describe(int status) {
        if (status == 429) {
            return "too many requests";
        }
        if (status >= 500) {
            return "server error";
        }
        return "client error";
    }
}
