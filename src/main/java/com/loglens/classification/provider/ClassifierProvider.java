package com.loglens.classification.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * An external text classifier reachable over HTTP.
 * 
 * Providers differ only in request payload and response layout; transport,
 * timeouts and error mapping live in {@link AbstractHttpClassifierProvider}.
 */
public interface ClassifierProvider {
    
    /**
     * @return provider name as used in configuration, e.g. "ollama"
     */
    String getName();
    
    String getModel();
    
    /**
     * Builds the JSON request body for a prompt.
     */
    ObjectNode buildPayload(String prompt);
    
    /**
     * Extracts the reply text from a response body.
     *
     * @throws ClassifierException if the body reports an error or lacks the reply
     */
    String extractText(JsonNode response);
    
    /**
     * Tokens reported by the endpoint, 0 when it does not report usage.
     */
    default long extractTokenUsage(JsonNode response) {
        return 0L;
    }
    
    /**
     * Sends the prompt and waits for the reply.
     *
     * @throws ClassifierException on transport errors, timeouts, HTTP errors or malformed replies
     */
    ClassifierReply complete(String prompt);
}
