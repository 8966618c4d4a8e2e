package com.loglens.classification.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassifierProviderTest {
    
    private final ObjectMapper objectMapper = new ObjectMapper();
    
    @Test
    void testOllama_returnsReplyAndTokenUsage() {
        // Given
        WebClient client = respondingWith(HttpStatus.OK,
            "{\"response\": \" CLASSIFICATION: Critical Failure \", \"prompt_eval_count\": 40, \"eval_count\": 12}");
        OllamaClassifierProvider provider = new OllamaClassifierProvider(client, objectMapper,
            "http://localhost:11434/api/generate", "mistral:instruct", Duration.ofSeconds(5));
        
        // When
        ClassifierReply reply = provider.complete("classify this");
        
        // Then
        assertThat(reply.getText()).isEqualTo("CLASSIFICATION: Critical Failure");
        assertThat(reply.getTokensUsed()).isEqualTo(52);
    }
    
    @Test
    void testOllama_buildsNonStreamingPayload() {
        OllamaClassifierProvider provider = new OllamaClassifierProvider(WebClient.create(), objectMapper,
            "http://localhost", "mistral:instruct", Duration.ofSeconds(5));
        
        ObjectNode payload = provider.buildPayload("hello");
        
        assertThat(payload.get("model").asText()).isEqualTo("mistral:instruct");
        assertThat(payload.get("prompt").asText()).isEqualTo("hello");
        assertThat(payload.get("stream").asBoolean()).isFalse();
        assertThat(payload.path("options").path("num_predict").asInt()).isEqualTo(150);
    }
    
    @Test
    void testChatCompletion_readsFirstChoice() {
        // Given
        WebClient client = respondingWith(HttpStatus.OK,
            "{\"choices\": [{\"message\": {\"content\": \"Normal Operation | fine | [Info]\"}}],"
                + " \"usage\": {\"total_tokens\": 77}}");
        ChatCompletionClassifierProvider provider = new ChatCompletionClassifierProvider("openai", client,
            objectMapper, "http://localhost/v1/chat/completions", "gpt-4o-mini", Duration.ofSeconds(5));
        
        // When
        ClassifierReply reply = provider.complete("classify this");
        
        // Then
        assertThat(reply.getText()).isEqualTo("Normal Operation | fine | [Info]");
        assertThat(reply.getTokensUsed()).isEqualTo(77);
        assertThat(provider.buildPayload("p").get("messages").get(0).get("role").asText()).isEqualTo("user");
    }
    
    @Test
    void testAnthropic_framesPromptAndReadsCompletion() {
        WebClient client = respondingWith(HttpStatus.OK, "{\"completion\": \"Security Threat | leak | [Security]\"}");
        AnthropicClassifierProvider provider = new AnthropicClassifierProvider(client, objectMapper,
            "http://localhost/v1/complete", "claude", Duration.ofSeconds(5));
        
        assertThat(provider.buildPayload("x").get("prompt").asText()).isEqualTo("\n\nHuman: x\n\nAssistant:");
        assertThat(provider.complete("x").getText()).isEqualTo("Security Threat | leak | [Security]");
        assertThat(provider.complete("x").getTokensUsed()).isZero();
    }
    
    @Test
    void shouldMapServerErrorsToRetryableMessage() {
        // Given
        WebClient client = respondingWith(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\": \"busy\"}");
        OllamaClassifierProvider provider = new OllamaClassifierProvider(client, objectMapper,
            "http://localhost", "m", Duration.ofSeconds(5));
        
        // When/Then
        assertThatThrownBy(() -> provider.complete("x"))
            .isInstanceOfSatisfying(ClassifierException.class, e -> {
                assertThat(e.getStatusCode()).isEqualTo(503);
                assertThat(e.getMessage()).contains("HTTP 503 server error");
            });
    }
    
    @Test
    void shouldReportErrorMemberInBody() {
        WebClient client = respondingWith(HttpStatus.OK, "{\"error\": {\"message\": \"rate limit reached\", \"code\": 429}}");
        ChatCompletionClassifierProvider provider = new ChatCompletionClassifierProvider("openai", client,
            objectMapper, "http://localhost", "m", Duration.ofSeconds(5));
        
        assertThatThrownBy(() -> provider.complete("x"))
            .isInstanceOf(ClassifierException.class)
            .hasMessageContaining("rate limit reached")
            .hasMessageContaining("status=429");
    }
    
    @Test
    void shouldRejectBlankReply() {
        WebClient client = respondingWith(HttpStatus.OK, "{\"response\": \"   \"}");
        TinyLlamaClassifierProvider provider = new TinyLlamaClassifierProvider(client, objectMapper,
            "http://localhost", "tinyllama", Duration.ofSeconds(5));
        
        assertThatThrownBy(() -> provider.complete("x"))
            .isInstanceOf(ClassifierException.class)
            .hasMessageContaining("empty response");
    }
    
    @Test
    void shouldTimeOutSlowEndpoint() {
        // Given: an endpoint that never answers
        WebClient client = WebClient.builder().exchangeFunction(request -> Mono.never()).build();
        OllamaClassifierProvider provider = new OllamaClassifierProvider(client, objectMapper,
            "http://localhost", "m", Duration.ofMillis(50));
        
        // When/Then
        assertThatThrownBy(() -> provider.complete("x"))
            .isInstanceOf(ClassifierException.class)
            .hasMessageContaining("timeout after 50ms");
    }
    
    @Test
    void testFactory_resolvesNamesAndFallsBack() {
        ClassifierProviderFactory factory = new ClassifierProviderFactory(WebClient.create(), objectMapper);
        
        assertThat(factory.create("OpenAI", "http://x", "gpt", Duration.ofSeconds(1)).getName()).isEqualTo("openai");
        assertThat(factory.create("mistral:instruct", "http://x", "m", Duration.ofSeconds(1)).getName())
            .isEqualTo("mistral");
        assertThat(factory.create("something-else", "http://x", "m", Duration.ofSeconds(1)).getName())
            .isEqualTo("ollama");
        assertThat(ClassifierProviderFactory.resolveName(null)).isEqualTo("ollama");
    }
    
    private static WebClient respondingWith(HttpStatus status, String json) {
        return WebClient.builder()
            .exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build()))
            .build();
    }
}
