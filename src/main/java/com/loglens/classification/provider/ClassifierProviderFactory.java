package com.loglens.classification.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates classifier providers by configured name.
 * 
 * The name may be given on its own ("openai") or as the prefix of a model
 * reference ("mistral:instruct"). Unknown names fall back to Ollama.
 */
public class ClassifierProviderFactory {
    
    private static final Logger log = LoggerFactory.getLogger(ClassifierProviderFactory.class);
    
    public static final String DEFAULT_PROVIDER = "ollama";
    
    @FunctionalInterface
    public interface ProviderConstructor {
        ClassifierProvider create(WebClient webClient, ObjectMapper objectMapper,
                                  String endpoint, String model, Duration timeout);
    }
    
    private final Map<String, ProviderConstructor> constructors = new ConcurrentHashMap<>();
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    
    public ClassifierProviderFactory(WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        register("ollama", OllamaClassifierProvider::new);
        register("tinyllama", TinyLlamaClassifierProvider::new);
        register("anthropic", AnthropicClassifierProvider::new);
        register("openai", (client, mapper, endpoint, model, timeout) ->
            new ChatCompletionClassifierProvider("openai", client, mapper, endpoint, model, timeout));
        register("mistral", (client, mapper, endpoint, model, timeout) ->
            new ChatCompletionClassifierProvider("mistral", client, mapper, endpoint, model, timeout));
    }
    
    /**
     * Registers or replaces a provider constructor.
     */
    public void register(String name, ProviderConstructor constructor) {
        constructors.put(name.toLowerCase(Locale.ROOT), constructor);
    }
    
    public Set<String> registeredNames() {
        return constructors.keySet();
    }
    
    public ClassifierProvider create(String providerName, String endpoint, String model, Duration timeout) {
        String key = resolveName(providerName);
        ProviderConstructor constructor = constructors.get(key);
        if (constructor == null) {
            log.warn("Unknown classifier provider '{}', falling back to {}", providerName, DEFAULT_PROVIDER);
            constructor = constructors.get(DEFAULT_PROVIDER);
        }
        ClassifierProvider provider = constructor.create(webClient, objectMapper, endpoint, model, timeout);
        log.info("Classifier provider '{}' (model={}, endpoint={}, timeout={}s)",
            provider.getName(), model, endpoint, timeout.getSeconds());
        return provider;
    }
    
    static String resolveName(String providerName) {
        if (providerName == null || providerName.isBlank()) {
            return DEFAULT_PROVIDER;
        }
        String name = providerName.trim().toLowerCase(Locale.ROOT);
        int colon = name.indexOf(':');
        return colon > 0 ? name.substring(0, colon) : name;
    }
}
