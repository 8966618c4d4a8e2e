package com.loglens.classification.retry;

import com.loglens.classification.provider.ClassifierException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {
    
    private RetryExecutor executor;
    
    @BeforeEach
    void setUp() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(1), 2.0, 0.0, null);
        executor = new RetryExecutor(policy, () -> 0.5);
    }
    
    @Test
    void shouldRetryTransientErrorsUntilExhausted() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        
        // When
        RetryState state = new RetryState();
        assertThatThrownBy(() -> executor.execute("classify", () -> {
            calls.incrementAndGet();
            throw new ClassifierException("timeout after 10000ms", "ollama");
        }, state))
            .isInstanceOf(RetryExhaustedException.class)
            .hasMessageContaining("after 3 attempt(s)")
            .hasCauseInstanceOf(ClassifierException.class);
        
        // Then
        assertThat(calls.get()).isEqualTo(3);
        assertThat(state.getAttempts()).isEqualTo(3);
        assertThat(state.getHistory()).hasSize(3);
        assertThat(state.getLastError()).hasMessageContaining("timeout");
    }
    
    @Test
    void shouldNotRetryPermanentErrors() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        
        // When/Then
        assertThatThrownBy(() -> executor.execute("classify", () -> {
            calls.incrementAndGet();
            throw new ClassifierException("HTTP 400 client error", "ollama", 400);
        }))
            .isInstanceOfSatisfying(RetryExhaustedException.class, e -> assertThat(e.getAttempts()).isEqualTo(1));
        assertThat(calls.get()).isEqualTo(1);
    }
    
    @Test
    void shouldReturnResultOnceCallRecovers() {
        // Given: a call failing once with a server error
        AtomicInteger calls = new AtomicInteger();
        
        // When
        String result = executor.execute("classify", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new ClassifierException("HTTP 503 server error", "ollama", 503);
            }
            return "ok";
        });
        
        // Then
        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(2);
    }
    
    @Test
    void shouldInspectCauseChainCaseInsensitively() {
        RuntimeException wrapped = new RuntimeException("call failed",
            new IllegalStateException("Connection reset by peer"));
        
        assertThat(executor.isRetryable(wrapped)).isTrue();
        assertThat(executor.isRetryable(new IllegalArgumentException("bad prompt"))).isFalse();
        assertThat(executor.isRetryable(new RuntimeException((String) null))).isFalse();
    }
    
    @Test
    void shouldMatchStatusCodesOnlyWithHttpPrefix() {
        assertThat(executor.isRetryable(new ClassifierException("HTTP 500 server error", "ollama", 500))).isTrue();
        assertThat(executor.isRetryable(new ClassifierException("HTTP 504 gateway timeout", "ollama", 504))).isTrue();
        assertThat(executor.isRetryable(new IllegalStateException("reply took 1500ms to parse"))).isFalse();
        assertThat(executor.isRetryable(new IllegalStateException("record 5030 is malformed"))).isFalse();
    }
    
    @Test
    void shouldUseCustomKeywordsWhenGiven() {
        RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(1), 1.0, 0.0,
            List.of("overloaded"));
        RetryExecutor custom = new RetryExecutor(policy, () -> 0.0);
        
        assertThat(custom.isRetryable(new RuntimeException("model overloaded"))).isTrue();
        assertThat(custom.isRetryable(new RuntimeException("timeout"))).isFalse();
    }
}
