package com.loglens.classification.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {
    
    @Test
    void shouldGrowDelayExponentiallyUpToCap() {
        RetryPolicy policy = RetryPolicy.defaults();
        
        assertThat(policy.baseDelayMillis(1)).isEqualTo(1000);
        assertThat(policy.baseDelayMillis(2)).isEqualTo(2000);
        assertThat(policy.baseDelayMillis(3)).isEqualTo(4000);
        assertThat(policy.baseDelayMillis(5)).isEqualTo(10000);
    }
    
    @Test
    void shouldApplySymmetricJitter() {
        RetryPolicy policy = RetryPolicy.defaults();
        
        assertThat(policy.delayMillis(1, 0.5)).isEqualTo(1000);
        assertThat(policy.delayMillis(1, 0.0)).isEqualTo(900);
        assertThat(policy.delayMillis(1, 1.0)).isEqualTo(1100);
    }
    
    @Test
    void shouldFallBackToDefaultKeywords() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 2.0, 0.1, null);
        
        assertThat(policy.getRetryableErrors()).isEqualTo(RetryPolicy.DEFAULT_RETRYABLE_ERRORS);
        assertThat(policy.getRetryableErrors()).contains("connection", "timeout", "HTTP 503");
    }
    
    @Test
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 2.0, 0.1, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 2.0, 1.5, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
