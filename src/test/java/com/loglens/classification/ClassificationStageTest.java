package com.loglens.classification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loglens.classification.provider.ClassifierException;
import com.loglens.classification.provider.ClassifierProvider;
import com.loglens.classification.provider.ClassifierReply;
import com.loglens.classification.retry.RetryExecutor;
import com.loglens.classification.retry.RetryPolicy;
import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.AnomalySource;
import com.loglens.domain.ClassificationResult;
import com.loglens.domain.DetectionAnnotation;
import com.loglens.domain.LogRecord;
import com.loglens.rules.SecurityClassifier;
import com.loglens.rules.SecurityPatternMatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClassificationStageTest {
    
    private ClassifierProvider provider;
    private SimpleMeterRegistry registry;
    private ClassificationStage stage;
    
    @BeforeEach
    void setUp() {
        provider = mock(ClassifierProvider.class);
        when(provider.getName()).thenReturn("ollama");
        when(provider.getModel()).thenReturn("mistral:instruct");
        registry = new SimpleMeterRegistry();
        stage = stage(0, new ClassificationSettings().setConcurrency(2));
    }
    
    @AfterEach
    void tearDown() {
        stage.close();
    }
    
    @Test
    void shouldApplyResultsInCandidateOrderAndDemoteBenignLabels() {
        // Given
        List<AnnotatedRecord> sequence = List.of(
            candidate(0, "disk controller alpha reported fault", 0.9),
            candidate(1, "cache beta warmed in 3ms", 0.8));
        when(provider.complete(anyString())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            if (prompt.contains("alpha")) {
                return new ClassifierReply("CLASSIFICATION: Critical Failure\nREASON: Disk fault\nTAGS: [Disk]", 30);
            }
            return new ClassifierReply("CLASSIFICATION: Normal Operation\nREASON: Routine\nTAGS: [Cache]", 20);
        });
        
        // When
        ClassificationOutcome outcome = stage.process(sequence, "app.log");
        
        // Then
        assertThat(outcome.getCandidatesClassified()).isEqualTo(2);
        assertThat(outcome.getProvider()).isEqualTo("ollama");
        assertThat(outcome.getStatistics().getTotalCalls()).isEqualTo(2);
        assertThat(outcome.getStatistics().getTokensUsed()).isEqualTo(50);
        
        DetectionAnnotation failure = sequence.get(0).getAnnotation();
        assertThat(failure.getClassification()).isEqualTo("Critical Failure");
        assertThat(failure.getTags()).contains("Disk");
        assertThat(failure.hasSource(AnomalySource.LLM)).isTrue();
        assertThat(failure.isAnomaly()).isTrue();
        
        DetectionAnnotation routine = sequence.get(1).getAnnotation();
        assertThat(routine.getClassification()).isEqualTo("Normal Operation");
        assertThat(routine.isAnomaly()).isFalse();
        assertThat(registry.get("loglens.classifier.calls").counter().count()).isEqualTo(2.0);
    }
    
    @Test
    void shouldShortCircuitSecretsWithoutCallingClassifier() {
        // Given
        List<AnnotatedRecord> sequence = List.of(
            candidate(0, "session started with token eyJhbGciOiJIUzI1NiJ9.eyJzdWIiOiIxIn0.sig", 0.9));
        
        // When
        stage.process(sequence, "app.log");
        
        // Then
        verify(provider, never()).complete(anyString());
        DetectionAnnotation annotation = sequence.get(0).getAnnotation();
        assertThat(annotation.getClassification()).isEqualTo(ClassificationStage.SENSITIVE_LEAK);
        assertThat(annotation.getTags()).contains("Sensitive", "Security Threat");
        assertThat(annotation.isSecurityRelated()).isTrue();
        assertThat(annotation.isAnomaly()).isTrue();
        assertThat(registry.get("loglens.classifier.short_circuits").counter().count()).isEqualTo(1.0);
    }
    
    @Test
    void shouldLabelTerminalFailuresAsErrorAndContinue() {
        // Given: the endpoint keeps answering 503 for one record
        List<AnnotatedRecord> sequence = List.of(
            candidate(0, "worker gamma stalled", 0.9),
            candidate(1, "worker delta stalled", 0.8));
        when(provider.complete(anyString())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            if (prompt.contains("gamma")) {
                throw new ClassifierException("HTTP 503 server error", "ollama", 503);
            }
            return new ClassifierReply("Performance Issue | Worker stalled | [Performance]", 0);
        });
        
        // When
        ClassificationOutcome outcome = stage.process(sequence, "app.log");
        
        // Then: three attempts for the failing record, one for the other
        verify(provider, times(4)).complete(anyString());
        DetectionAnnotation failed = sequence.get(0).getAnnotation();
        assertThat(failed.getClassification()).isEqualTo(ClassificationStage.ERROR_CLASSIFICATION);
        assertThat(failed.getReason()).startsWith("Classifier error:").contains("503");
        assertThat(failed.isAnomaly()).isTrue();
        assertThat(sequence.get(1).getAnnotation().getClassification()).isEqualTo("Performance Issue");
        assertThat(outcome.getStatistics().getErrors()).isEqualTo(1);
    }
    
    @Test
    void shouldRelabelUnplacedStackTraceLines() {
        // Given
        List<AnnotatedRecord> sequence = List.of(candidate(0, "    at com.shop.Checkout.pay(Checkout.java:42)", 0.9));
        when(provider.complete(anyString())).thenReturn(new ClassifierReply("no idea", 0));
        
        // When
        stage.process(sequence, "app.log");
        
        // Then
        DetectionAnnotation annotation = sequence.get(0).getAnnotation();
        assertThat(annotation.getClassification()).isEqualTo(DependentAnomalyFilter.DEPENDENT_ANOMALY);
        assertThat(annotation.isAnomaly()).isFalse();
    }
    
    @Test
    void shouldDropContextWhenPromptWouldBeTooLarge() {
        // Given: a one-token budget and neighbours in the context window
        stage.close();
        stage = stage(1, new ClassificationSettings().setConcurrency(1).setMaxTotalTokens(1));
        List<AnnotatedRecord> sequence = new ArrayList<>();
        sequence.add(new AnnotatedRecord(0, new LogRecord(null, "neighbour before the outlier", "app")));
        sequence.add(candidate(1, "strange outlier line", 0.9));
        when(provider.complete(anyString())).thenReturn(new ClassifierReply("Error | bad | [Error]", 0));
        
        // When
        ClassificationOutcome outcome = stage.process(sequence, "app.log");
        
        // Then
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(provider).complete(prompt.capture());
        assertThat(prompt.getValue()).contains("strange outlier line").doesNotContain("neighbour before");
        assertThat(outcome.getStatistics().getContextsTrimmed()).isEqualTo(1);
    }
    
    @Test
    void shouldLabelCandidateErrorWhenParsingFailsAndClassifyTheRest() {
        // Given: a parser that fails on the reply for one record only
        stage.close();
        ResponseParser failingParser = new ResponseParser(new ObjectMapper(), 200) {
            @Override
            public ClassificationResult parse(String reply) {
                if (reply.contains("garbled")) {
                    throw new IllegalStateException("unexpected reply layout");
                }
                return super.parse(reply);
            }
        };
        stage = stage(0, new ClassificationSettings().setConcurrency(1), failingParser);
        List<AnnotatedRecord> sequence = List.of(
            candidate(0, "worker epsilon stalled", 0.9),
            candidate(1, "worker zeta stalled", 0.8));
        when(provider.complete(anyString())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            if (prompt.contains("epsilon")) {
                return new ClassifierReply("garbled", 0);
            }
            return new ClassifierReply("Performance Issue | Worker stalled | [Performance]", 0);
        });
        
        // When
        ClassificationOutcome outcome = stage.process(sequence, "app.log");
        
        // Then
        DetectionAnnotation first = sequence.get(0).getAnnotation();
        assertThat(first.getClassification()).isEqualTo(ClassificationStage.ERROR_CLASSIFICATION);
        assertThat(first.getReason()).isEqualTo("Classifier error: unexpected reply layout");
        assertThat(first.getTags()).contains(ResponseParser.UNKNOWN);
        assertThat(sequence.get(1).getAnnotation().getClassification()).isEqualTo("Performance Issue");
        assertThat(outcome.getStatistics().getErrors()).isEqualTo(1);
        assertThat(outcome.getStatistics().getTotalCalls()).isEqualTo(2);
        assertThat(registry.get("loglens.classifier.errors").counter().count()).isEqualTo(1.0);
    }
    
    @Test
    void shouldNeverExceedConfiguredConcurrency() {
        // Given: six candidates, two slots, calls that hold their slot until both slots are busy
        CountDownLatch bothSlotsBusy = new CountDownLatch(2);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<AnnotatedRecord> sequence = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            sequence.add(candidate(i, "worker " + i + " stalled", 0.9 - i * 0.1));
        }
        when(provider.complete(anyString())).thenAnswer(invocation -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                bothSlotsBusy.countDown();
                bothSlotsBusy.await(5, TimeUnit.SECONDS);
                Thread.sleep(20);
            } finally {
                inFlight.decrementAndGet();
            }
            return new ClassifierReply("Performance Issue | Worker stalled | [Performance]", 0);
        });
        
        // When
        ClassificationOutcome outcome = stage.process(sequence, "app.log");
        
        // Then
        verify(provider, times(6)).complete(anyString());
        assertThat(outcome.getStatistics().getTotalCalls()).isEqualTo(6);
        assertThat(peak.get()).isEqualTo(2);
    }
    
    @Test
    void shouldExcludeSlotWaitFromCallLatency() {
        // Given: one slot, two calls of about 200ms each
        stage.close();
        stage = stage(0, new ClassificationSettings().setConcurrency(1));
        List<AnnotatedRecord> sequence = List.of(
            candidate(0, "worker eta stalled", 0.9),
            candidate(1, "worker theta stalled", 0.8));
        when(provider.complete(anyString())).thenAnswer(invocation -> {
            Thread.sleep(200);
            return new ClassifierReply("Performance Issue | Worker stalled | [Performance]", 0);
        });
        
        // When
        ClassificationOutcome outcome = stage.process(sequence, "app.log");
        
        // Then: the second call's wait for the slot is not part of its latency
        assertThat(outcome.getStatistics().getTotalElapsedMillis()).isBetween(400L, 550L);
    }
    
    @Test
    void testProcess_withoutCandidates_makesNoCalls() {
        List<AnnotatedRecord> sequence = List.of(new AnnotatedRecord(0, new LogRecord(null, "quiet", "app")));
        
        ClassificationOutcome outcome = stage.process(sequence, "app.log");
        
        assertThat(outcome.getCandidatesClassified()).isZero();
        verify(provider, never()).complete(anyString());
    }
    
    private ClassificationStage stage(int contextRadius, ClassificationSettings settings) {
        return stage(contextRadius, settings, new ResponseParser(new ObjectMapper(), 200));
    }
    
    private ClassificationStage stage(int contextRadius, ClassificationSettings settings, ResponseParser parser) {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(1), 1.0, 0.0, null);
        CandidateSelector selector = new CandidateSelector(10, AllowListStore.NONE,
            new ContextWindowBuilder(contextRadius, ContextEntryFilter.ACCEPT_ALL));
        SecurityPatternMatcher securityPatterns = new SecurityPatternMatcher();
        return new ClassificationStage(provider, new RetryExecutor(policy), selector,
            parser, securityPatterns,
            new SecurityClassifier(securityPatterns), new ClassificationMetrics(registry), settings);
    }
    
    private static AnnotatedRecord candidate(int index, String message, double knnScore) {
        AnnotatedRecord record = new AnnotatedRecord(index, new LogRecord(null, message, "app"));
        record.getAnnotation().setKnnScore(knnScore);
        record.getAnnotation().setKnnAnomaly(true);
        record.getAnnotation().markAnomaly(AnomalySource.STATISTICAL);
        return record;
    }
}
