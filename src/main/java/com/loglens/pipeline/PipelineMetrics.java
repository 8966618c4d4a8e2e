package com.loglens.pipeline;

import com.loglens.domain.AnomalySource;
import com.loglens.report.AggregatedAnomaly;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Batch level metrics: records processed, anomalies per detector and batch latency.
 */
public class PipelineMetrics {
    
    private final Counter batchesProcessed;
    private final Counter batchesFailed;
    private final Counter recordsProcessed;
    private final Counter floodRecordsCollapsed;
    private final Map<AnomalySource, Counter> anomalies = new EnumMap<>(AnomalySource.class);
    private final Timer batchLatency;
    
    public PipelineMetrics(MeterRegistry registry) {
        this.batchesProcessed = Counter.builder("loglens.batches.processed")
            .description("Number of batches analysed")
            .tag("component", "pipeline")
            .register(registry);
        
        this.batchesFailed = Counter.builder("loglens.batches.failed")
            .description("Number of batches that could not be analysed")
            .tag("component", "pipeline")
            .register(registry);
        
        this.recordsProcessed = Counter.builder("loglens.records.processed")
            .description("Number of log records analysed")
            .tag("component", "pipeline")
            .register(registry);
        
        this.floodRecordsCollapsed = Counter.builder("loglens.flood.records.collapsed")
            .description("Records replaced by flood summaries")
            .tag("component", "pipeline")
            .register(registry);
        
        for (AnomalySource source : AnomalySource.values()) {
            anomalies.put(source, Counter.builder("loglens.anomalies")
                .description("Anomalies reported per detector")
                .tag("component", "pipeline")
                .tag("source", source.getLabel())
                .register(registry));
        }
        
        this.batchLatency = Timer.builder("loglens.batch.latency")
            .description("End-to-end batch analysis latency")
            .tag("component", "pipeline")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }
    
    public void recordBatch(int records, int collapsed, List<AggregatedAnomaly> reported, long durationMs) {
        batchesProcessed.increment();
        recordsProcessed.increment(records);
        floodRecordsCollapsed.increment(collapsed);
        for (AggregatedAnomaly anomaly : reported) {
            anomalies.get(anomaly.getSource()).increment();
        }
        batchLatency.record(durationMs, TimeUnit.MILLISECONDS);
    }
    
    public void recordBatchFailure() {
        batchesFailed.increment();
    }
    
    public double getRecordsProcessed() {
        return recordsProcessed.count();
    }
}
