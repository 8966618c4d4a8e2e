package com.loglens.report;

import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.AnomalySource;
import com.loglens.domain.LogRecord;

import java.util.List;

/**
 * One entry of the final anomaly list: a record and the detector set it came from.
 * The same record may appear once per detector set that flagged it.
 */
public class AggregatedAnomaly {
    
    private final AnnotatedRecord record;
    private final AnomalySource source;
    private final boolean anomaly;
    private final List<LogRecord> context;
    
    public AggregatedAnomaly(AnnotatedRecord record, AnomalySource source, boolean anomaly, List<LogRecord> context) {
        this.record = record;
        this.source = source;
        this.anomaly = anomaly;
        this.context = context != null ? List.copyOf(context) : List.of();
    }
    
    public AnnotatedRecord getRecord() {
        return record;
    }
    
    public AnomalySource getSource() {
        return source;
    }
    
    /**
     * False for entries kept for the record but not counted as critical, e.g. non-error floods.
     */
    public boolean isAnomaly() {
        return anomaly;
    }
    
    public List<LogRecord> getContext() {
        return context;
    }
}
