package com.loglens.classification;

import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.LogRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the records surrounding a candidate, up to {@code radius} positions
 * on each side, excluding the candidate itself and anything the entry filter rejects.
 */
public class ContextWindowBuilder {
    
    private final int radius;
    private final ContextEntryFilter filter;
    
    public ContextWindowBuilder(int radius, ContextEntryFilter filter) {
        if (radius < 0) {
            throw new IllegalArgumentException("Context radius must be >= 0: " + radius);
        }
        this.radius = radius;
        this.filter = filter != null ? filter : ContextEntryFilter.ACCEPT_ALL;
    }
    
    public List<LogRecord> build(List<AnnotatedRecord> sequence, int position) {
        LogRecord candidate = sequence.get(position).getRecord();
        int from = Math.max(0, position - radius);
        int to = Math.min(sequence.size() - 1, position + radius);
        List<LogRecord> context = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            if (i == position) {
                continue;
            }
            LogRecord entry = sequence.get(i).getRecord();
            if (filter.accept(candidate, entry)) {
                context.add(entry);
            }
        }
        return context;
    }
    
    public int getRadius() {
        return radius;
    }
}
