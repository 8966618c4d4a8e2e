package com.loglens.classification;

import com.loglens.domain.LogRecord;

/**
 * Decides whether a neighbouring record is useful context for a candidate.
 */
@FunctionalInterface
public interface ContextEntryFilter {
    
    ContextEntryFilter ACCEPT_ALL = (candidate, entry) -> true;
    
    boolean accept(LogRecord candidate, LogRecord entry);
}
