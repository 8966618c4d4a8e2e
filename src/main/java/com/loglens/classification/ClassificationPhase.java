package com.loglens.classification;

import java.util.Locale;

/**
 * How secondary classification is split across runs.
 */
public enum ClassificationPhase {
    
    /** Select and classify candidates while analysing each batch. */
    FULL,
    
    /** Analyse batches and save the selected candidates without calling the classifier. */
    PREPARE,
    
    /** Skip raw logs; classify candidates saved by an earlier {@link #PREPARE} run. */
    CLASSIFY;
    
    /**
     * @throws IllegalArgumentException for an unknown phase name
     */
    public static ClassificationPhase from(String value) {
        if (value == null || value.isBlank()) {
            return FULL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown classification phase '" + value
                + "', expected one of full, prepare, classify", e);
        }
    }
}
