package com.loglens.detection.behavioral;

import java.util.Locale;
import java.util.Optional;

public enum BehavioralRuleType {
    /** Number of records in the window. */
    COUNT,
    /** Number of distinct values of a field in the window. */
    DISTINCT_COUNT,
    /** Share of pattern-matching records among all records in the window. */
    RATIO;
    
    public static Optional<BehavioralRuleType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "count":
                return Optional.of(COUNT);
            case "distinct_count":
                return Optional.of(DISTINCT_COUNT);
            case "ratio":
                return Optional.of(RATIO);
            default:
                return Optional.empty();
        }
    }
}
