package com.loglens.domain;

/**
 * Overall risk rating of a batch.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;
    
    /**
     * HIGH if incidents > 5 or critical anomalies > 10, MEDIUM if incidents > 2
     * or critical anomalies > 5, LOW otherwise.
     */
    public static RiskLevel assess(long securityIncidents, long criticalAnomalies) {
        if (securityIncidents > 5 || criticalAnomalies > 10) {
            return HIGH;
        }
        if (securityIncidents > 2 || criticalAnomalies > 5) {
            return MEDIUM;
        }
        return LOW;
    }
}
