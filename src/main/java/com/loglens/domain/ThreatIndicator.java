package com.loglens.domain;

public enum ThreatIndicator {
    LOG_FLOODING,
    DATA_EXPOSURE,
    RULE_VIOLATIONS,
    HIGH_ERROR_RATE
}
