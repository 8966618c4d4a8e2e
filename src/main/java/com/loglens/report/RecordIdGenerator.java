package com.loglens.report;

import com.google.common.hash.Hashing;
import com.loglens.util.TimestampParser;

import java.nio.charset.StandardCharsets;

/**
 * Stable anomaly identifiers: the first 16 hex characters of the SHA-256 of
 * the normalized timestamp followed by the message.
 */
public final class RecordIdGenerator {
    
    private static final int ID_LENGTH = 16;
    
    private RecordIdGenerator() {
    }
    
    public static String recordId(String timestamp, String message) {
        String key = TimestampParser.normalize(timestamp) + (message != null ? message : "");
        return Hashing.sha256()
            .hashString(key, StandardCharsets.UTF_8)
            .toString()
            .substring(0, ID_LENGTH);
    }
}
