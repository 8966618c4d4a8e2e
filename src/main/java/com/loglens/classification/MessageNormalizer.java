package com.loglens.classification;

import java.util.regex.Pattern;

/**
 * Canonical form of a log message used for allow-list comparison.
 * Bracketed prefixes, ISO timestamps, identifiers, addresses and credentials
 * are replaced so that lines differing only in those values compare equal.
 */
public final class MessageNormalizer {
    
    private static final Pattern BRACKETED = Pattern.compile("\\[.*?]");
    private static final Pattern ISO_TIMESTAMP = Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?Z");
    private static final Pattern LONG_ID = Pattern.compile("[a-f0-9\\-]{32,}");
    private static final Pattern IP = Pattern.compile("\\b\\d{1,3}(\\.\\d{1,3}){3}\\b");
    private static final Pattern SECRET = Pattern.compile("(Bearer|Token|APIKey|Secret)\\s+\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    
    private MessageNormalizer() {
    }
    
    public static String normalize(String message) {
        if (message == null) {
            return "";
        }
        String text = BRACKETED.matcher(message).replaceAll("");
        text = ISO_TIMESTAMP.matcher(text).replaceAll("");
        text = LONG_ID.matcher(text).replaceAll("<ID>");
        text = IP.matcher(text).replaceAll("<IP>");
        text = SECRET.matcher(text).replaceAll("<SECRET>");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
