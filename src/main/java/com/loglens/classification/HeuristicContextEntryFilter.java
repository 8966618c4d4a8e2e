package com.loglens.classification;

import com.loglens.domain.LogRecord;

/**
 * Drops context lines that carry no information for the classifier:
 * fragments, quoted or parenthesised continuation lines, path dumps,
 * elided lines, entries with malformed timestamps and entries from another day.
 */
public class HeuristicContextEntryFilter implements ContextEntryFilter {
    
    @Override
    public boolean accept(LogRecord candidate, LogRecord entry) {
        String text = entry.getMessage().trim();
        if (text.length() < 5 || text.split("\\s+").length < 2) {
            return false;
        }
        if (text.startsWith("'") && text.endsWith("'") && text.length() < 50) {
            return false;
        }
        if (count(text, '/') > 3 && text.length() < 100) {
            return false;
        }
        if (text.contains("...")) {
            return false;
        }
        if (text.startsWith("(") && text.endsWith(")") && text.length() < 100) {
            return false;
        }
        return acceptTimestamp(candidate.getTimestamp(), entry.getTimestamp());
    }
    
    private static boolean acceptTimestamp(String candidateTimestamp, String entryTimestamp) {
        if (entryTimestamp == null || entryTimestamp.isEmpty()) {
            return true;
        }
        if (entryTimestamp.length() < 3
            || entryTimestamp.startsWith("(")
            || entryTimestamp.startsWith("'")
            || entryTimestamp.startsWith("+")
            || entryTimestamp.chars().noneMatch(Character::isDigit)) {
            return false;
        }
        if (candidateTimestamp != null && candidateTimestamp.length() >= 10 && entryTimestamp.length() >= 10) {
            return candidateTimestamp.substring(0, 10).equals(entryTimestamp.substring(0, 10));
        }
        return true;
    }
    
    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }
}
