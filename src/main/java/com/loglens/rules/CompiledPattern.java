package com.loglens.rules;

import java.util.regex.Pattern;

/**
 * A {@link RulePattern} with its regular expression compiled.
 */
public class CompiledPattern {
    
    private final String name;
    private final Pattern regex;
    private final String reason;
    
    public CompiledPattern(String name, Pattern regex, String reason) {
        this.name = name;
        this.regex = regex;
        this.reason = reason;
    }
    
    public boolean matches(String text) {
        return text != null && regex.matcher(text).find();
    }
    
    public String getName() {
        return name;
    }
    
    public Pattern getRegex() {
        return regex;
    }
    
    public String getReason() {
        return reason;
    }
}
