package com.loglens.rules;

/**
 * Raised when a configured pattern or rule cannot be used, for example an
 * invalid regular expression or an unknown behavioral rule type.
 * Callers skip the offending item and continue.
 */
public class ConfigurationDefectException extends RuntimeException {
    
    private final String itemName;
    
    public ConfigurationDefectException(String message, String itemName) {
        super(message);
        this.itemName = itemName;
    }
    
    public ConfigurationDefectException(String message, String itemName, Throwable cause) {
        super(message, cause);
        this.itemName = itemName;
    }
    
    public String getItemName() {
        return itemName;
    }
}
