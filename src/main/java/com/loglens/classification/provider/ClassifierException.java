package com.loglens.classification.provider;

/**
 * Failure talking to a classifier endpoint.
 * The message carries enough text (status code, "timeout", "empty response")
 * for the retry policy to decide whether the call is worth repeating.
 */
public class ClassifierException extends RuntimeException {
    
    private final String provider;
    private final Integer statusCode;
    
    public ClassifierException(String message, String provider) {
        this(message, provider, null, null);
    }
    
    public ClassifierException(String message, String provider, Integer statusCode) {
        this(message, provider, statusCode, null);
    }
    
    public ClassifierException(String message, String provider, Integer statusCode, Throwable cause) {
        super(provider + " error: " + message + (statusCode != null ? " (status=" + statusCode + ")" : ""), cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }
    
    public String getProvider() {
        return provider;
    }
    
    public Integer getStatusCode() {
        return statusCode;
    }
}
