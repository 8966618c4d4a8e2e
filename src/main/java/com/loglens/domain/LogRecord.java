package com.loglens.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single log line as loaded from an input batch.
 * 
 * Records are immutable. The template is assigned once by the template miner
 * through {@link #withTemplate(String)}, which returns a copy. Structured input
 * keeps its remaining scalar fields in {@code attributes} so behavioral rules
 * can group by and count them.
 */
public final class LogRecord {
    
    private final String timestamp;
    private final String message;
    private final String source;
    private final String template;
    private final Map<String, String> attributes;
    
    public LogRecord(String timestamp, String message, String source) {
        this(timestamp, message, source, null, null);
    }
    
    @JsonCreator
    public LogRecord(@JsonProperty("timestamp") String timestamp,
                     @JsonProperty("message") String message,
                     @JsonProperty("source") String source,
                     @JsonProperty("template") String template,
                     @JsonProperty("attributes") Map<String, String> attributes) {
        this.timestamp = timestamp;
        this.message = message != null ? message : "";
        this.source = source != null ? source : "unknown";
        this.template = template;
        this.attributes = attributes != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
            : Collections.emptyMap();
    }
    
    /**
     * Returns a copy of this record carrying the mined template.
     *
     * @throws IllegalStateException if a template was already assigned
     */
    public LogRecord withTemplate(String minedTemplate) {
        if (template != null) {
            throw new IllegalStateException("Template already assigned for record: " + message);
        }
        return new LogRecord(timestamp, message, source, minedTemplate, attributes);
    }
    
    /**
     * Resolves a named field for rule evaluation. Well-known names map to the
     * record's own fields, anything else is looked up in the attributes.
     */
    public String field(String name) {
        if (name == null) {
            return null;
        }
        switch (name) {
            case "message":
            case "log":
                return message;
            case "source":
                return source;
            case "template":
                return template;
            case "timestamp":
                return timestamp;
            default:
                return attributes.get(name);
        }
    }
    
    public String getTimestamp() {
        return timestamp;
    }
    
    public String getMessage() {
        return message;
    }
    
    public String getSource() {
        return source;
    }
    
    public String getTemplate() {
        return template;
    }
    
    /**
     * @return the template when mined, otherwise the raw message
     */
    public String templateOrMessage() {
        return template != null ? template : message;
    }
    
    public Map<String, String> getAttributes() {
        return attributes;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogRecord)) return false;
        LogRecord that = (LogRecord) o;
        return Objects.equals(timestamp, that.timestamp)
            && message.equals(that.message)
            && source.equals(that.source)
            && Objects.equals(template, that.template)
            && attributes.equals(that.attributes);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(timestamp, message, source, template, attributes);
    }
    
    @Override
    public String toString() {
        return "LogRecord{" +
                "timestamp='" + timestamp + '\'' +
                ", source='" + source + '\'' +
                ", message='" + message + '\'' +
                '}';
    }
}
