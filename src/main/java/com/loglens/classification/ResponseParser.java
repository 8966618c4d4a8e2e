package com.loglens.classification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loglens.domain.ClassificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a free-text classifier reply into a {@link ClassificationResult}.
 * 
 * Accepts three layouts, tried in order:
 * a JSON object with classification, reason and tags members;
 * labelled lines (CLASSIFICATION: / REASON: / TAGS:);
 * a single pipe separated line "Classification | Reason | [Tag, Tag]".
 * Tags outside {@link #VALID_TAGS} are dropped.
 */
public class ResponseParser {
    
    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);
    
    public static final String UNKNOWN = "Unknown";
    public static final String UNPARSEABLE_REASON = "Could not parse";
    
    public static final List<String> VALID_TAGS = List.of(
        "Error", "Warning", "Info", "Debug", "Database", "Network", "Security", "Performance",
        "Configuration", "System", "Application", "API", "Authentication", "Authorization",
        "Validation", "Memory", "CPU", "Disk", "Cache", "Queue", "Timeout", "Retry", "Recovery",
        "Startup", "Shutdown", "Dependency", "Integration", "Migration", "Deployment", "Unknown"
    );
    
    private static final Map<String, String> CANONICAL_TAGS = new LinkedHashMap<>();
    
    static {
        for (String tag : VALID_TAGS) {
            CANONICAL_TAGS.put(tag.toLowerCase(Locale.ROOT), tag);
        }
    }
    
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{.*}", Pattern.DOTALL);
    private static final Pattern CLASSIFICATION_LINE = Pattern.compile(
        "(?im)^\\s*\\**\\s*classification\\s*\\**\\s*:\\s*\\**\\s*(.+?)\\s*\\**\\s*$");
    private static final Pattern REASON_LINE = Pattern.compile(
        "(?im)^\\s*\\**\\s*reason\\s*\\**\\s*:\\s*\\**\\s*(.+?)\\s*$");
    private static final Pattern TAGS_LINE = Pattern.compile(
        "(?im)^\\s*\\**\\s*tags\\s*\\**\\s*:\\s*\\**\\s*(.+?)\\s*$");
    
    private final ObjectMapper objectMapper;
    private final int maxReasonLength;
    
    public ResponseParser(ObjectMapper objectMapper, int maxReasonLength) {
        this.objectMapper = objectMapper;
        this.maxReasonLength = maxReasonLength;
    }
    
    public ClassificationResult parse(String reply) {
        if (reply == null || reply.isBlank()) {
            return unparseable();
        }
        Optional<ClassificationResult> result = parseJson(reply);
        if (result.isEmpty()) {
            result = parseLabelled(reply);
        }
        if (result.isEmpty()) {
            result = parsePipe(reply);
        }
        if (result.isEmpty()) {
            log.debug("Unparseable classifier reply: {}", reply);
            return unparseable();
        }
        return result.get();
    }
    
    public static ClassificationResult unparseable() {
        return new ClassificationResult(UNKNOWN, UNPARSEABLE_REASON, List.of(UNKNOWN));
    }
    
    private Optional<ClassificationResult> parseJson(String reply) {
        Matcher matcher = JSON_OBJECT.matcher(reply);
        if (!matcher.find()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(matcher.group());
        } catch (JsonProcessingException e) {
            log.trace("Reply is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject() || !node.hasNonNull("classification")) {
            return Optional.empty();
        }
        List<String> rawTags = new ArrayList<>();
        JsonNode tags = node.path("tags");
        if (tags.isArray()) {
            tags.forEach(tag -> rawTags.add(tag.asText()));
        } else if (tags.isTextual()) {
            rawTags.addAll(splitTags(tags.asText()));
        }
        return Optional.of(result(node.get("classification").asText(), node.path("reason").asText(""), rawTags));
    }
    
    private Optional<ClassificationResult> parseLabelled(String reply) {
        Matcher classification = CLASSIFICATION_LINE.matcher(reply);
        if (!classification.find()) {
            return Optional.empty();
        }
        Matcher reason = REASON_LINE.matcher(reply);
        Matcher tags = TAGS_LINE.matcher(reply);
        return Optional.of(result(
            classification.group(1),
            reason.find() ? reason.group(1) : "",
            tags.find() ? splitTags(tags.group(1)) : List.of()));
    }
    
    private Optional<ClassificationResult> parsePipe(String reply) {
        for (String line : reply.split("\\R")) {
            String[] parts = line.split("\\|");
            if (parts.length >= 2 && !parts[0].isBlank()) {
                List<String> tags = parts.length >= 3 ? splitTags(parts[2]) : List.of();
                return Optional.of(result(parts[0], parts[1], tags));
            }
        }
        return Optional.empty();
    }
    
    private ClassificationResult result(String classification, String reason, List<String> rawTags) {
        String label = strip(classification);
        if (label.isEmpty()) {
            label = UNKNOWN;
        }
        List<String> tags = validTags(rawTags);
        if (tags.isEmpty()) {
            tags = List.of(UNKNOWN);
        }
        return new ClassificationResult(label, truncate(strip(reason)), tags);
    }
    
    static List<String> validTags(List<String> rawTags) {
        Set<String> tags = new LinkedHashSet<>();
        for (String raw : rawTags) {
            String canonical = CANONICAL_TAGS.get(strip(raw).toLowerCase(Locale.ROOT));
            if (canonical != null) {
                tags.add(canonical);
            }
        }
        return new ArrayList<>(tags);
    }
    
    private static List<String> splitTags(String text) {
        String body = text.replace("[", "").replace("]", "");
        List<String> tags = new ArrayList<>();
        for (String tag : body.split(",")) {
            if (!tag.isBlank()) {
                tags.add(tag);
            }
        }
        return tags;
    }
    
    private static String strip(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("^[\\s*\"'`]+|[\\s*\"'`.]+$", "");
    }
    
    private String truncate(String reason) {
        if (reason.length() <= maxReasonLength) {
            return reason;
        }
        return reason.substring(0, maxReasonLength) + "...";
    }
}
