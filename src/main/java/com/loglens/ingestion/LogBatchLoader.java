package com.loglens.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loglens.domain.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads one input file into a {@link LogBatch}.
 * 
 * {@code .json} files hold an array of objects; the message is taken from
 * {@code @message.log}, {@code message}, {@code log} or a string {@code @message},
 * the timestamp from the first of {@code @timestamp, timestamp, time, @time,
 * datetime, date}. Remaining scalar members become attributes. Any other file
 * is read line by line, the first space-separated token being the timestamp.
 * Entries without a message are dropped.
 */
public class LogBatchLoader {
    
    private static final Logger log = LoggerFactory.getLogger(LogBatchLoader.class);
    
    private static final List<String> TIMESTAMP_FIELDS = List.of(
        "@timestamp", "timestamp", "time", "@time", "datetime", "date");
    private static final List<String> MESSAGE_FIELDS = List.of("@message", "message", "log");
    
    private final ObjectMapper objectMapper;
    private final int maxLogLines;
    private final int largeLogWarningThreshold;
    
    /**
     * @param maxLogLines keep only the first N entries, 0 for no limit
     */
    public LogBatchLoader(ObjectMapper objectMapper, int maxLogLines, int largeLogWarningThreshold) {
        this.objectMapper = objectMapper;
        this.maxLogLines = maxLogLines;
        this.largeLogWarningThreshold = largeLogWarningThreshold;
    }
    
    public static boolean isSupported(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") || name.endsWith(".log") || name.endsWith(".txt");
    }
    
    /**
     * @throws BatchLoadException if the file cannot be read or parsed
     */
    public LogBatch load(Path file) {
        String sourceFile = file.getFileName().toString();
        List<LogRecord> records;
        int read;
        try {
            if (sourceFile.toLowerCase(Locale.ROOT).endsWith(".json")) {
                JsonNode root = objectMapper.readTree(file.toFile());
                read = root != null && root.isArray() ? root.size() : 0;
                records = fromJson(root, sourceFile);
            } else {
                List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
                read = lines.size();
                records = fromLines(lines, sourceFile);
            }
        } catch (IOException e) {
            throw new BatchLoadException(sourceFile, "Cannot read input", e);
        }
        
        if (maxLogLines > 0 && records.size() > maxLogLines) {
            log.warn("Sampling first {} of {} records from {}", maxLogLines, records.size(), sourceFile);
            records = new ArrayList<>(records.subList(0, maxLogLines));
        }
        if (records.size() > largeLogWarningThreshold) {
            log.warn("Large log file detected: {} has {} records, processing may take longer", sourceFile, records.size());
        }
        log.info("Loaded {} records from {} ({} entries read)", records.size(), sourceFile, read);
        return new LogBatch(sourceFile, records, read);
    }
    
    List<LogRecord> fromJson(JsonNode root, String sourceFile) {
        if (root == null || !root.isArray()) {
            throw new BatchLoadException(sourceFile, "Expected a JSON array of log objects", null);
        }
        List<LogRecord> records = new ArrayList<>();
        for (JsonNode entry : root) {
            if (!entry.isObject()) {
                continue;
            }
            String message = message(entry);
            if (message == null || message.trim().isEmpty()) {
                continue;
            }
            records.add(new LogRecord(timestamp(entry), message.trim(), sourceFile, null, attributes(entry)));
        }
        return records;
    }
    
    List<LogRecord> fromLines(List<String> lines, String sourceFile) {
        List<LogRecord> records = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = trimmed.split(" ", 2);
            if (parts.length == 2) {
                records.add(new LogRecord(parts[0], parts[1].trim(), sourceFile));
            } else {
                records.add(new LogRecord(null, trimmed, sourceFile));
            }
        }
        return records;
    }
    
    private static String message(JsonNode entry) {
        JsonNode structured = entry.get("@message");
        if (structured != null && structured.isObject() && structured.hasNonNull("log")) {
            return structured.get("log").asText();
        }
        JsonNode message = entry.get("message");
        if (message != null && message.isTextual()) {
            return message.asText();
        }
        JsonNode logField = entry.get("log");
        if (logField != null && logField.isValueNode() && !logField.isNull()) {
            return logField.asText();
        }
        if (structured != null && structured.isTextual()) {
            return structured.asText();
        }
        return null;
    }
    
    private static String timestamp(JsonNode entry) {
        for (String field : TIMESTAMP_FIELDS) {
            JsonNode value = entry.get(field);
            if (value != null && value.isValueNode() && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }
    
    private static Map<String, String> attributes(JsonNode entry) {
        Map<String, String> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = entry.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (MESSAGE_FIELDS.contains(name) || TIMESTAMP_FIELDS.contains(name)) {
                continue;
            }
            JsonNode value = field.getValue();
            if (value.isValueNode() && !value.isNull()) {
                attributes.put(name, value.asText());
            }
        }
        return attributes;
    }
}
