package com.loglens.mining;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Template miner that masks variable tokens with placeholders.
 * 
 * Masks are applied in order: quoted strings, ISO timestamps, UUIDs, IPv4
 * addresses (with optional port), hex identifiers, file paths and finally
 * numbers. Templates are remembered in first-seen order with their counts.
 */
public class MaskingTemplateMiner implements TemplateMinerClient {
    
    private static final Logger log = LoggerFactory.getLogger(MaskingTemplateMiner.class);
    
    private static final List<Mask> MASKS = List.of(
        new Mask(Pattern.compile("\"[^\"]*\"|'[^']*'"), "<STR>"),
        new Mask(Pattern.compile("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}(?:[.,]\\d+)?(?:Z|[+-]\\d{2}:?\\d{2})?"), "<TS>"),
        new Mask(Pattern.compile("\\b[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}\\b"), "<UUID>"),
        new Mask(Pattern.compile("\\b\\d{1,3}(?:\\.\\d{1,3}){3}(?::\\d+)?\\b"), "<IP>"),
        new Mask(Pattern.compile("\\b0x[0-9a-fA-F]+\\b|\\b(?=[0-9a-fA-F]*\\d)(?=[0-9a-fA-F]*[a-fA-F])[0-9a-fA-F]{8,}\\b"), "<HEX>"),
        new Mask(Pattern.compile("(?<=\\s|^)(?:/[\\w.\\-]+){2,}/?"), "<PATH>"),
        new Mask(Pattern.compile("\\b\\d+(?:\\.\\d+)?\\b"), "<NUM>")
    );
    
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    
    private final Map<String, Integer> templates = new LinkedHashMap<>();
    
    @Override
    public synchronized String mine(String message) {
        String template = mask(message);
        int count = templates.merge(template, 1, Integer::sum);
        if (count == 1) {
            log.trace("New template #{}: {}", templates.size(), template);
        }
        return template;
    }
    
    /**
     * Masks a message without recording it.
     */
    public static String mask(String message) {
        if (message == null || message.isBlank()) {
            return "";
        }
        String masked = message;
        for (Mask mask : MASKS) {
            masked = mask.pattern.matcher(masked).replaceAll(mask.placeholder);
        }
        return WHITESPACE.matcher(masked).replaceAll(" ").trim();
    }
    
    public synchronized int templateCount() {
        return templates.size();
    }
    
    public synchronized Map<String, Integer> templateCounts() {
        return new LinkedHashMap<>(templates);
    }
    
    private static final class Mask {
        private final Pattern pattern;
        private final String placeholder;
        
        private Mask(Pattern pattern, String placeholder) {
            this.pattern = pattern;
            this.placeholder = placeholder;
        }
    }
}
