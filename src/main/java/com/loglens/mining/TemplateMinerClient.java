package com.loglens.mining;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces raw log messages to structural templates with variable parts masked.
 * 
 * Implementations may be stateful and learn templates in call order, so
 * records must be mined in batch order.
 */
public interface TemplateMinerClient {
    
    /**
     * @param message a raw log message
     * @return the template for the message, never null
     */
    String mine(String message);
    
    default List<String> mineAll(List<String> messages) {
        List<String> templates = new ArrayList<>(messages.size());
        for (String message : messages) {
            templates.add(mine(message));
        }
        return templates;
    }
}
