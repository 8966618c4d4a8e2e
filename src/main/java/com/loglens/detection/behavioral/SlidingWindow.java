package com.loglens.detection.behavioral;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;

/**
 * Two-pointer time window over a time-ordered stream.
 * 
 * Items are pushed in time order; on each push the oldest items are evicted
 * while they lie more than {@code spanMillis} before the newest one, so the
 * window is inclusive of items exactly {@code spanMillis} apart. The window
 * keeps running totals of items accepted by the membership predicate and of
 * distinct non-null values of the value extractor.
 *
 * @param <T> item type
 */
public class SlidingWindow<T> {
    
    private final long spanMillis;
    private final ToLongFunction<T> time;
    private final Predicate<T> membership;
    private final Function<T, String> valueExtractor;
    
    private final Deque<T> items = new ArrayDeque<>();
    private final Map<String, Integer> valueCounts = new HashMap<>();
    private int memberCount;
    
    public SlidingWindow(long spanMillis, ToLongFunction<T> time, Predicate<T> membership,
                         Function<T, String> valueExtractor) {
        this.spanMillis = spanMillis;
        this.time = time;
        this.membership = membership;
        this.valueExtractor = valueExtractor;
    }
    
    /**
     * Adds the next item and evicts items that fell out of the window.
     */
    public void push(T item) {
        items.addLast(item);
        if (membership.test(item)) {
            memberCount++;
        }
        addValue(item);
        
        long newest = time.applyAsLong(item);
        while (!items.isEmpty() && newest - time.applyAsLong(items.peekFirst()) > spanMillis) {
            evict(items.pollFirst());
        }
    }
    
    private void addValue(T item) {
        if (valueExtractor == null) {
            return;
        }
        String value = valueExtractor.apply(item);
        if (value != null) {
            valueCounts.merge(value, 1, Integer::sum);
        }
    }
    
    private void evict(T item) {
        if (membership.test(item)) {
            memberCount--;
        }
        if (valueExtractor != null) {
            String value = valueExtractor.apply(item);
            if (value != null) {
                valueCounts.computeIfPresent(value, (k, v) -> v > 1 ? v - 1 : null);
            }
        }
    }
    
    public int size() {
        return items.size();
    }
    
    public int memberCount() {
        return memberCount;
    }
    
    public int distinctValues() {
        return valueCounts.size();
    }
    
    public double memberRatio() {
        return items.isEmpty() ? 0.0 : (double) memberCount / items.size();
    }
    
    public List<T> items() {
        return new ArrayList<>(items);
    }
    
    public List<T> members() {
        List<T> members = new ArrayList<>();
        for (T item : items) {
            if (membership.test(item)) {
                members.add(item);
            }
        }
        return members;
    }
}
