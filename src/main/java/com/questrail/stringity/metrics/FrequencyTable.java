package com.questrail.stringity.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * FrequencyTable
 * -----------------------------------------------------------------------------
 * Occurrence counts of items, kept in first-seen order.
 *
 * <p>A table is built per call from exactly the items supplied and is never
 * cached or shared. Iteration order is the order in which each distinct item
 * first appeared, and that order is the tie-break: when several items share
 * the highest (or lowest) count, {@link #mostFrequent()} (or
 * {@link #leastFrequent()}) returns the one seen first.</p>
 *
 * @param <T> item type; must have value-based {@code equals}/{@code hashCode}
 */
public final class FrequencyTable<T>
{
    private final Map<T, Integer> counts;

    private FrequencyTable(Map<T, Integer> counts) {
        this.counts = Collections.unmodifiableMap(counts);
    }

    /**
     * Counts {@code items} in iteration order.
     */
    public static <T> FrequencyTable<T> of(Iterable<? extends T> items) {
        Objects.requireNonNull(items, "items");

        Map<T, Integer> tmp = new LinkedHashMap<>();
        for (T item : items) {
            tmp.merge(Objects.requireNonNull(item, "item"), 1, Integer::sum);
        }
        return new FrequencyTable<>(tmp);
    }

    public int count(T item) {
        return counts.getOrDefault(item, 0);
    }

    /** Number of distinct items. */
    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /** Unmodifiable view, iterating in first-seen order. */
    public Map<T, Integer> asMap() {
        return counts;
    }

    public Optional<T> mostFrequent() {
        T best = null;
        int bestCount = 0;
        for (Map.Entry<T, Integer> e : counts.entrySet()) {
            // strictly greater: an equal count never displaces an earlier item
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    public Optional<T> leastFrequent() {
        T best = null;
        int bestCount = Integer.MAX_VALUE;
        for (Map.Entry<T, Integer> e : counts.entrySet()) {
            if (e.getValue() < bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public String toString() {
        return "FrequencyTable" + counts;
    }
}
