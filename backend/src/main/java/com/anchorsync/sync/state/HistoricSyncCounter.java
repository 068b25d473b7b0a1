package com.anchorsync.sync.state;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Outstanding historical sync jobs per model. A model with no entry is historically synced.
 * Counts never go below zero and zero entries are removed.
 */
public class HistoricSyncCounter {

    private final Map<String, Integer> counts = new HashMap<>();

    public synchronized void increment(Collection<String> models) {
        for (String model : models) {
            counts.merge(model, 1, Integer::sum);
        }
    }

    public synchronized void decrement(Collection<String> models) {
        for (String model : models) {
            counts.computeIfPresent(model, (m, c) -> c > 1 ? c - 1 : null);
        }
    }

    /** Replaces every count with the given outstanding jobs per model; non-positive counts are dropped. */
    public synchronized void replaceAll(Map<String, Integer> outstanding) {
        counts.clear();
        outstanding.forEach((model, count) -> {
            if (count > 0) {
                counts.put(model, count);
            }
        });
    }

    public synchronized int get(String model) {
        return counts.getOrDefault(model, 0);
    }

    public boolean isSynced(String model) {
        return get(model) == 0;
    }

    public synchronized Map<String, Integer> snapshot() {
        return Map.copyOf(counts);
    }
}
