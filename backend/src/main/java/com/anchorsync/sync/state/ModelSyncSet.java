package com.anchorsync.sync.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Models currently enrolled for sync, in enrollment order.
 */
public class ModelSyncSet {

    private final Set<String> models = new LinkedHashSet<>();

    /** @return the models that were not enrolled yet */
    public synchronized List<String> addAll(Collection<String> toAdd) {
        List<String> added = new ArrayList<>();
        for (String model : toAdd) {
            if (models.add(model)) {
                added.add(model);
            }
        }
        return added;
    }

    /** @return the models that were enrolled and are now removed */
    public synchronized List<String> removeAll(Collection<String> toRemove) {
        List<String> removed = new ArrayList<>();
        for (String model : toRemove) {
            if (models.remove(model)) {
                removed.add(model);
            }
        }
        return removed;
    }

    public synchronized boolean contains(String model) {
        return models.contains(model);
    }

    public synchronized List<String> snapshot() {
        return List.copyOf(models);
    }

    public synchronized int size() {
        return models.size();
    }
}
