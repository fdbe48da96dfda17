package com.mouse.surebet.tracker;

import com.mouse.surebet.enums.TrackerState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Remembers which opportunity keys were present in the previous cycle.
 * <p>
 * Lifecycle: {@link TrackerState#UNINITIALIZED} until the first {@link #advance(Set)}, which stores
 * the keys and reports nothing so a cold start does not flood the sink; {@link TrackerState#TRACKING}
 * afterwards, where each advance reports the difference and replaces the remembered set.
 * <p>
 * Not thread-safe. The owning engine serializes cycles.
 */
@Slf4j
public class ChangeTracker<K> {

    private final String name;
    private TrackerState state = TrackerState.UNINITIALIZED;
    private Set<K> previous = Collections.emptySet();

    public ChangeTracker(String name) {
        this.name = name;
    }

    /**
     * added = current - previous, removed = previous - current. Order follows the source sets.
     */
    public static <K> ChangeSet<K> diff(Set<K> previous, Set<K> current) {
        List<K> added = new ArrayList<>();
        for (K key : current) {
            if (!previous.contains(key)) {
                added.add(key);
            }
        }
        List<K> removed = new ArrayList<>();
        for (K key : previous) {
            if (!current.contains(key)) {
                removed.add(key);
            }
        }
        return new ChangeSet<>(List.copyOf(added), List.copyOf(removed));
    }

    public ChangeSet<K> advance(Set<K> current) {
        Set<K> snapshot = current == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(current));

        if (state == TrackerState.UNINITIALIZED) {
            previous = snapshot;
            state = TrackerState.TRACKING;
            log.debug("[{}] Tracker initialized with {} keys, no changes reported on first cycle", name, snapshot.size());
            return ChangeSet.empty();
        }

        ChangeSet<K> changes = diff(previous, snapshot);
        previous = snapshot;
        if (!changes.isEmpty()) {
            log.debug("[{}] +{} -{} (now {})", name, changes.getAdded().size(), changes.getRemoved().size(), snapshot.size());
        }
        return changes;
    }

    public TrackerState getState() {
        return state;
    }

    public Set<K> getPrevious() {
        return previous;
    }

    public String getName() {
        return name;
    }
}
