package com.mouse.surebet.tracker;

import lombok.Value;

import java.util.List;

/**
 * Keys that appeared and disappeared between two cycles.
 */
@Value
public class ChangeSet<K> {
    List<K> added;
    List<K> removed;

    public static <K> ChangeSet<K> empty() {
        return new ChangeSet<>(List.of(), List.of());
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
