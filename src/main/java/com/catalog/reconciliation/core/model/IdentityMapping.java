package com.catalog.reconciliation.core.model;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One-to-one mapping from local identifiers to final identifiers, produced by one
 * reconciliation pass over one collection. Immutable once built.
 */
public final class IdentityMapping {

    private static final IdentityMapping EMPTY = new IdentityMapping(Map.of());

    private final Map<Integer, Integer> entries;
    private final Set<Integer> targets;

    private IdentityMapping(Map<Integer, Integer> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        this.targets = Set.copyOf(entries.values());
    }

    public static IdentityMapping empty() {
        return EMPTY;
    }

    /**
     * Creates a mapping from an existing map. Fails if two keys map to the same target.
     */
    public static IdentityMapping of(Map<Integer, Integer> entries) {
        Builder builder = builder();
        entries.forEach(builder::put);
        return builder.build();
    }

    /**
     * Returns the final identifier for a local identifier, or null if it is not mapped.
     */
    public Integer apply(Integer oldId) {
        return oldId == null ? null : entries.get(oldId);
    }

    public boolean contains(Integer oldId) {
        return oldId != null && entries.containsKey(oldId);
    }

    public boolean containsTarget(Integer newId) {
        return newId != null && targets.contains(newId);
    }

    /**
     * Entries whose identifier actually changed.
     */
    public Map<Integer, Integer> changedEntries() {
        Map<Integer, Integer> changed = new LinkedHashMap<>();
        entries.forEach((oldId, newId) -> {
            if (!oldId.equals(newId)) {
                changed.put(oldId, newId);
            }
        });
        return Collections.unmodifiableMap(changed);
    }

    public Map<Integer, Integer> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((IdentityMapping) o).entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries);
    }

    @Override
    public String toString() {
        return "IdentityMapping" + entries;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<Integer, Integer> entries = new LinkedHashMap<>();
        private final Set<Integer> targets = new HashSet<>();

        public Builder put(Integer oldId, Integer newId) {
            Objects.requireNonNull(oldId, "oldId is required");
            Objects.requireNonNull(newId, "newId is required");
            Integer previous = entries.get(oldId);
            if (previous != null) {
                if (previous.equals(newId)) {
                    return this;
                }
                throw new IllegalStateException("Identifier " + oldId + " already mapped to " + previous);
            }
            if (!targets.add(newId)) {
                throw new IllegalStateException("Target identifier " + newId + " already assigned");
            }
            entries.put(oldId, newId);
            return this;
        }

        public IdentityMapping build() {
            return new IdentityMapping(entries);
        }
    }
}
