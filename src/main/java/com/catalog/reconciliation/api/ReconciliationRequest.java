package com.catalog.reconciliation.api;

import com.catalog.reconciliation.core.model.CollectionType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Input of one reconciliation run: raw local records per entity collection, the matching
 * canonical records where available, and dependent collections that are only rewritten.
 *
 * <p>Raw records are field maps as read from JSON; they are validated during the run.</p>
 */
public class ReconciliationRequest {

    private final Map<CollectionType, List<Map<String, Object>>> locals;
    private final Map<CollectionType, List<Map<String, Object>>> canonicals;
    private final Map<CollectionType, List<Map<String, Object>>> dependents;

    private ReconciliationRequest(Builder builder) {
        this.locals = Collections.unmodifiableMap(new EnumMap<>(builder.locals));
        this.canonicals = Collections.unmodifiableMap(new EnumMap<>(builder.canonicals));
        this.dependents = Collections.unmodifiableMap(new EnumMap<>(builder.dependents));
    }

    /**
     * Entity collections to reconcile, in {@link CollectionType} order.
     */
    public Map<CollectionType, List<Map<String, Object>>> getLocals() {
        return locals;
    }

    /**
     * Canonical records for the collection; empty when the collection is only made internally consistent.
     */
    public Optional<List<Map<String, Object>>> getCanonical(CollectionType type) {
        return Optional.ofNullable(canonicals.get(type));
    }

    public Map<CollectionType, List<Map<String, Object>>> getDependents() {
        return dependents;
    }

    public boolean isEmpty() {
        return locals.isEmpty() && dependents.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<CollectionType, List<Map<String, Object>>> locals = new EnumMap<>(CollectionType.class);
        private final Map<CollectionType, List<Map<String, Object>>> canonicals = new EnumMap<>(CollectionType.class);
        private final Map<CollectionType, List<Map<String, Object>>> dependents = new EnumMap<>(CollectionType.class);

        /**
         * Adds an entity collection with no canonical counterpart: only its identifier
         * conflicts are resolved.
         */
        public Builder collection(CollectionType type, List<Map<String, Object>> local) {
            requireEntity(type);
            requireNotDependent(type);
            locals.put(type, copy(local));
            canonicals.remove(type);
            return this;
        }

        /**
         * Adds an entity collection to synchronize against canonical data.
         */
        public Builder collection(CollectionType type, List<Map<String, Object>> local,
                                  List<Map<String, Object>> canonical) {
            collection(type, local);
            canonicals.put(type, copy(canonical));
            return this;
        }

        /**
         * Adds a collection whose foreign keys are rewritten but which is not itself reconciled.
         */
        public Builder dependent(CollectionType type, List<Map<String, Object>> records) {
            if (locals.containsKey(type)) {
                throw new IllegalArgumentException(type + " is already reconciled in this request");
            }
            dependents.put(type, copy(records));
            return this;
        }

        public ReconciliationRequest build() {
            return new ReconciliationRequest(this);
        }

        private void requireNotDependent(CollectionType type) {
            if (dependents.containsKey(type)) {
                throw new IllegalArgumentException(type + " is already a dependent collection in this request");
            }
        }

        private static void requireEntity(CollectionType type) {
            if (!type.isEntity()) {
                throw new IllegalArgumentException(type + " is a link collection; add it as a dependent");
            }
        }

        private static List<Map<String, Object>> copy(List<Map<String, Object>> records) {
            // elements may be null (reported as malformed); List.copyOf rejects nulls
            return records != null ? Collections.unmodifiableList(new ArrayList<>(records)) : List.of();
        }
    }
}
