package com.catalog.reconciliation.rewrite;

import com.catalog.reconciliation.core.model.CollectionType;

import java.util.Objects;

/**
 * Declares that {@code source.field} holds identifiers of records in {@code target}.
 */
public record ForeignKey(CollectionType source, String field, CollectionType target) {

    public ForeignKey {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(target, "target is required");
        if (field.isBlank()) {
            throw new IllegalArgumentException("field must not be blank");
        }
    }

    @Override
    public String toString() {
        return source.getKey() + "." + field + " -> " + target.getKey();
    }
}
