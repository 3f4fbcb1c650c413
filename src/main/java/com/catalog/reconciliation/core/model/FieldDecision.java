package com.catalog.reconciliation.core.model;

import java.util.Objects;

/**
 * Audit entry for one merged field.
 *
 * @param field          the field name
 * @param decision       what the merger did with the field
 * @param localValue     value on the local record before merging (null if absent)
 * @param canonicalValue value carried by the canonical record
 */
public record FieldDecision(
        String field,
        MergeDecision decision,
        Object localValue,
        Object canonicalValue
) {
    public FieldDecision {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(decision, "decision is required");
    }
}
