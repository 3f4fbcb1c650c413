package com.catalog.reconciliation.core.model;

/**
 * Per-field outcome of merging a canonical record into a local one.
 */
public enum MergeDecision {
    /**
     * The field is protected on the local record; the local value was kept.
     */
    KEPT_LOCAL,

    /**
     * The canonical value differed and replaced the local value.
     */
    ADOPTED_CANONICAL,

    /**
     * Local and canonical values were already equal.
     */
    UNCHANGED
}
