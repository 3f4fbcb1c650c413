package com.catalog.reconciliation.core.model;

/**
 * Outcome of matching one local record against the canonical collection.
 */
public enum MatchStatus {
    /**
     * A canonical record with the same normalized name exists.
     * The local record takes the canonical identifier.
     */
    MATCHED,

    /**
     * No canonical counterpart. The record receives a freshly allocated identifier.
     */
    NEW
}
