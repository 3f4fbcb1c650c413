package com.catalog.reconciliation.identity;

/**
 * Thrown when no free identifier remains above the allocator's cursor.
 * Fatal for the collection being reconciled; other collections proceed.
 */
public class AllocatorExhaustedException extends RuntimeException {

    public AllocatorExhaustedException(String message) {
        super(message);
    }
}
