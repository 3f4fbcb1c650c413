package com.catalog.reconciliation.identity;

/**
 * An identifier handed out by the conflict resolver.
 *
 * @param position    index of the record in the input collection
 * @param oldId       previous identifier, or null if the record had none
 * @param newId       the identifier assigned
 * @param displayName the record's display name, for audit readability
 */
public record IdReassignment(int position, Integer oldId, int newId, String displayName) {

    /**
     * True if this replaced a conflicting identifier rather than filling a missing one.
     */
    public boolean isConflict() {
        return oldId != null;
    }
}
