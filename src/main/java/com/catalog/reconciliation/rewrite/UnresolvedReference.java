package com.catalog.reconciliation.rewrite;

import java.util.Locale;

/**
 * A foreign-key value the rewriter left untouched and flagged.
 *
 * @param foreignKey the declared reference
 * @param position   index of the record within its collection
 * @param recordId   identifier of the referencing record (null for link records)
 * @param value      the raw reference value
 * @param reason     why it was flagged
 */
public record UnresolvedReference(
        ForeignKey foreignKey,
        int position,
        Integer recordId,
        Object value,
        Reason reason
) {
    public enum Reason {
        /**
         * The identifier is neither a remapped local identifier nor a final identifier.
         * The referenced entity may live outside this run.
         */
        UNKNOWN_ENTITY,

        /**
         * The value is not an integer identifier.
         */
        NOT_AN_IDENTIFIER
    }

    public String describe() {
        return foreignKey + " at position " + position
                + (recordId != null ? " (record " + recordId + ")" : "")
                + ": " + value + " " + reason.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
