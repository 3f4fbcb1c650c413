package com.catalog.reconciliation.audit;

/**
 * Types of auditable actions during catalog reconciliation.
 */
public enum AuditAction {
    ID_ASSIGNED,
    ID_REASSIGNED,
    RECORD_MATCHED,
    RECORD_CREATED,
    DUPLICATE_LOCAL_MATCH,
    AMBIGUOUS_CANONICAL_NAME,
    FIELD_ADOPTED,
    FIELD_KEPT_LOCAL,
    REFERENCE_REWRITTEN,
    UNKNOWN_REFERENCE,
    RECORD_SKIPPED,
    COLLECTION_FAILED
}
