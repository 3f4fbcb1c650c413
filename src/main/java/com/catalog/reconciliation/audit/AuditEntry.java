package com.catalog.reconciliation.audit;

import com.catalog.reconciliation.core.model.CollectionType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of an auditable operation.
 * The run identifier is null for entries recorded outside a reconciliation run.
 * Detail values may be null (e.g. a field absent from the local record).
 */
public record AuditEntry(
        String id,
        String runId,
        AuditAction action,
        CollectionType collection,
        Integer recordId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String runId;
        private AuditAction action;
        private CollectionType collection;
        private Integer recordId;
        private Map<String, Object> details;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder collection(CollectionType collection) {
            this.collection = collection;
            return this;
        }

        public Builder recordId(Integer recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, runId, action, collection, recordId, details, timestamp);
        }
    }
}
