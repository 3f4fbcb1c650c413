package com.catalog.reconciliation.ledger;

import com.catalog.reconciliation.core.model.CollectionType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable outcome of a finished reconciliation run.
 */
public record RunReport(
        String runId,
        RunStatus status,
        Map<CollectionType, CollectionTally> perType,
        Instant startedAt,
        Instant finishedAt,
        List<String> issues,
        String source,
        String triggeredBy
) {
    public RunReport {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(startedAt, "startedAt is required");
        perType = perType != null && !perType.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(perType))
                : Map.of();
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public CollectionTally tally(CollectionType type) {
        return perType.getOrDefault(type, CollectionTally.empty());
    }

    public Duration duration() {
        return finishedAt != null ? Duration.between(startedAt, finishedAt) : Duration.ZERO;
    }

    public int totalCreated() {
        return perType.values().stream().mapToInt(CollectionTally::created).sum();
    }

    public int totalUpdated() {
        return perType.values().stream().mapToInt(CollectionTally::updated).sum();
    }

    public int totalArchived() {
        return perType.values().stream().mapToInt(CollectionTally::archived).sum();
    }

    public int totalErrors() {
        return perType.values().stream().mapToInt(t -> t.errors().size()).sum();
    }

    public int totalProcessed() {
        return perType.values().stream().mapToInt(CollectionTally::processed).sum();
    }

    public boolean hasErrors() {
        return totalErrors() > 0;
    }

    /**
     * Plain map view for serialization, with wire names for keys and ISO-8601 timestamps.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("run_id", runId);
        map.put("status", status.getValue());
        map.put("source", source);
        map.put("triggered_by", triggeredBy);
        map.put("started_at", startedAt.toString());
        map.put("finished_at", finishedAt != null ? finishedAt.toString() : null);
        map.put("duration_seconds", duration().toMillis() / 1000.0);

        Map<String, Object> types = new LinkedHashMap<>();
        perType.forEach((type, tally) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("created", tally.created());
            entry.put("updated", tally.updated());
            entry.put("archived", tally.archived());
            List<Map<String, Object>> errors = new ArrayList<>();
            for (RecordError error : tally.errors()) {
                Map<String, Object> e = new LinkedHashMap<>();
                e.put("record", error.record());
                e.put("reason", error.reason());
                errors.add(e);
            }
            entry.put("errors", errors);
            entry.put("failed", tally.failed());
            types.put(type.getKey(), entry);
        });
        map.put("per_type", types);

        Map<String, Object> totals = new LinkedHashMap<>();
        totals.put("created", totalCreated());
        totals.put("updated", totalUpdated());
        totals.put("archived", totalArchived());
        totals.put("errors", totalErrors());
        map.put("totals", totals);
        map.put("issues", issues);
        return map;
    }

    @Override
    public String toString() {
        return "RunReport{runId=" + runId +
                ", status=" + status +
                ", created=" + totalCreated() +
                ", updated=" + totalUpdated() +
                ", archived=" + totalArchived() +
                ", errors=" + totalErrors() +
                ", issues=" + issues.size() + '}';
    }
}
