package com.catalog.reconciliation.metrics;

import com.catalog.reconciliation.core.model.CollectionType;
import com.catalog.reconciliation.core.model.MergeDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code catalog.reconcile.duration}: Timer (tags: collection, outcome)</li>
 *   <li>{@code catalog.records.created}: Counter (tag: collection)</li>
 *   <li>{@code catalog.records.updated}: Counter (tag: collection)</li>
 *   <li>{@code catalog.records.archived}: Counter (tag: collection)</li>
 *   <li>{@code catalog.records.errors}: Counter (tag: collection)</li>
 *   <li>{@code catalog.ids.reassigned}: Counter (tag: collection)</li>
 *   <li>{@code catalog.fields.decision}: Counter (tags: collection, decision)</li>
 *   <li>{@code catalog.references.unresolved}: Counter (tag: collection)</li>
 *   <li>{@code catalog.collection.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary collectionSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.collectionSizeSummary = DistributionSummary.builder("catalog.collection.size")
                .description("Number of local records per reconciled collection")
                .register(registry);
    }

    @Override
    public void recordReconcileDuration(CollectionType type, boolean success, Duration duration) {
        String outcome = success ? "success" : "failed";
        String key = type.name() + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("catalog.reconcile.duration")
                        .description("Duration of one collection reconciliation pass")
                        .tag("collection", type.getKey())
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementCreated(CollectionType type) {
        counter("catalog.records.created", "Records given a new identifier", type).increment();
    }

    @Override
    public void incrementUpdated(CollectionType type) {
        counter("catalog.records.updated", "Records matched to a canonical record", type).increment();
    }

    @Override
    public void incrementArchived(CollectionType type) {
        counter("catalog.records.archived", "Records matched to an archived canonical record", type).increment();
    }

    @Override
    public void incrementErrors(CollectionType type) {
        counter("catalog.records.errors", "Records skipped or collections failed", type).increment();
    }

    @Override
    public void incrementIdReassigned(CollectionType type) {
        counter("catalog.ids.reassigned", "Conflicting identifiers replaced", type).increment();
    }

    @Override
    public void recordFieldDecision(CollectionType type, MergeDecision decision) {
        String key = "decision:" + type.name() + ":" + decision.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("catalog.fields.decision")
                        .description("Per-field merge decisions")
                        .tag("collection", type.getKey())
                        .tag("decision", decision.name())
                        .register(registry)).increment();
    }

    @Override
    public void incrementUnresolvedReference(CollectionType type) {
        counter("catalog.references.unresolved", "Foreign keys left unrewritten and flagged", type).increment();
    }

    @Override
    public void recordCollectionSize(int size) {
        collectionSizeSummary.record(size);
    }

    private Counter counter(String name, String description, CollectionType type) {
        String key = name + ":" + type.name();
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("collection", type.getKey())
                        .register(registry));
    }
}
