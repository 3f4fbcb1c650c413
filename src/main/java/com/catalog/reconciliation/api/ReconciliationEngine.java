package com.catalog.reconciliation.api;

import com.catalog.reconciliation.audit.AuditAction;
import com.catalog.reconciliation.audit.AuditEntry;
import com.catalog.reconciliation.audit.AuditService;
import com.catalog.reconciliation.core.model.CatalogRecord;
import com.catalog.reconciliation.core.model.CollectionType;
import com.catalog.reconciliation.core.model.IdentityMapping;
import com.catalog.reconciliation.core.model.MalformedRecordException;
import com.catalog.reconciliation.ledger.RunLedger;
import com.catalog.reconciliation.ledger.RunReport;
import com.catalog.reconciliation.logging.LogContext;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import com.catalog.reconciliation.rewrite.CascadeResult;
import com.catalog.reconciliation.rewrite.ForeignKey;
import com.catalog.reconciliation.rewrite.ReferenceRewriter;
import com.catalog.reconciliation.rewrite.ReferenceTable;
import com.catalog.reconciliation.rewrite.UnresolvedReference;
import com.catalog.reconciliation.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs a reconciliation across collections.
 *
 * <p>Phase 1 reconciles every entity collection of the request in waves ordered by the
 * options' reference table: a collection runs only after every other reconciled collection
 * it references has a final mapping, and translates its own foreign keys before merging.
 * Collections of one wave run concurrently when {@link ReconciliationOptions#getParallelism()}
 * is greater than one. A collection whose pass throws is marked failed in the run ledger and
 * the run continues. Phase 2 starts once every phase 1 mapping is final: it rewrites the
 * foreign keys of the dependent collections.</p>
 *
 * <pre>
 * try (ReconciliationEngine engine = new ReconciliationEngine(options)) {
 *     ReconciliationResult result = engine.reconcile(request);
 *     log.info("{}", result.getReport());
 * }
 * </pre>
 */
public class ReconciliationEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final ReconciliationOptions options;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Clock clock;
    private final CollectionReconciler collectionReconciler;
    private final ReferenceRewriter referenceRewriter;
    private final ExecutorService executor;

    public ReconciliationEngine(ReconciliationOptions options) {
        this(options, new AuditService(), new NoOpMetricsService());
    }

    public ReconciliationEngine(ReconciliationOptions options, AuditService auditService,
                                MetricsService metricsService) {
        this(options, auditService, metricsService, Clock.systemUTC());
    }

    public ReconciliationEngine(ReconciliationOptions options, AuditService auditService,
                                MetricsService metricsService, Clock clock) {
        this.options = options;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.clock = clock;

        NameNormalizer normalizer = NameNormalizer.createDefault();
        normalizer.addRules(options.getNormalizationRules());
        this.collectionReconciler = new CollectionReconciler(normalizer, auditService, metricsService, options);
        this.referenceRewriter = new ReferenceRewriter();
        this.executor = options.getParallelism() > 1
                ? Executors.newFixedThreadPool(options.getParallelism())
                : null;
    }

    /**
     * @throws IllegalArgumentException if reconciled collections of the request reference each other in a cycle
     */
    public ReconciliationResult reconcile(ReconciliationRequest request) {
        List<List<CollectionType>> waves = reconciliationWaves(request.getLocals().keySet());
        RunLedger ledger = new RunLedger(LogContext.generateRunId(), options.getSource(),
                options.getTriggeredBy(), clock);

        try (LogContext ignored = LogContext.forRun(ledger.getRunId())) {
            Map<CollectionType, ReconciledCollection> reconciled = reconcileCollections(waves, request, ledger);

            Map<CollectionType, IdentityMapping> mappings = new EnumMap<>(CollectionType.class);
            Map<CollectionType, List<CatalogRecord>> collections = new EnumMap<>(CollectionType.class);
            reconciled.forEach((type, collection) -> {
                mappings.put(type, collection.mapping());
                collections.put(type, collection.records());
            });

            CascadeResult cascade = rewriteDependents(parseDependents(request, ledger), mappings, ledger);
            collections.putAll(cascade.collections());
            List<UnresolvedReference> unresolved = reportReferences(reconciled, cascade, request, ledger);

            RunReport report = ledger.finish();
            log.info("reconcile.completed status={} created={} updated={} archived={} errors={} durationMs={}",
                    report.status(), report.totalCreated(), report.totalUpdated(), report.totalArchived(),
                    report.totalErrors(), report.duration().toMillis());
            return new ReconciliationResult(report, reconciled, collections, mappings,
                    unresolved, auditService.getEntriesForRun(ledger.getRunId()));
        }
    }

    /**
     * Orders the reconciled collections so that every collection comes after the other
     * reconciled collections it references. References to a collection itself do not count.
     */
    private List<List<CollectionType>> reconciliationWaves(Set<CollectionType> types) {
        ReferenceTable table = options.getReferenceTable();
        Set<CollectionType> remaining = EnumSet.noneOf(CollectionType.class);
        remaining.addAll(types);
        List<List<CollectionType>> waves = new ArrayList<>();

        while (!remaining.isEmpty()) {
            List<CollectionType> wave = new ArrayList<>();
            for (CollectionType type : remaining) {
                boolean ready = table.referencesFrom(type).stream()
                        .map(ForeignKey::target)
                        .allMatch(target -> target == type || !remaining.contains(target));
                if (ready) {
                    wave.add(type);
                }
            }
            if (wave.isEmpty()) {
                throw new IllegalArgumentException("Reconciled collections reference each other in a cycle: "
                        + remaining);
            }
            wave.forEach(remaining::remove);
            waves.add(wave);
        }
        return waves;
    }

    private Map<CollectionType, ReconciledCollection> reconcileCollections(List<List<CollectionType>> waves,
                                                                        ReconciliationRequest request,
                                                                        RunLedger ledger) {
        Map<CollectionType, ReconciledCollection> reconciled = new EnumMap<>(CollectionType.class);
        request.getLocals().keySet().forEach(ledger::begin);
        Map<CollectionType, IdentityMapping> finished = new EnumMap<>(CollectionType.class);

        for (List<CollectionType> wave : waves) {
            Map<CollectionType, IdentityMapping> targets = Map.copyOf(finished);
            log.debug("reconcile.wave collections={}", wave);

            if (executor == null || wave.size() == 1) {
                for (CollectionType type : wave) {
                    reconcileCollection(type, request, targets, ledger)
                            .ifPresent(result -> reconciled.put(type, result));
                }
            } else {
                String runId = ledger.getRunId();
                Map<CollectionType, CompletableFuture<Optional<ReconciledCollection>>> futures = new LinkedHashMap<>();
                for (CollectionType type : wave) {
                    futures.put(type, CompletableFuture.supplyAsync(() -> {
                        try (LogContext ignored = LogContext.forRun(runId)) {
                            return reconcileCollection(type, request, targets, ledger);
                        }
                    }, executor));
                }
                futures.forEach((type, future) -> future.join().ifPresent(result -> reconciled.put(type, result)));
            }

            for (CollectionType type : wave) {
                ReconciledCollection result = reconciled.get(type);
                if (result != null) {
                    finished.put(type, result.mapping());
                }
            }
        }
        return reconciled;
    }

    private Optional<ReconciledCollection> reconcileCollection(CollectionType type,
                                                               ReconciliationRequest request,
                                                               Map<CollectionType, IdentityMapping> targets,
                                                               RunLedger ledger) {
        List<Map<String, Object>> locals = request.getLocals().get(type);
        Instant started = clock.instant();
        metricsService.recordCollectionSize(locals.size());
        try {
            ReconciledCollection result = collectionReconciler.reconcile(type, locals,
                    request.getCanonical(type).orElse(null), ledger, targets);
            metricsService.recordReconcileDuration(type, true, Duration.between(started, clock.instant()));
            return Optional.of(result);
        } catch (RuntimeException e) {
            log.error("reconcile.collection.failed collection={} error={}", type.getKey(), e.getMessage(), e);
            ledger.markFailed(type, e.getClass().getSimpleName() + ": " + e.getMessage());
            metricsService.incrementErrors(type);
            metricsService.recordReconcileDuration(type, false, Duration.between(started, clock.instant()));
            auditService.record(AuditEntry.builder()
                    .runId(ledger.getRunId())
                    .action(AuditAction.COLLECTION_FAILED)
                    .collection(type)
                    .details(Map.of("error", String.valueOf(e.getMessage())))
                    .build());
            return Optional.empty();
        }
    }

    private Map<CollectionType, List<CatalogRecord>> parseDependents(ReconciliationRequest request,
                                                                     RunLedger ledger) {
        Map<CollectionType, List<CatalogRecord>> dependents = new EnumMap<>(CollectionType.class);
        request.getDependents().forEach((type, raw) -> {
            List<CatalogRecord> records = new ArrayList<>(raw.size());
            for (Map<String, Object> item : raw) {
                try {
                    records.add(CatalogRecord.fromMap(item));
                } catch (MalformedRecordException e) {
                    ledger.addIssue(type.getKey() + ": skipped malformed record: " + e.getMessage());
                    auditService.record(AuditEntry.builder()
                            .runId(ledger.getRunId())
                            .action(AuditAction.RECORD_SKIPPED)
                            .collection(type)
                            .details(Map.of("reason", e.getMessage()))
                            .build());
                }
            }
            dependents.put(type, records);
        });
        return dependents;
    }

    private CascadeResult rewriteDependents(Map<CollectionType, List<CatalogRecord>> dependents,
                                            Map<CollectionType, IdentityMapping> mappings,
                                            RunLedger ledger) {
        try (LogContext ignored = LogContext.forRewrite(ledger.getRunId())) {
            return referenceRewriter.rewriteAll(dependents, mappings, options.getReferenceTable());
        }
    }

    /**
     * Audits the references translated in both phases and reports the ones left untouched.
     *
     * @return every unresolved reference of the run, reconciled collections first
     */
    private List<UnresolvedReference> reportReferences(Map<CollectionType, ReconciledCollection> reconciled,
                                                       CascadeResult cascade,
                                                       ReconciliationRequest request,
                                                       RunLedger ledger) {
        Map<ForeignKey, Integer> rewritten = new LinkedHashMap<>();
        List<UnresolvedReference> unresolved = new ArrayList<>();
        List<ForeignKey> skipped = new ArrayList<>();
        reconciled.forEach((type, collection) -> {
            collection.references().forEach((foreignKey, count) -> rewritten.merge(foreignKey, count, Integer::sum));
            unresolved.addAll(collection.unresolved());
            for (ForeignKey foreignKey : options.getReferenceTable().referencesFrom(type)) {
                if (foreignKey.target() != type && !reconciled.containsKey(foreignKey.target())) {
                    skipped.add(foreignKey);
                }
            }
        });
        cascade.rewrittenByKey().forEach((foreignKey, count) -> rewritten.merge(foreignKey, count, Integer::sum));
        unresolved.addAll(cascade.unresolved());
        skipped.addAll(cascade.skipped());

        rewritten.forEach((foreignKey, count) -> {
            if (count > 0) {
                auditService.record(AuditEntry.builder()
                        .runId(ledger.getRunId())
                        .action(AuditAction.REFERENCE_REWRITTEN)
                        .collection(foreignKey.source())
                        .details(Map.of("field", foreignKey.field(),
                                "target", foreignKey.target().getKey(),
                                "count", count))
                        .build());
            }
        });

        for (UnresolvedReference reference : unresolved) {
            CollectionType source = reference.foreignKey().source();
            ledger.addIssue(reference.describe());
            metricsService.incrementUnresolvedReference(source);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("field", reference.foreignKey().field());
            details.put("value", reference.value());
            details.put("reason", reference.reason().name());
            details.put("position", reference.position());
            auditService.record(AuditEntry.builder()
                    .runId(ledger.getRunId())
                    .action(AuditAction.UNKNOWN_REFERENCE)
                    .collection(source)
                    .recordId(reference.recordId())
                    .details(details)
                    .build());
        }

        for (ForeignKey foreignKey : skipped) {
            if (request.getLocals().containsKey(foreignKey.target())) {
                ledger.addIssue(foreignKey + " left unchanged: "
                        + foreignKey.target().getKey() + " failed to reconcile");
            } else {
                log.debug("rewrite.skipped fk='{}' reason=no-mapping", foreignKey);
            }
        }
        return unresolved;
    }

    public ReconciliationOptions getOptions() {
        return options;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
