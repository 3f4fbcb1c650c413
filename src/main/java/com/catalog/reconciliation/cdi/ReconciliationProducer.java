package com.catalog.reconciliation.cdi;

import com.catalog.reconciliation.api.ReconciliationEngine;
import com.catalog.reconciliation.api.ReconciliationOptions;
import com.catalog.reconciliation.audit.AuditService;
import com.catalog.reconciliation.core.model.CollectionType;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * CDI producer that wires the reconciliation engine from MicroProfile Config properties.
 *
 * <p>Every property has a default, so the engine works without configuration:</p>
 * <pre>
 * catalog-reconciliation:
 *   identity:
 *     start-id: 1
 *   parallelism: 4
 *   sort-order:
 *     collections: categories
 *     field: sort_order
 *   run:
 *     source: local
 *     triggered-by: nightly-sync
 * </pre>
 *
 * <p>A {@link MetricsService} bean supplied by the application (for example a
 * {@code MicrometerMetricsService} around the container's registry) is picked up;
 * otherwise metrics are not recorded.</p>
 */
@ApplicationScoped
public class ReconciliationProducer {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationProducer.class);

    // ── Identity ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.identity.start-id", defaultValue = "1")
    int startId;

    // ── Execution ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.parallelism", defaultValue = "1")
    int parallelism;

    // ── Sort order ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.sort-order.collections")
    Optional<List<String>> sortOrderCollections;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.sort-order.field", defaultValue = "sort_order")
    String sortOrderField;

    // ── Run metadata ──────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.run.source", defaultValue = "local")
    String source;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.run.triggered-by", defaultValue = "SYSTEM")
    String triggeredBy;

    @Inject
    Instance<MetricsService> metricsServices;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ReconciliationOptions reconciliationOptions() {
        ReconciliationOptions.Builder builder = ReconciliationOptions.builder()
                .startId(startId)
                .parallelism(parallelism)
                .sortOrderField(sortOrderField)
                .source(source)
                .triggeredBy(triggeredBy);
        sortOrderCollections.ifPresent(keys -> keys.stream()
                .map(CollectionType::fromKey)
                .forEach(builder::renumberSortOrder));

        ReconciliationOptions options = builder.build();
        log.info("Reconciliation options: startId={} parallelism={} sortOrderCollections={} source={}",
                options.getStartId(), options.getParallelism(), options.getSortOrderCollections(),
                options.getSource());
        return options;
    }

    @Produces
    @ApplicationScoped
    public AuditService auditService() {
        return new AuditService();
    }

    @Produces
    @ApplicationScoped
    public ReconciliationEngine reconciliationEngine(ReconciliationOptions options, AuditService auditService) {
        MetricsService metrics = resolveMetrics();
        log.info("Producing ReconciliationEngine: metrics={}", metrics.getClass().getSimpleName());
        return new ReconciliationEngine(options, auditService, metrics);
    }

    public void closeEngine(@Disposes ReconciliationEngine engine) {
        log.info("Closing ReconciliationEngine");
        engine.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private MetricsService resolveMetrics() {
        if (metricsServices != null && metricsServices.isResolvable()) {
            return metricsServices.get();
        }
        return new NoOpMetricsService();
    }
}
