package com.catalog.reconciliation.metrics;

import com.catalog.reconciliation.core.model.CollectionType;
import com.catalog.reconciliation.core.model.MergeDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordReconcileDuration(CollectionType.CATEGORIES, true, Duration.ofMillis(100));
                noOp.incrementCreated(CollectionType.CATEGORIES);
                noOp.incrementUpdated(CollectionType.SERVICES);
                noOp.incrementArchived(CollectionType.OFFERS);
                noOp.incrementErrors(CollectionType.RESOURCES);
                noOp.incrementIdReassigned(CollectionType.CATEGORIES);
                noOp.recordFieldDecision(CollectionType.SERVICES, MergeDecision.KEPT_LOCAL);
                noOp.incrementUnresolvedReference(CollectionType.SERVICE_PRACTITIONERS);
                noOp.recordCollectionSize(50);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record reconcile duration as timer per outcome")
        void recordReconcileDuration() {
            metrics.recordReconcileDuration(CollectionType.CATEGORIES, true, Duration.ofMillis(150));
            metrics.recordReconcileDuration(CollectionType.CATEGORIES, true, Duration.ofMillis(250));
            metrics.recordReconcileDuration(CollectionType.CATEGORIES, false, Duration.ofMillis(5));

            Timer success = registry.find("catalog.reconcile.duration")
                    .tag("collection", "categories")
                    .tag("outcome", "success")
                    .timer();
            Timer failed = registry.find("catalog.reconcile.duration")
                    .tag("collection", "categories")
                    .tag("outcome", "failed")
                    .timer();

            assertNotNull(success);
            assertEquals(2, success.count());
            assertNotNull(failed);
            assertEquals(1, failed.count());
        }

        @Test
        @DisplayName("Should count records per collection")
        void recordCounters() {
            metrics.incrementCreated(CollectionType.CATEGORIES);
            metrics.incrementCreated(CollectionType.CATEGORIES);
            metrics.incrementCreated(CollectionType.SERVICES);
            metrics.incrementUpdated(CollectionType.SERVICES);
            metrics.incrementArchived(CollectionType.SERVICES);
            metrics.incrementErrors(CollectionType.OFFERS);

            Counter categoriesCreated = registry.find("catalog.records.created")
                    .tag("collection", "categories")
                    .counter();
            Counter servicesCreated = registry.find("catalog.records.created")
                    .tag("collection", "services")
                    .counter();

            assertNotNull(categoriesCreated);
            assertEquals(2.0, categoriesCreated.count());
            assertNotNull(servicesCreated);
            assertEquals(1.0, servicesCreated.count());
            assertEquals(1.0, registry.find("catalog.records.updated").counter().count());
            assertEquals(1.0, registry.find("catalog.records.archived").counter().count());
            assertEquals(1.0, registry.find("catalog.records.errors").tag("collection", "offers").counter().count());
        }

        @Test
        @DisplayName("Should tag field decisions")
        void fieldDecisions() {
            metrics.recordFieldDecision(CollectionType.SERVICES, MergeDecision.KEPT_LOCAL);
            metrics.recordFieldDecision(CollectionType.SERVICES, MergeDecision.KEPT_LOCAL);
            metrics.recordFieldDecision(CollectionType.SERVICES, MergeDecision.ADOPTED_CANONICAL);

            Counter kept = registry.find("catalog.fields.decision")
                    .tag("decision", "KEPT_LOCAL")
                    .counter();

            assertNotNull(kept);
            assertEquals(2.0, kept.count());
        }

        @Test
        @DisplayName("Should count reassigned identifiers and unresolved references")
        void identityCounters() {
            metrics.incrementIdReassigned(CollectionType.CATEGORIES);
            metrics.incrementUnresolvedReference(CollectionType.SERVICES);

            assertEquals(1.0, registry.find("catalog.ids.reassigned").counter().count());
            assertEquals(1.0, registry.find("catalog.references.unresolved")
                    .tag("collection", "services").counter().count());
        }

        @Test
        @DisplayName("Should record collection sizes")
        void collectionSize() {
            metrics.recordCollectionSize(10);
            metrics.recordCollectionSize(30);

            DistributionSummary summary = registry.find("catalog.collection.size").summary();
            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(40.0, summary.totalAmount());
        }
    }
}
