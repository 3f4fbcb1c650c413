package com.catalog.reconciliation.metrics;

import com.catalog.reconciliation.core.model.CollectionType;
import com.catalog.reconciliation.core.model.MergeDecision;

import java.time.Duration;

/**
 * Interface for recording reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordReconcileDuration(CollectionType type, boolean success, Duration duration);

    void incrementCreated(CollectionType type);

    void incrementUpdated(CollectionType type);

    void incrementArchived(CollectionType type);

    void incrementErrors(CollectionType type);

    void incrementIdReassigned(CollectionType type);

    void recordFieldDecision(CollectionType type, MergeDecision decision);

    void incrementUnresolvedReference(CollectionType type);

    void recordCollectionSize(int size);
}
