package com.catalog.reconciliation.metrics;

import com.catalog.reconciliation.core.model.CollectionType;
import com.catalog.reconciliation.core.model.MergeDecision;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordReconcileDuration(CollectionType type, boolean success, Duration duration) {
    }

    @Override
    public void incrementCreated(CollectionType type) {
    }

    @Override
    public void incrementUpdated(CollectionType type) {
    }

    @Override
    public void incrementArchived(CollectionType type) {
    }

    @Override
    public void incrementErrors(CollectionType type) {
    }

    @Override
    public void incrementIdReassigned(CollectionType type) {
    }

    @Override
    public void recordFieldDecision(CollectionType type, MergeDecision decision) {
    }

    @Override
    public void incrementUnresolvedReference(CollectionType type) {
    }

    @Override
    public void recordCollectionSize(int size) {
    }
}
