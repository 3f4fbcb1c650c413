package com.catalog.reconciliation.api;

import com.catalog.reconciliation.core.model.CollectionType;
import com.catalog.reconciliation.identity.ConflictResolver;
import com.catalog.reconciliation.rewrite.ReferenceTable;
import com.catalog.reconciliation.rules.NormalizationRule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Options for reconciliation runs.
 * Configures identifier allocation, concurrency, sort-order renumbering and run metadata.
 */
public class ReconciliationOptions {

    private static final int DEFAULT_PARALLELISM = 1;
    private static final String DEFAULT_SORT_ORDER_FIELD = "sort_order";
    private static final String DEFAULT_SOURCE = "local";
    private static final String DEFAULT_TRIGGERED_BY = "SYSTEM";

    private final int startId;
    private final int parallelism;
    private final Set<CollectionType> sortOrderCollections;
    private final String sortOrderField;
    private final String source;
    private final String triggeredBy;
    private final ReferenceTable referenceTable;
    private final List<NormalizationRule> normalizationRules;

    private ReconciliationOptions(Builder builder) {
        this.startId = builder.startId;
        this.parallelism = builder.parallelism;
        this.sortOrderCollections = builder.sortOrderCollections.isEmpty()
                ? Set.of() : Set.copyOf(builder.sortOrderCollections);
        this.sortOrderField = builder.sortOrderField;
        this.source = builder.source;
        this.triggeredBy = builder.triggeredBy;
        this.referenceTable = builder.referenceTable;
        this.normalizationRules = List.copyOf(builder.normalizationRules);
    }

    /**
     * First candidate when filling in or replacing local identifiers.
     */
    public int getStartId() {
        return startId;
    }

    /**
     * Number of collections reconciled concurrently; 1 runs them one after another.
     */
    public int getParallelism() {
        return parallelism;
    }

    public Set<CollectionType> getSortOrderCollections() {
        return sortOrderCollections;
    }

    /**
     * True if the collection's output is sorted by identifier and its sort-order field renumbered.
     */
    public boolean isRenumberSortOrder(CollectionType type) {
        return sortOrderCollections.contains(type);
    }

    public String getSortOrderField() {
        return sortOrderField;
    }

    public String getSource() {
        return source;
    }

    public String getTriggeredBy() {
        return triggeredBy;
    }

    public ReferenceTable getReferenceTable() {
        return referenceTable;
    }

    /**
     * Rules applied on top of the default name normalization.
     */
    public List<NormalizationRule> getNormalizationRules() {
        return normalizationRules;
    }

    /**
     * Creates default options.
     */
    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(ReconciliationOptions options) {
        return new Builder()
                .startId(options.startId)
                .parallelism(options.parallelism)
                .sortOrderCollections(options.sortOrderCollections)
                .sortOrderField(options.sortOrderField)
                .source(options.source)
                .triggeredBy(options.triggeredBy)
                .referenceTable(options.referenceTable)
                .normalizationRules(options.normalizationRules);
    }

    public static class Builder {
        private int startId = ConflictResolver.DEFAULT_START_ID;
        private int parallelism = DEFAULT_PARALLELISM;
        private final Set<CollectionType> sortOrderCollections = EnumSet.noneOf(CollectionType.class);
        private String sortOrderField = DEFAULT_SORT_ORDER_FIELD;
        private String source = DEFAULT_SOURCE;
        private String triggeredBy = DEFAULT_TRIGGERED_BY;
        private ReferenceTable referenceTable = ReferenceTable.catalogDefaults();
        private final List<NormalizationRule> normalizationRules = new ArrayList<>();

        public Builder startId(int startId) {
            if (startId <= 0) {
                throw new IllegalArgumentException("startId must be positive");
            }
            this.startId = startId;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder renumberSortOrder(CollectionType... types) {
            for (CollectionType type : types) {
                requireEntity(type);
                sortOrderCollections.add(type);
            }
            return this;
        }

        public Builder sortOrderCollections(Collection<CollectionType> types) {
            sortOrderCollections.clear();
            types.forEach(this::renumberSortOrder);
            return this;
        }

        public Builder sortOrderField(String sortOrderField) {
            if (sortOrderField == null || sortOrderField.isBlank()) {
                throw new IllegalArgumentException("sortOrderField is required");
            }
            this.sortOrderField = sortOrderField;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder triggeredBy(String triggeredBy) {
            this.triggeredBy = triggeredBy;
            return this;
        }

        public Builder referenceTable(ReferenceTable referenceTable) {
            if (referenceTable == null) {
                throw new IllegalArgumentException("referenceTable is required");
            }
            this.referenceTable = referenceTable;
            return this;
        }

        public Builder normalizationRule(NormalizationRule rule) {
            this.normalizationRules.add(rule);
            return this;
        }

        public Builder normalizationRules(List<NormalizationRule> rules) {
            this.normalizationRules.clear();
            this.normalizationRules.addAll(rules);
            return this;
        }

        public ReconciliationOptions build() {
            return new ReconciliationOptions(this);
        }

        private static void requireEntity(CollectionType type) {
            if (!type.isEntity()) {
                throw new IllegalArgumentException("Sort order is only renumbered for entity collections: " + type);
            }
        }
    }
}
