package com.catalog.reconciliation.rewrite;

import com.catalog.reconciliation.core.model.CollectionType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative table of which record fields reference which collections.
 * Drives the cascading rewrite after identifiers are remapped.
 */
public final class ReferenceTable {

    private final List<ForeignKey> foreignKeys;

    private ReferenceTable(List<ForeignKey> foreignKeys) {
        this.foreignKeys = List.copyOf(foreignKeys);
    }

    /**
     * Foreign keys of the clinic catalog: category hierarchy, services in categories,
     * and the service/practitioner, service/resource and offer/service link collections.
     */
    public static ReferenceTable catalogDefaults() {
        return builder()
                .reference(CollectionType.CATEGORIES, "parent_id", CollectionType.CATEGORIES)
                .reference(CollectionType.SERVICES, "category_id", CollectionType.CATEGORIES)
                .reference(CollectionType.SERVICE_PRACTITIONERS, "service_id", CollectionType.SERVICES)
                .reference(CollectionType.SERVICE_PRACTITIONERS, "practitioner_id", CollectionType.PRACTITIONERS)
                .reference(CollectionType.SERVICE_RESOURCES, "service_id", CollectionType.SERVICES)
                .reference(CollectionType.SERVICE_RESOURCES, "resource_id", CollectionType.RESOURCES)
                .reference(CollectionType.OFFER_SERVICES, "offer_id", CollectionType.OFFERS)
                .reference(CollectionType.OFFER_SERVICES, "service_id", CollectionType.SERVICES)
                .build();
    }

    public static ReferenceTable empty() {
        return new ReferenceTable(List.of());
    }

    public List<ForeignKey> getForeignKeys() {
        return foreignKeys;
    }

    /**
     * Foreign keys declared on records of the given collection.
     */
    public List<ForeignKey> referencesFrom(CollectionType source) {
        return foreignKeys.stream().filter(fk -> fk.source() == source).toList();
    }

    /**
     * Foreign keys pointing at the given collection.
     */
    public List<ForeignKey> referencesTo(CollectionType target) {
        return foreignKeys.stream().filter(fk -> fk.target() == target).toList();
    }

    public int size() {
        return foreignKeys.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(ReferenceTable table) {
        Builder builder = new Builder();
        table.foreignKeys.forEach(builder::reference);
        return builder;
    }

    public static class Builder {
        private final Set<ForeignKey> foreignKeys = new LinkedHashSet<>();

        public Builder reference(CollectionType source, String field, CollectionType target) {
            return reference(new ForeignKey(source, field, target));
        }

        public Builder reference(ForeignKey foreignKey) {
            foreignKeys.add(foreignKey);
            return this;
        }

        public ReferenceTable build() {
            return new ReferenceTable(new ArrayList<>(foreignKeys));
        }
    }
}
