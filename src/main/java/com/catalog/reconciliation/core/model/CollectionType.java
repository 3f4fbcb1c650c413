package com.catalog.reconciliation.core.model;

import java.util.Locale;

/**
 * Catalog collections handled by the reconciliation engine.
 * Entity collections carry their own identifier space; link collections
 * only reference other collections by foreign key.
 */
public enum CollectionType {
    CATEGORIES("categories", true),
    PRACTITIONERS("practitioners", true),
    SERVICES("services", true),
    RESOURCES("resources", true),
    OFFERS("offers", true),
    SERVICE_PRACTITIONERS("service_practitioners", false),
    SERVICE_RESOURCES("service_resources", false),
    OFFER_SERVICES("offer_services", false);

    private final String key;
    private final boolean entity;

    CollectionType(String key, boolean entity) {
        this.key = key;
        this.entity = entity;
    }

    /**
     * Wire name of the collection, as used in files and reports.
     */
    public String getKey() {
        return key;
    }

    public boolean isEntity() {
        return entity;
    }

    /**
     * Looks up a collection by its wire name or enum name.
     */
    public static CollectionType fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Collection key is required");
        }
        String candidate = key.trim().toLowerCase(Locale.ROOT);
        for (CollectionType type : values()) {
            if (type.key.equals(candidate) || type.name().equalsIgnoreCase(candidate)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown collection: " + key);
    }
}
