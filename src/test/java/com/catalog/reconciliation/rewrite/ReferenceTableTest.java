package com.catalog.reconciliation.rewrite;

import com.catalog.reconciliation.core.model.CollectionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceTableTest {

    @Test
    @DisplayName("Catalog defaults declare the category, service and link references")
    void catalogDefaults() {
        ReferenceTable table = ReferenceTable.catalogDefaults();

        assertEquals(8, table.size());
        assertEquals(3, table.referencesTo(CollectionType.SERVICES).size());
        assertEquals(2, table.referencesTo(CollectionType.CATEGORIES).size());
        assertEquals(2, table.referencesFrom(CollectionType.OFFER_SERVICES).size());
        assertTrue(table.getForeignKeys().contains(
                new ForeignKey(CollectionType.CATEGORIES, "parent_id", CollectionType.CATEGORIES)));
    }

    @Test
    @DisplayName("Builder ignores duplicate declarations and extends existing tables")
    void builder() {
        ReferenceTable table = ReferenceTable.builder()
                .reference(CollectionType.SERVICES, "category_id", CollectionType.CATEGORIES)
                .reference(CollectionType.SERVICES, "category_id", CollectionType.CATEGORIES)
                .build();
        ReferenceTable extended = ReferenceTable.builder(table)
                .reference(CollectionType.OFFERS, "category_id", CollectionType.CATEGORIES)
                .build();

        assertEquals(1, table.size());
        assertEquals(2, extended.size());
        assertEquals(0, ReferenceTable.empty().size());
    }

    @Test
    @DisplayName("Foreign keys require a field name")
    void foreignKeyValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new ForeignKey(CollectionType.SERVICES, " ", CollectionType.CATEGORIES));
    }
}
