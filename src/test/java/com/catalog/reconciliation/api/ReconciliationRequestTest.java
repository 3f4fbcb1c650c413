package com.catalog.reconciliation.api;

import com.catalog.reconciliation.core.model.CollectionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationRequestTest {

    private static final List<Map<String, Object>> RECORDS = List.of(Map.of("id", 1, "name", "A"));

    @Test
    @DisplayName("Canonical data is optional per collection")
    void canonicalOptional() {
        ReconciliationRequest request = ReconciliationRequest.builder()
                .collection(CollectionType.CATEGORIES, RECORDS, RECORDS)
                .collection(CollectionType.PRACTITIONERS, RECORDS)
                .build();

        assertTrue(request.getCanonical(CollectionType.CATEGORIES).isPresent());
        assertTrue(request.getCanonical(CollectionType.PRACTITIONERS).isEmpty());
        assertEquals(2, request.getLocals().size());
    }

    @Test
    @DisplayName("Link collections can only be dependents")
    void linkCollections() {
        assertThrows(IllegalArgumentException.class, () -> ReconciliationRequest.builder()
                .collection(CollectionType.SERVICE_PRACTITIONERS, RECORDS));

        ReconciliationRequest request = ReconciliationRequest.builder()
                .dependent(CollectionType.SERVICE_PRACTITIONERS, List.of(Map.of("service_id", 1)))
                .build();
        assertEquals(1, request.getDependents().size());
        assertFalse(request.isEmpty());
    }

    @Test
    @DisplayName("A collection cannot be both reconciled and dependent")
    void noOverlap() {
        ReconciliationRequest.Builder builder = ReconciliationRequest.builder()
                .collection(CollectionType.SERVICES, RECORDS);

        assertThrows(IllegalArgumentException.class, () -> builder.dependent(CollectionType.SERVICES, RECORDS));
    }

    @Test
    @DisplayName("Empty request")
    void empty() {
        assertTrue(ReconciliationRequest.builder().build().isEmpty());
    }
}
