package com.catalog.reconciliation.merge;

import com.catalog.reconciliation.core.model.CatalogRecord;
import com.catalog.reconciliation.core.model.FieldDecision;
import com.catalog.reconciliation.core.model.MergeDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OverrideAwareMergerTest {

    private final OverrideAwareMerger merger = new OverrideAwareMerger();

    private static FieldDecision decision(MergeResult result, String field) {
        return result.decisions().stream()
                .filter(d -> d.field().equals(field))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("Protected field keeps the local value")
    void protectedFieldKept() {
        CatalogRecord local = CatalogRecord.builder()
                .id(5).name("Massage").field("price_min", 100).protectedFields("price_min").build();
        CatalogRecord canonical = CatalogRecord.builder()
                .id(12).name("Massage").field("price_min", 150).build();

        MergeResult result = merger.merge(local, canonical);

        assertEquals(100, result.record().get("price_min"));
        FieldDecision decision = decision(result, "price_min");
        assertEquals(MergeDecision.KEPT_LOCAL, decision.decision());
        assertEquals(100, decision.localValue());
        assertEquals(150, decision.canonicalValue());
        assertEquals(List.of("price_min"), result.keptFields());
    }

    @Test
    @DisplayName("Unprotected differing field adopts the canonical value")
    void adoptsCanonical() {
        CatalogRecord local = CatalogRecord.builder().id(5).name("Massage").field("duration", 45).build();
        CatalogRecord canonical = CatalogRecord.builder().id(12).name("Massage").field("duration", 60).build();

        MergeResult result = merger.merge(local, canonical);

        assertEquals(60, result.record().get("duration"));
        assertEquals(MergeDecision.ADOPTED_CANONICAL, decision(result, "duration").decision());
        assertEquals(MergeDecision.UNCHANGED, decision(result, "name").decision());
        assertTrue(result.hasChanges());
        assertEquals(List.of("duration"), result.adoptedFields());
    }

    @Test
    @DisplayName("Local-only fields survive, protected or not")
    void localOnlyFieldsSurvive() {
        CatalogRecord local = CatalogRecord.builder()
                .id(5).name("Massage").field("notes", "front desk").field("internal", true)
                .protectedFields("internal").build();
        CatalogRecord canonical = CatalogRecord.builder().id(12).name("Massage").build();

        MergeResult result = merger.merge(local, canonical);

        assertEquals("front desk", result.record().get("notes"));
        assertEquals(true, result.record().get("internal"));
        assertFalse(result.hasChanges());
    }

    @Test
    @DisplayName("Canonical-only fields are added unless protected")
    void canonicalOnlyFields() {
        CatalogRecord local = CatalogRecord.builder().id(5).name("Massage").protectedFields("image").build();
        CatalogRecord canonical = CatalogRecord.builder()
                .id(12).name("Massage").field("color", "#fff").field("image", "a.png").build();

        MergeResult result = merger.merge(local, canonical);

        assertEquals("#fff", result.record().get("color"));
        assertFalse(result.record().has("image"));
        assertEquals(MergeDecision.KEPT_LOCAL, decision(result, "image").decision());
    }

    @Test
    @DisplayName("Protection list and identifier are left to the caller")
    void protectionAndIdentifierUntouched() {
        CatalogRecord local = CatalogRecord.builder().id(5).name("A").protectedFields("name").build();
        CatalogRecord canonical = CatalogRecord.builder().id(12).name("B").build();

        MergeResult result = merger.merge(local, canonical);

        assertEquals(5, result.record().getId());
        assertEquals(List.of("name"), result.record().getProtectedFields());
        assertEquals("A", result.record().getDisplayName());
    }

    @Test
    @DisplayName("Local record is not modified")
    void localUntouched() {
        CatalogRecord local = CatalogRecord.builder().id(5).name("Massage").field("duration", 45).build();
        CatalogRecord canonical = CatalogRecord.builder().id(12).name("Massage").field("duration", 60).build();

        merger.merge(local, canonical);

        assertEquals(45, local.get("duration"));
    }

    @Nested
    @DisplayName("Value comparison")
    class ValueComparison {

        @Test
        @DisplayName("Numbers compare by value")
        void numbers() {
            assertTrue(OverrideAwareMerger.valuesEqual(100, 100.0));
            assertTrue(OverrideAwareMerger.valuesEqual(100L, new BigDecimal("100.00")));
            assertFalse(OverrideAwareMerger.valuesEqual(100, 100.5));
        }

        @Test
        @DisplayName("Maps and lists compare element-wise")
        void nested() {
            assertTrue(OverrideAwareMerger.valuesEqual(
                    Map.of("en", "Massage", "sort", List.of(1, 2)),
                    Map.of("en", "Massage", "sort", List.of(1.0, 2.0))));
            assertFalse(OverrideAwareMerger.valuesEqual(List.of(1, 2), List.of(2, 1)));
        }

        @Test
        @DisplayName("Null only equals null")
        void nulls() {
            assertTrue(OverrideAwareMerger.valuesEqual(null, null));
            assertFalse(OverrideAwareMerger.valuesEqual(null, 0));
        }
    }
}
