package com.catalog.reconciliation.matching;

import com.catalog.reconciliation.core.model.CatalogRecord;
import com.catalog.reconciliation.rules.NameNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalIndexTest {

    private final NameNormalizer normalizer = NameNormalizer.createDefault();

    private static CatalogRecord record(int id, String name) {
        return CatalogRecord.builder().id(id).name(name).build();
    }

    @Test
    @DisplayName("Should find records by normalized name")
    void findByNormalizedName() {
        CanonicalIndex index = CanonicalIndex.build(List.of(record(12, "Massage   Therapy")), normalizer);

        assertEquals(12, index.find("massage therapy").orElseThrow().getId());
        assertTrue(index.find("facial").isEmpty());
    }

    @Test
    @DisplayName("Last record wins when names collide, and the collision is reported")
    void lastWins() {
        CanonicalIndex index = CanonicalIndex.build(List.of(
                record(3, "Facial"),
                record(8, "FACIAL!")), normalizer);

        assertEquals(8, index.find("facial").orElseThrow().getId());
        assertEquals(1, index.ambiguousNames().size());
        CanonicalIndex.AmbiguousName ambiguous = index.ambiguousNames().get(0);
        assertEquals(3, ambiguous.displacedId());
        assertEquals(8, ambiguous.winningId());
        assertEquals("facial", ambiguous.normalizedName());
    }

    @Test
    @DisplayName("Unnamed records are not indexed but count towards maxId")
    void unnamedRecords() {
        CanonicalIndex index = CanonicalIndex.build(List.of(
                record(4, "Facial"),
                CatalogRecord.builder().id(40).field("description", "no name").build()), normalizer);

        assertEquals(40, index.maxId());
        assertEquals(1, index.indexedNames());
        assertEquals(2, index.size());
        assertTrue(index.ids().contains(40));
        assertTrue(index.find("").isEmpty());
    }

    @Test
    @DisplayName("Should index by English translation when present")
    void translatedName() {
        CanonicalIndex index = CanonicalIndex.build(List.of(
                CatalogRecord.builder().id(2).field("name_i18n", Map.of("en", "Body Scrub")).build()), normalizer);

        assertTrue(index.find("body scrub").isPresent());
    }

    @Test
    @DisplayName("Empty index has maxId 0")
    void empty() {
        assertEquals(0, CanonicalIndex.empty().maxId());
        assertEquals(0, CanonicalIndex.build(List.of(), normalizer).size());
    }
}
