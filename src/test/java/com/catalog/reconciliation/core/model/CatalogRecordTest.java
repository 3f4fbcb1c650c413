package com.catalog.reconciliation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CatalogRecordTest {

    @Nested
    @DisplayName("Parsing raw records")
    class Parsing {

        @Test
        @DisplayName("Should read identifier, fields and protection list")
        void readsAllParts() throws Exception {
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("id", 7);
            raw.put("name", "Massage");
            raw.put("price_min", 100);
            raw.put("protected_fields", List.of("price_min"));

            CatalogRecord record = CatalogRecord.fromMap(raw);

            assertEquals(7, record.getId());
            assertEquals("Massage", record.getDisplayName());
            assertEquals(100, record.get("price_min"));
            assertTrue(record.isFieldProtected("price_min"));
            assertFalse(record.isFieldProtected("name"));
            assertTrue(record.isOverridden());
            assertFalse(record.has("id"), "identifier is not kept among the fields");
            assertFalse(record.has("protected_fields"));
        }

        @Test
        @DisplayName("Should accept a missing identifier")
        void missingIdentifier() throws Exception {
            CatalogRecord record = CatalogRecord.fromMap(Map.of("name", "Facial"));

            assertFalse(record.hasId());
            assertNull(record.getId());
        }

        @Test
        @DisplayName("Should accept integral numbers of any width within int range")
        void integralIdentifiers() throws Exception {
            assertEquals(3, CatalogRecord.fromMap(Map.of("id", 3L)).getId());
            assertEquals(4, CatalogRecord.fromMap(Map.of("id", 4.0)).getId());
            assertEquals(5, CatalogRecord.fromMap(Map.of("id", BigInteger.valueOf(5))).getId());
        }

        @Test
        @DisplayName("Should reject a non-integral identifier")
        void rejectsFractionalIdentifier() {
            MalformedRecordException e = assertThrows(MalformedRecordException.class,
                    () -> CatalogRecord.fromMap(Map.of("id", 1.5, "name", "X")));
            assertNotNull(e.getRawRecord());
        }

        @Test
        @DisplayName("Should reject a string identifier")
        void rejectsStringIdentifier() {
            assertThrows(MalformedRecordException.class,
                    () -> CatalogRecord.fromMap(Map.of("id", "12")));
        }

        @Test
        @DisplayName("Should reject an identifier outside int range")
        void rejectsHugeIdentifier() {
            assertThrows(MalformedRecordException.class,
                    () -> CatalogRecord.fromMap(Map.of("id", 1L + Integer.MAX_VALUE)));
        }

        @Test
        @DisplayName("Should reject a name that is not a string")
        void rejectsNonStringName() {
            assertThrows(MalformedRecordException.class,
                    () -> CatalogRecord.fromMap(Map.of("id", 1, "name", 42)));
        }

        @Test
        @DisplayName("Should reject name_i18n that is not an object")
        void rejectsNonObjectTranslations() {
            assertThrows(MalformedRecordException.class,
                    () -> CatalogRecord.fromMap(Map.of("id", 1, "name_i18n", "Massage")));
        }

        @Test
        @DisplayName("Should reject a protection list with non-string entries")
        void rejectsBadProtectionList() {
            assertThrows(MalformedRecordException.class,
                    () -> CatalogRecord.fromMap(Map.of("id", 1, "protected_fields", List.of(1, 2))));
            assertThrows(MalformedRecordException.class,
                    () -> CatalogRecord.fromMap(Map.of("id", 1, "protected_fields", "price")));
        }

        @Test
        @DisplayName("Should reject a null record")
        void rejectsNull() {
            assertThrows(MalformedRecordException.class, () -> CatalogRecord.fromMap(null));
        }

        @Test
        @DisplayName("Should fall back to the legacy overridden_fields key")
        void legacyProtectionKey() throws Exception {
            CatalogRecord record = CatalogRecord.fromMap(Map.of(
                    "id", 1, "overridden_fields", List.of("description")));

            assertTrue(record.isFieldProtected("description"));
            assertEquals(List.of("description"), record.toMap().get("overridden_fields"));
            assertFalse(record.toMap().containsKey("protected_fields"));
        }

        @Test
        @DisplayName("Should treat a null protection list as empty")
        void nullProtectionList() throws Exception {
            Map<String, Object> raw = new HashMap<>();
            raw.put("id", 1);
            raw.put("protected_fields", null);

            CatalogRecord record = CatalogRecord.fromMap(raw);

            assertFalse(record.isOverridden());
        }
    }

    @Nested
    @DisplayName("Display name")
    class DisplayNames {

        @Test
        @DisplayName("Should prefer the English translation")
        void prefersEnglish() throws Exception {
            CatalogRecord record = CatalogRecord.fromMap(Map.of(
                    "id", 1, "name", "Massage", "name_i18n", Map.of("en", "Massage Therapy", "fr", "Massothérapie")));

            assertEquals("Massage Therapy", record.getDisplayName());
        }

        @Test
        @DisplayName("Should fall back to name when the translation is blank")
        void blankTranslation() throws Exception {
            CatalogRecord record = CatalogRecord.fromMap(Map.of(
                    "id", 1, "name", "Massage", "name_i18n", Map.of("en", "  ")));

            assertEquals("Massage", record.getDisplayName());
        }

        @Test
        @DisplayName("Should yield empty string when there is no name")
        void noName() throws Exception {
            assertEquals("", CatalogRecord.fromMap(Map.of("id", 1)).getDisplayName());
        }
    }

    @Test
    @DisplayName("Copies should leave the original untouched")
    void copyOnWrite() {
        CatalogRecord original = CatalogRecord.builder().id(1).name("Massage").build();

        CatalogRecord renamed = original.withField("name", "Facial");
        CatalogRecord renumbered = original.withId(9);

        assertEquals("Massage", original.getDisplayName());
        assertEquals("Facial", renamed.getDisplayName());
        assertEquals(1, renamed.getId());
        assertEquals(9, renumbered.getId());
        assertNotEquals(original, renumbered);
    }

    @Test
    @DisplayName("Fields should be unmodifiable")
    void fieldsUnmodifiable() {
        CatalogRecord record = CatalogRecord.builder().id(1).name("Massage").build();

        assertThrows(UnsupportedOperationException.class, () -> record.getFields().put("x", 1));
    }

    @Test
    @DisplayName("Nested maps and lists should not be shared with the raw input or toMap output")
    @SuppressWarnings("unchecked")
    void nestedValuesCopied() throws MalformedRecordException {
        Map<String, Object> translations = new HashMap<>();
        translations.put("en", "Massage");
        List<Object> tags = new ArrayList<>(List.of("relax"));
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("id", 1);
        raw.put("name_i18n", translations);
        raw.put("tags", tags);

        CatalogRecord record = CatalogRecord.fromMap(raw);
        translations.put("en", "Changed");
        tags.add("changed");

        assertEquals("Massage", record.getDisplayName());
        assertEquals(List.of("relax"), record.get("tags"));
        assertThrows(UnsupportedOperationException.class,
                () -> ((Map<String, Object>) record.get("name_i18n")).put("en", "Other"));

        Map<String, Object> out = record.toMap();
        ((Map<String, Object>) out.get("name_i18n")).put("en", "Other");
        ((List<Object>) out.get("tags")).add("other");

        assertEquals("Massage", record.getDisplayName());
        assertEquals(List.of("relax"), record.get("tags"));
    }

    @Test
    @DisplayName("toMap should write identifier first and keep field order")
    void toMapOrder() {
        CatalogRecord record = CatalogRecord.builder()
                .id(3)
                .field("name", "Massage")
                .field("duration", 60)
                .protectedFields("duration")
                .build();

        Map<String, Object> map = record.toMap();

        assertEquals(List.of("id", "name", "duration", "protected_fields"), List.copyOf(map.keySet()));
        assertEquals(3, map.get("id"));
    }

    @Test
    @DisplayName("isArchived should read is_archived")
    void archived() {
        assertTrue(CatalogRecord.builder().id(1).field("is_archived", true).build().isArchived());
        assertFalse(CatalogRecord.builder().id(1).field("is_archived", false).build().isArchived());
        assertFalse(CatalogRecord.builder().id(1).build().isArchived());
    }
}
