package com.catalog.reconciliation.bulk;

import com.catalog.reconciliation.core.model.CatalogRecord;
import com.catalog.reconciliation.core.model.CollectionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonCatalogReaderTest {

    private final JsonCatalogReader reader = new JsonCatalogReader();

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should read an array of records in document order")
    void readCollection() throws Exception {
        String json = """
                [
                  {"id": 1, "name": "Massage", "price_min": 100, "protected_fields": ["price_min"]},
                  {"id": 2, "name_i18n": {"en": "Facial"}, "is_archived": true}
                ]
                """;

        List<Map<String, Object>> records = reader.readCollection(stream(json));

        assertEquals(2, records.size());
        assertEquals(List.of("id", "name", "price_min", "protected_fields"), List.copyOf(records.get(0).keySet()));

        CatalogRecord second = CatalogRecord.fromMap(records.get(1));
        assertEquals("Facial", second.getDisplayName());
        assertTrue(second.isArchived());
    }

    @Test
    @DisplayName("Integral floats should still parse as identifiers")
    void integralFloatIdentifier() throws Exception {
        List<Map<String, Object>> records = reader.readCollection(new StringReader("[{\"id\": 12.0}]"));

        assertEquals(12, CatalogRecord.fromMap(records.get(0)).getId());
    }

    @Test
    @DisplayName("Should read a bundle keyed by collection name and skip unknown names")
    void readBundle() throws Exception {
        String json = """
                {
                  "categories": [{"id": 1, "name": "Body"}],
                  "service_practitioners": [{"service_id": 3, "practitioner_id": 4}],
                  "coupons": [{"id": 9}]
                }
                """;

        Map<CollectionType, List<Map<String, Object>>> bundle = reader.readBundle(stream(json));

        assertEquals(2, bundle.size());
        assertEquals(1, bundle.get(CollectionType.CATEGORIES).size());
        assertEquals(3, bundle.get(CollectionType.SERVICE_PRACTITIONERS).get(0).get("service_id"));
    }

    @Test
    @DisplayName("Should reject input that is not an array of objects")
    void rejectsWrongShape() {
        assertThrows(IOException.class, () -> reader.readCollection(stream("{\"id\": 1}")));
        assertThrows(IOException.class, () -> reader.readCollection(stream("[1, 2]")));
        assertThrows(IOException.class, () -> reader.readBundle(stream("[]")));
    }

    @Test
    @DisplayName("String input should be validated like stream input")
    void stringInputValidatedLikeStream() throws IOException {
        IOException fromString = assertThrows(IOException.class, () -> reader.readCollection("[1, 2]"));
        IOException fromStream = assertThrows(IOException.class, () -> reader.readCollection(stream("[1, 2]")));
        assertEquals(fromStream.getMessage(), fromString.getMessage());

        assertThrows(IOException.class, () -> reader.readCollection("{\"id\": 1}"));
        assertThrows(IOException.class, () -> reader.readCollection("[{\"id\": 1, \"id\": 2}]"));
        assertEquals(List.of(Map.of("id", 1, "name", "Peel")),
                reader.readCollection("[{\"id\": 1, \"name\": \"Peel\"}]"));
    }

    @Test
    @DisplayName("Should reject malformed JSON and duplicate keys")
    void rejectsMalformedJson() {
        assertThrows(IOException.class, () -> reader.readCollection(stream("[{\"id\": 1,")));
        assertThrows(IOException.class, () -> reader.readCollection(stream("[{\"id\": 1, \"id\": 2}]")));
    }
}
