package com.catalog.reconciliation.bulk;

import com.catalog.reconciliation.core.model.CollectionType;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads catalog collections from JSON.
 *
 * <p>A collection file is a JSON array of objects:</p>
 * <pre>
 * [
 *   {"id": 1, "name": "Massage", "protected_fields": ["price"]},
 *   {"id": 2, "name_i18n": {"en": "Facial"}}
 * ]
 * </pre>
 *
 * <p>A bundle file is an object keyed by collection name, each value a collection array.
 * Unknown collection names are skipped with a warning.</p>
 *
 * <p>Records are returned as raw maps in document order; validation happens when the
 * engine parses them into {@link com.catalog.reconciliation.core.model.CatalogRecord}s.</p>
 */
public class JsonCatalogReader {
    private static final Logger log = LoggerFactory.getLogger(JsonCatalogReader.class);

    private final ObjectMapper mapper;

    public JsonCatalogReader() {
        this(new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION));
    }

    public JsonCatalogReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Reads one collection (a JSON array of objects).
     *
     * @throws IOException if the input is not valid JSON or not an array of objects
     */
    public List<Map<String, Object>> readCollection(InputStream input) throws IOException {
        return toRecords(mapper.readTree(input));
    }

    public List<Map<String, Object>> readCollection(Reader reader) throws IOException {
        return toRecords(mapper.readTree(reader));
    }

    /**
     * Reads a bundle of collections (a JSON object keyed by collection name).
     */
    public Map<CollectionType, List<Map<String, Object>>> readBundle(InputStream input) throws IOException {
        JsonNode root = mapper.readTree(input);
        if (root == null || !root.isObject()) {
            throw new IOException("Expected a JSON object keyed by collection name");
        }
        Map<CollectionType, List<Map<String, Object>>> bundle = new EnumMap<>(CollectionType.class);
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            CollectionType type;
            try {
                type = CollectionType.fromKey(field.getKey());
            } catch (IllegalArgumentException e) {
                log.warn("read.unknown-collection name='{}'", field.getKey());
                continue;
            }
            bundle.put(type, toRecords(field.getValue()));
        }
        log.info("read.bundle collections={}", bundle.keySet());
        return bundle;
    }

    private List<Map<String, Object>> toRecords(JsonNode node) throws IOException {
        if (node == null || !node.isArray()) {
            throw new IOException("Expected a JSON array of records");
        }
        List<Map<String, Object>> records = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isObject()) {
                throw new IOException("Expected a JSON object, found " + element.getNodeType());
            }
            records.add(mapper.convertValue(element, new TypeReference<LinkedHashMap<String, Object>>() {}));
        }
        log.debug("read.collection records={}", records.size());
        return records;
    }

    /**
     * Parses a JSON array string. Convenience for tests and small inputs.
     */
    public List<Map<String, Object>> readCollection(String json) throws IOException {
        return toRecords(mapper.readTree(json));
    }
}
