package com.catalog.reconciliation.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A catalog record: an opaque field map plus an integer identifier and the
 * list of manually curated fields that synchronization must not overwrite.
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies.
 * Nested maps and lists are copied on the way in and out, so a record never shares
 * structure with its raw input, another record or a serialized map.
 * Field order from the raw input is preserved.</p>
 */
public final class CatalogRecord {

    public static final String ID_FIELD = "id";
    public static final String NAME_FIELD = "name";
    public static final String NAME_I18N_FIELD = "name_i18n";
    public static final String ARCHIVED_FIELD = "is_archived";
    public static final String PROTECTED_FIELDS = "protected_fields";
    public static final String LEGACY_PROTECTED_FIELDS = "overridden_fields";

    private static final String DEFAULT_LANGUAGE = "en";

    private final Integer id;
    private final Map<String, Object> fields;
    private final List<String> protectedFields;
    private final String protectionKey;

    private CatalogRecord(Builder builder) {
        this.id = builder.id;
        Map<String, Object> copy = new LinkedHashMap<>();
        builder.fields.forEach((name, value) -> copy.put(name, freeze(value)));
        this.fields = Collections.unmodifiableMap(copy);
        this.protectedFields = List.copyOf(builder.protectedFields);
        this.protectionKey = builder.protectionKey;
    }

    /**
     * Parses a raw field map into a record.
     *
     * @throws MalformedRecordException if the identifier, name or protection list has the wrong shape
     */
    public static CatalogRecord fromMap(Map<String, ?> raw) throws MalformedRecordException {
        if (raw == null) {
            throw new MalformedRecordException("Record is null", null);
        }

        Builder builder = builder();
        Object rawId = raw.get(ID_FIELD);
        if (rawId != null) {
            Integer id = Identifiers.toIdentifier(rawId);
            if (id == null) {
                throw new MalformedRecordException("Identifier is not an integer: " + rawId, raw);
            }
            builder.id(id);
        }

        String protectionKey = raw.containsKey(PROTECTED_FIELDS) ? PROTECTED_FIELDS
                : raw.containsKey(LEGACY_PROTECTED_FIELDS) ? LEGACY_PROTECTED_FIELDS
                : null;
        if (protectionKey != null) {
            builder.protectedFields(parseProtectedFields(raw.get(protectionKey), raw));
            builder.protectionKey(protectionKey);
        }

        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            String key = entry.getKey();
            if (ID_FIELD.equals(key) || PROTECTED_FIELDS.equals(key) || LEGACY_PROTECTED_FIELDS.equals(key)) {
                continue;
            }
            builder.field(key, entry.getValue());
        }

        CatalogRecord record = builder.build();
        validateName(record, raw);
        return record;
    }

    private static List<String> parseProtectedFields(Object value, Map<String, ?> raw)
            throws MalformedRecordException {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new MalformedRecordException("Protected fields must be a list", raw);
        }
        List<String> names = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof String name)) {
                throw new MalformedRecordException("Protected field name is not a string: " + item, raw);
            }
            names.add(name);
        }
        return names;
    }

    private static void validateName(CatalogRecord record, Map<String, ?> raw) throws MalformedRecordException {
        Object name = record.fields.get(NAME_FIELD);
        if (name != null && !(name instanceof String)) {
            throw new MalformedRecordException("Name is not a string: " + name, raw);
        }
        Object i18n = record.fields.get(NAME_I18N_FIELD);
        if (i18n == null) {
            return;
        }
        if (!(i18n instanceof Map<?, ?> translations)) {
            throw new MalformedRecordException("name_i18n is not an object", raw);
        }
        Object english = translations.get(DEFAULT_LANGUAGE);
        if (english != null && !(english instanceof String)) {
            throw new MalformedRecordException("name_i18n.en is not a string: " + english, raw);
        }
    }

    public Integer getId() {
        return id;
    }

    public boolean hasId() {
        return id != null;
    }

    /**
     * All non-identifier fields, in input order (unmodifiable).
     */
    public Map<String, Object> getFields() {
        return fields;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public List<String> getProtectedFields() {
        return protectedFields;
    }

    public boolean isFieldProtected(String field) {
        return protectedFields.contains(field);
    }

    /**
     * True if any field has been manually overridden.
     */
    public boolean isOverridden() {
        return !protectedFields.isEmpty();
    }

    public boolean isArchived() {
        return Boolean.TRUE.equals(fields.get(ARCHIVED_FIELD));
    }

    /**
     * Display name: the English translation when present and non-blank, otherwise {@code name}.
     * Never null.
     */
    public String getDisplayName() {
        if (fields.get(NAME_I18N_FIELD) instanceof Map<?, ?> translations
                && translations.get(DEFAULT_LANGUAGE) instanceof String english
                && !english.isBlank()) {
            return english;
        }
        return fields.get(NAME_FIELD) instanceof String name ? name : "";
    }

    public CatalogRecord withId(Integer newId) {
        return builder(this).id(newId).build();
    }

    public CatalogRecord withField(String field, Object value) {
        return builder(this).field(field, value).build();
    }

    /**
     * Serializes back to a raw map: identifier first, then fields, then the protection list
     * under the key it was read from.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(ID_FIELD, id);
        fields.forEach((name, value) -> map.put(name, thaw(value)));
        if (protectionKey != null || !protectedFields.isEmpty()) {
            map.put(protectionKey != null ? protectionKey : PROTECTED_FIELDS, new ArrayList<>(protectedFields));
        }
        return map;
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, freeze(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(nested -> copy.add(freeze(nested)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static Object thaw(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, thaw(nested)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(nested -> copy.add(thaw(nested)));
            return copy;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CatalogRecord that = (CatalogRecord) o;
        return Objects.equals(id, that.id)
                && fields.equals(that.fields)
                && protectedFields.equals(that.protectedFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fields, protectedFields);
    }

    @Override
    public String toString() {
        return "CatalogRecord{" +
                "id=" + id +
                ", name='" + getDisplayName() + '\'' +
                ", fields=" + fields.size() +
                ", protectedFields=" + protectedFields +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(CatalogRecord record) {
        return new Builder()
                .id(record.id)
                .fields(record.fields)
                .protectedFields(record.protectedFields)
                .protectionKey(record.protectionKey);
    }

    public static class Builder {
        private Integer id;
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private List<String> protectedFields = List.of();
        private String protectionKey;

        public Builder id(Integer id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            return field(NAME_FIELD, name);
        }

        public Builder field(String name, Object value) {
            Objects.requireNonNull(name, "field name is required");
            this.fields.put(name, value);
            return this;
        }

        public Builder fields(Map<String, ?> fields) {
            fields.forEach(this::field);
            return this;
        }

        public Builder protectedFields(List<String> protectedFields) {
            this.protectedFields = protectedFields != null ? protectedFields : List.of();
            return this;
        }

        public Builder protectedFields(String... protectedFields) {
            return protectedFields(List.of(protectedFields));
        }

        Builder protectionKey(String protectionKey) {
            this.protectionKey = protectionKey;
            return this;
        }

        public CatalogRecord build() {
            return new CatalogRecord(this);
        }
    }
}
