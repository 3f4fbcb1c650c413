package com.catalog.reconciliation.bulk;

import com.catalog.reconciliation.core.model.CatalogRecord;
import com.catalog.reconciliation.core.model.IdentityMapping;
import com.catalog.reconciliation.ledger.RunReport;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes reconciled collections, identifier mappings and run reports as pretty-printed JSON.
 */
public class JsonCatalogWriter {

    private final ObjectMapper mapper;

    public JsonCatalogWriter() {
        this(new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET));
    }

    public JsonCatalogWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void writeCollection(OutputStream output, List<CatalogRecord> records) throws IOException {
        mapper.writeValue(output, records.stream().map(CatalogRecord::toMap).toList());
    }

    /**
     * Writes the mapping as an object from old to new identifier. JSON keys are strings.
     */
    public void writeMapping(OutputStream output, IdentityMapping mapping) throws IOException {
        mapper.writeValue(output, mappingAsJson(mapping));
    }

    public void writeReport(OutputStream output, RunReport report) throws IOException {
        mapper.writeValue(output, report.toMap());
    }

    public String toJson(List<CatalogRecord> records) throws IOException {
        return mapper.writeValueAsString(records.stream().map(CatalogRecord::toMap).toList());
    }

    public String toJson(RunReport report) throws IOException {
        return mapper.writeValueAsString(report.toMap());
    }

    public String toJson(IdentityMapping mapping) throws IOException {
        return mapper.writeValueAsString(mappingAsJson(mapping));
    }

    private static Map<String, Integer> mappingAsJson(IdentityMapping mapping) {
        Map<String, Integer> json = new LinkedHashMap<>();
        mapping.asMap().forEach((oldId, newId) -> json.put(String.valueOf(oldId), newId));
        return json;
    }
}
