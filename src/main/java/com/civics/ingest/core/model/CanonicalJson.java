package com.civics.ingest.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic JSON rendering of a {@link CanonicalRepresentative}.
 * Two representatives with the same content always render to the same bytes.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    private CanonicalJson() {
    }

    public static String write(CanonicalRepresentative rep) {
        try {
            return MAPPER.writeValueAsString(snapshot(rep));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render representative " + rep.getCanonicalId(), e);
        }
    }

    /**
     * Plain map view used for rendering and audit details.
     */
    public static Map<String, Object> snapshot(CanonicalRepresentative rep) {
        Map<String, Object> fields = new TreeMap<>();
        rep.getFields().forEach((k, v) -> fields.put(k.name(), v));

        Map<String, Object> provenance = new TreeMap<>();
        rep.getFieldProvenance().forEach((k, v) -> provenance.put(k.name(), v));

        Map<String, Object> crosswalk = new TreeMap<>();
        rep.getCrosswalk().forEach((k, v) -> crosswalk.put(k.key(), v));

        Map<String, Object> retired = new TreeMap<>();
        rep.getRetiredCrosswalk().forEach((k, v) -> retired.put(k.key(), v));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("canonicalId", rep.getCanonicalId());
        out.put("createdAt", rep.getCreatedAt());
        out.put("crosswalk", crosswalk);
        out.put("dataQualityScore", rep.getDataQualityScore());
        out.put("fieldProvenance", provenance);
        out.put("fields", fields);
        out.put("replacedById", rep.getReplacedById());
        out.put("retiredCrosswalk", retired);
        out.put("status", rep.getStatus());
        out.put("statusChangedAt", rep.getStatusChangedAt());
        out.put("statusReason", rep.getStatusReason());
        out.put("verificationStatus", rep.getVerificationStatus());
        return out;
    }
}
