package com.property.reconciliation.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.property.reconciliation.core.model.CanonicalEntity;

import java.util.Map;

/**
 * Converts canonical entities into the plain field maps stored as the
 * before/after images of audit entries. Dates are written as ISO strings,
 * null fields are left out.
 */
public class AuditSnapshots {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public AuditSnapshots() {
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(MapperFeature.AUTO_DETECT_IS_GETTERS)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }

    public Map<String, Object> snapshot(CanonicalEntity entity) {
        if (entity == null) {
            return null;
        }
        return objectMapper.convertValue(entity, MAP_TYPE);
    }
}
