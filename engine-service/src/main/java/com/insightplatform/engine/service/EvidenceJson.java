package com.insightplatform.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightplatform.common.exception.EngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evidence maps are stored as JSON text columns.
 */
@Component
public class EvidenceJson {

    private static final Logger log = LoggerFactory.getLogger(EvidenceJson.class);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public EvidenceJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(String stage, Map<String, Object> evidence) {
        try {
            return objectMapper.writeValueAsString(evidence);
        } catch (JsonProcessingException e) {
            throw new EngineException(stage, "Failed to serialize evidence", e);
        }
    }

    /** Unreadable evidence yields an empty map; the row itself is still usable. */
    public Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable evidence JSON, using empty evidence. reason={}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
