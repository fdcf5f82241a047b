package com.healthrevo.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Writes the JSON text stored in the metadata, drivers, medications and flags columns.
 */
@Component
public class JsonColumns {

    private final ObjectMapper objectMapper;

    public JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Value is not serializable to a JSON column: " + value.getClass().getSimpleName(), e);
        }
    }
}
