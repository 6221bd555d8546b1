package com.umitunal.dummyllm.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;

/**
 * Jackson codec for request payloads and canonical echo text.
 *
 * Canonical form is compact JSON: no insignificant whitespace, object keys in
 * insertion order, array order preserved and non-ASCII characters written as-is.
 */
public class JsonCodec {
    private final ObjectMapper mapper;

    public JsonCodec() {
        this(createDefaultMapper());
    }

    public JsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Encode a tree to its canonical string form.
     */
    public String canonical(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (IOException e) {
            throw new JsonCodecException("Failed to serialize to JSON", e);
        }
    }

    /**
     * Parse a JSON document into a tree.
     */
    public JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (IOException e) {
            throw new JsonCodecException("Failed to parse JSON", e);
        }
    }

    /**
     * Bind a JSON document to a type.
     */
    public <T> T decode(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (IOException e) {
            throw new JsonCodecException("Failed to deserialize from JSON", e);
        }
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * Unchecked wrapper for Jackson I/O failures.
     */
    public static class JsonCodecException extends RuntimeException {
        public JsonCodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
