package com.fastalert.core.serializer;

import com.fastalert.core.spi.PayloadSerializer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Optional;

public class JacksonPayloadSerializer implements PayloadSerializer {

    private final ObjectMapper mapper;

    public JacksonPayloadSerializer() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                // 时间按 ISO-8601 输出
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    public JacksonPayloadSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String toJson(Object body) {
        if (body == null) {
            return "{}";
        }
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write channel body as JSON", e);
        }
    }

    @Override
    public Optional<String> readText(String json, String... fields) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Provider response is not JSON", e);
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        for (String f : fields) {
            JsonNode v = root.get(f);
            if (v != null && !v.isNull() && v.isValueNode()) {
                return Optional.of(v.asText());
            }
        }
        return Optional.empty();
    }
}
