package com.meshsentinel.monitor.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.meshsentinel.core.model.Anomaly;

import java.util.List;

/**
 * Pretty-printed JSON array of anomalies with ISO-8601 timestamps.
 *
 * @since 1.0.0
 */
public class JsonRenderer implements AnomalyRenderer {

    private final ObjectMapper mapper;

    public JsonRenderer() {
        this.mapper = newObjectMapper();
    }

    @Override
    public String render(List<Anomaly> anomalies) {
        try {
            return mapper.writeValueAsString(anomalies) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render anomalies as JSON: " + e.getMessage(), e);
        }
    }

    /**
     * @return a mapper that writes {@code java.time} values as ISO-8601 strings
     */
    static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        return mapper;
    }
}
