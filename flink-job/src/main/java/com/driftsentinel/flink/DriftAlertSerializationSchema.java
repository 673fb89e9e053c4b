package com.driftsentinel.flink;

import com.driftsentinel.core.model.DriftAlert;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts a {@link DriftAlert} into
 * JSON bytes for the Kafka alerts topic.
 */
public class DriftAlertSerializationSchema implements SerializationSchema<DriftAlert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DriftAlertSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(DriftAlert alert) {
        try {
            return objectMapper().writeValueAsBytes(alert);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize drift alert for stream {}: {}", alert.getStreamKey(), e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
