package com.driftsentinel.flink;

import com.driftsentinel.core.model.TelemetryWindow;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes into a
 * {@link TelemetryWindow}.
 * <p>
 * Malformed messages are logged and dropped (returns {@code null}), so a
 * single bad record does not crash the pipeline.
 * </p>
 */
public class TelemetryWindowDeserializationSchema implements DeserializationSchema<TelemetryWindow> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TelemetryWindowDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public TelemetryWindow deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            TelemetryWindow window = objectMapper().readValue(message, TelemetryWindow.class);
            window.setIngestionTime(Instant.now());
            return window;
        } catch (IOException e) {
            LOG.warn("Failed to deserialize telemetry window, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(TelemetryWindow nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<TelemetryWindow> getProducedType() {
        return TypeInformation.of(TelemetryWindow.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            // A null sample must drop the record, not read as 0.0
            mapper.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
        }
        return mapper;
    }
}
