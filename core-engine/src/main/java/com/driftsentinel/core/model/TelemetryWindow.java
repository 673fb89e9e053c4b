package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * One telemetry record as delivered by the upstream source.
 *
 * <p>
 * Arrives as JSON of the form:
 * </p>
 *
 * <pre>
 * {"stream": "model-a/latency", "values": [..], "features": [[..], ..]}
 * </pre>
 *
 * <p>
 * {@code values} is the univariate window evaluated by the sentinel layer;
 * {@code features} is the optional richer observation for the confirm layer.
 * Unknown JSON properties are ignored.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe; it is a transport object
 * owned by one pipeline stage at a time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelemetryWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Identifier of the monitored metric stream; one detector per stream. */
    private String stream;

    /** Univariate samples, in temporal order. */
    private double[] values;

    /** Optional multivariate observation aligned with {@link #values}. */
    private double[][] features;

    /** Source-side timestamp of the window, if the producer sets one. */
    private Instant timestamp;

    /** Ingestion timestamp (set by the deserializer). */
    private Instant ingestionTime;

    public TelemetryWindow() {
    }

    public TelemetryWindow(String stream, double[] values) {
        this.stream = stream;
        this.values = values;
    }

    /**
     * Convert the raw values into a validated {@link NumericWindow}.
     *
     * @return the univariate window
     * @throws NullPointerException if no values are present
     */
    public NumericWindow toWindow() {
        return NumericWindow.of(Objects.requireNonNull(values, "Telemetry window has no values"));
    }

    /**
     * @return the multivariate observation, if the producer supplied one
     */
    public Optional<MultivariateSample> toObservation() {
        return features == null ? Optional.empty() : Optional.of(MultivariateSample.of(features));
    }

    /**
     * @return the source timestamp if present, else the ingestion time, else now
     */
    @JsonIgnore
    public Instant getEffectiveTime() {
        if (timestamp != null) {
            return timestamp;
        }
        return ingestionTime != null ? ingestionTime : Instant.now();
    }

    public String getStream() {
        return stream;
    }

    public void setStream(String stream) {
        this.stream = stream;
    }

    public double[] getValues() {
        return values;
    }

    public void setValues(double[] values) {
        this.values = values;
    }

    public double[][] getFeatures() {
        return features;
    }

    public void setFeatures(double[][] features) {
        this.features = features;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @JsonIgnore
    public Instant getIngestionTime() {
        return ingestionTime;
    }

    public void setIngestionTime(Instant ingestionTime) {
        this.ingestionTime = ingestionTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TelemetryWindow that))
            return false;
        return Objects.equals(stream, that.stream)
                && Arrays.equals(values, that.values)
                && Arrays.deepEquals(features, that.features)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(stream, timestamp);
        result = 31 * result + Arrays.hashCode(values);
        return 31 * result + Arrays.deepHashCode(features);
    }

    @Override
    public String toString() {
        return "TelemetryWindow{" +
                "stream='" + stream + '\'' +
                ", values=" + (values == null ? 0 : values.length) +
                ", features=" + (features == null ? 0 : features.length) +
                ", timestamp=" + timestamp +
                '}';
    }
}
