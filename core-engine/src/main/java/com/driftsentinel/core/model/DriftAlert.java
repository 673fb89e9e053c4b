package com.driftsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Record handed to the downstream alerting consumer.
 *
 * <p>
 * Carries the stream the window belonged to, when it was evaluated, a
 * one-line summary and the full {@link DetectionResult}. The detector only
 * classifies; paging policy belongs to whoever consumes these records.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #of(String, Instant, DetectionResult)} or the {@link Builder}.
 * {@code streamKey}, {@code timestamp} and {@code result} are required.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftAlert implements Serializable {

    private static final long serialVersionUID = 1L;

    private String streamKey;
    private Instant timestamp;
    private String details;
    private DetectionResult result;

    /** No-arg constructor required by Flink's POJO serializer. */
    public DriftAlert() {
    }

    private DriftAlert(Builder builder) {
        this.streamKey = Objects.requireNonNull(builder.streamKey, "streamKey must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.result = Objects.requireNonNull(builder.result, "result must not be null");
        this.details = builder.details != null ? builder.details : summarize(builder.result);
    }

    /**
     * Build an alert whose details are derived from {@code result}.
     */
    public static DriftAlert of(String streamKey, Instant timestamp, DetectionResult result) {
        return builder().streamKey(streamKey).timestamp(timestamp).result(result).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link DriftAlert} instances.
     */
    public static class Builder {
        private String streamKey;
        private Instant timestamp;
        private String details;
        private DetectionResult result;

        public Builder streamKey(String streamKey) {
            this.streamKey = streamKey;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public Builder result(DetectionResult result) {
            this.result = result;
            return this;
        }

        /**
         * @throws NullPointerException if a required field is missing
         */
        public DriftAlert build() {
            return new DriftAlert(this);
        }
    }

    static String summarize(DetectionResult result) {
        Thresholds t = result.getThresholds();
        String head = result.isAlert() ? "Drift confirmed" : "No drift";
        String distance = result.distance().isPresent()
                ? String.format(Locale.ROOT, "%.4f (threshold %.4f)", result.distance().getAsDouble(),
                        t.getSlicedDistance())
                : "not evaluated";
        return String.format(Locale.ROOT,
                "%s: pe=%.4f (threshold %.4f), hfd=%.4f (threshold %.4f), distance=%s, state=%s",
                head, result.getPermutationEntropy(), t.getPermutationEntropy(),
                result.getFractalDimension(), t.getFractalDimension(), distance, result.getState());
    }

    public String getStreamKey() {
        return streamKey;
    }

    public void setStreamKey(String streamKey) {
        this.streamKey = streamKey;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public DetectionResult getResult() {
        return result;
    }

    public void setResult(DetectionResult result) {
        this.result = result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DriftAlert that))
            return false;
        return Objects.equals(streamKey, that.streamKey)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamKey, timestamp);
    }

    @Override
    public String toString() {
        return "DriftAlert{" +
                "streamKey='" + streamKey + '\'' +
                ", timestamp=" + timestamp +
                ", details='" + details + '\'' +
                '}';
    }
}
