package com.driftsentinel.flink;

import com.driftsentinel.core.config.DetectorConfig;
import com.driftsentinel.core.detection.Calibration;
import com.driftsentinel.core.detection.LayeredDriftDetector;
import com.driftsentinel.core.exception.DriftDetectionException;
import com.driftsentinel.core.model.DetectionResult;
import com.driftsentinel.core.model.DriftAlert;
import com.driftsentinel.core.model.TelemetryWindow;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Flink {@link KeyedProcessFunction} that runs one
 * {@link LayeredDriftDetector} per stream key.
 *
 * <h3>State Management</h3>
 * <p>
 * A {@code ValueState<Integer>} holds each stream's hysteresis counter and
 * nothing else. The detector is rebuilt per window from that counter and the
 * calibration shared by the whole job, so checkpoints stay small and every
 * stream, restored or new, is judged against the same thresholds. Windows of
 * one key are processed one at a time and in arrival order.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * A window that cannot be evaluated (wrong length, non-finite samples,
 * mismatched observation) is logged at WARN, counted, and skipped. It is
 * never reported as "no drift" and leaves the detector state untouched.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftProcessFunction
        extends KeyedProcessFunction<String, TelemetryWindow, DriftAlert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DriftProcessFunction.class);

    private final DetectorConfig config;
    private final Calibration calibration;
    private final boolean emitAllResults;

    /** Flink keyed state holding the per-stream hysteresis counter. */
    private transient ValueState<Integer> hysteresisState;

    private transient DriftMetrics metrics;

    /**
     * @param config         detector configuration the calibration was built with
     * @param calibration    shared baseline calibration
     * @param emitAllResults emit a record for every evaluated window instead of
     *                       only for confirmed drift
     */
    public DriftProcessFunction(DetectorConfig config, Calibration calibration, boolean emitAllResults) {
        this.config = Objects.requireNonNull(config, "DetectorConfig must not be null");
        this.calibration = Objects.requireNonNull(calibration, "Calibration must not be null");
        this.emitAllResults = emitAllResults;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        hysteresisState = getRuntimeContext().getState(hysteresisStateDescriptor());

        metrics = new DriftMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("DriftProcessFunction opened with thresholds {}", calibration.getThresholds());
    }

    @Override
    public void close() {
        LOG.info("DriftProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(TelemetryWindow window,
            KeyedProcessFunction<String, TelemetryWindow, DriftAlert>.Context ctx,
            Collector<DriftAlert> out) throws Exception {
        long startNanos = System.nanoTime();

        LayeredDriftDetector detector = restoreDetector(config, calibration, hysteresisState.value());

        evaluate(detector, ctx.getCurrentKey(), window, emitAllResults, metrics).ifPresent(out::collect);

        hysteresisState.update(detector.getHysteresisCount());

        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }

    static ValueStateDescriptor<Integer> hysteresisStateDescriptor() {
        return new ValueStateDescriptor<>("hysteresis-count", Types.INT);
    }

    /**
     * Rebuild a stream's detector from its stored counter; {@code null} means
     * the stream has not been seen yet.
     */
    static LayeredDriftDetector restoreDetector(DetectorConfig config, Calibration calibration,
            Integer storedCount) {
        return new LayeredDriftDetector(config, calibration, storedCount == null ? 0 : storedCount);
    }

    /**
     * Evaluate one window against the stream's detector.
     *
     * @return the record to publish, if any
     */
    static Optional<DriftAlert> evaluate(LayeredDriftDetector detector, String streamKey, TelemetryWindow window,
            boolean emitAllResults, DriftMetrics metrics) {
        if (window.getValues() == null) {
            metrics.incrementEvaluationErrors();
            LOG.warn("Skipping window without values for stream {}", streamKey);
            return Optional.empty();
        }

        DetectionResult result;
        try {
            result = detector.check(window.toWindow(), window.toObservation().orElse(null));
        } catch (DriftDetectionException e) {
            metrics.incrementEvaluationErrors();
            LOG.warn("Skipping window for stream {}: {}", streamKey, e.getMessage());
            return Optional.empty();
        }

        metrics.recordResult(result);
        if (result.isAlert()) {
            LOG.info("Drift confirmed: stream={} distance={} threshold={}", streamKey,
                    result.getSlicedDistance(), result.getThresholds().getSlicedDistance());
        }
        if (result.isAlert() || emitAllResults) {
            return Optional.of(DriftAlert.of(streamKey, window.getEffectiveTime(), result));
        }
        return Optional.empty();
    }
}
