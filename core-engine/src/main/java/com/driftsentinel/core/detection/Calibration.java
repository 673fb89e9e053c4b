package com.driftsentinel.core.detection;

import com.driftsentinel.core.estimator.SlicedDistanceEstimator.ProjectedReference;
import com.driftsentinel.core.model.MultivariateSample;
import com.driftsentinel.core.model.Thresholds;

import java.io.Serializable;
import java.util.Objects;

/**
 * Everything a detector derives from its baseline: the thresholds, the
 * reference sample, the reference's quantile functions along the fixed
 * projection directions, and the seed those directions came from.
 *
 * <p>
 * Immutable. A detector holds exactly one instance and replaces it as a whole
 * on recalibration, so thresholds and reference never disagree.
 * </p>
 *
 * @since 1.0.0
 */
public final class Calibration implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Thresholds thresholds;
    private final MultivariateSample reference;
    private final ProjectedReference projectedReference;
    private final long seed;

    Calibration(Thresholds thresholds, MultivariateSample reference, ProjectedReference projectedReference,
            long seed) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
        this.reference = Objects.requireNonNull(reference, "reference must not be null");
        this.projectedReference = Objects.requireNonNull(projectedReference, "projectedReference must not be null");
        this.seed = seed;
    }

    public Thresholds getThresholds() {
        return thresholds;
    }

    public MultivariateSample getReference() {
        return reference;
    }

    public ProjectedReference getProjectedReference() {
        return projectedReference;
    }

    /**
     * @return seed of the projection directions
     */
    public long getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return "Calibration{" +
                "thresholds=" + thresholds +
                ", reference=" + reference +
                ", seed=" + seed +
                '}';
    }
}
