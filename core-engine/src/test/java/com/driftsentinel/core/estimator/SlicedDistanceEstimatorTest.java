package com.driftsentinel.core.estimator;

import com.driftsentinel.core.estimator.SlicedDistanceEstimator.ProjectedReference;
import com.driftsentinel.core.exception.DimensionMismatchException;
import com.driftsentinel.core.exception.InvalidParametersException;
import com.driftsentinel.core.model.MultivariateSample;
import com.driftsentinel.core.support.TestSignals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SlicedDistanceEstimator}.
 */
class SlicedDistanceEstimatorTest {

    private static final int PROJECTIONS = 50;
    private static final int QUANTILES = 64;

    @Test
    @DisplayName("Distance of a sample to itself is zero")
    void selfDistanceIsZero() {
        MultivariateSample sample = TestSignals.gaussianRows(300, 3, 0.0, 1);

        assertThat(SlicedDistanceEstimator.slicedDistance(sample, sample, PROJECTIONS, QUANTILES, 2, 42L))
                .isCloseTo(0.0, within(1e-12));
    }

    @Test
    @DisplayName("Distance is symmetric for a fixed seed")
    void isSymmetric() {
        MultivariateSample x = TestSignals.gaussianRows(200, 3, 0.0, 1);
        MultivariateSample y = TestSignals.gaussianRows(250, 3, 0.5, 2);

        double xy = SlicedDistanceEstimator.slicedDistance(x, y, PROJECTIONS, QUANTILES, 2, 7L);
        double yx = SlicedDistanceEstimator.slicedDistance(y, x, PROJECTIONS, QUANTILES, 2, 7L);

        assertThat(xy).isCloseTo(yx, within(1e-12));
    }

    @Test
    @DisplayName("Same seed gives a bit-identical estimate")
    void sameSeedIsReproducible() {
        MultivariateSample x = TestSignals.gaussianRows(200, 4, 0.0, 1);
        MultivariateSample y = TestSignals.gaussianRows(200, 4, 1.0, 2);

        assertThat(SlicedDistanceEstimator.slicedDistance(x, y, PROJECTIONS, QUANTILES, 2, 99L))
                .isEqualTo(SlicedDistanceEstimator.slicedDistance(x, y, PROJECTIONS, QUANTILES, 2, 99L));
    }

    @Test
    @DisplayName("Different seeds project onto different directions")
    void differentSeedsDiffer() {
        MultivariateSample x = TestSignals.gaussianRows(200, 4, 0.0, 1);
        MultivariateSample y = TestSignals.gaussianRows(200, 4, 1.0, 2);

        assertThat(SlicedDistanceEstimator.slicedDistance(x, y, PROJECTIONS, QUANTILES, 2, 1L))
                .isNotEqualTo(SlicedDistanceEstimator.slicedDistance(x, y, PROJECTIONS, QUANTILES, 2, 2L));
    }

    @Test
    @DisplayName("One-dimensional shift equals the shift size")
    void univariateShiftIsRecovered() {
        double[] base = TestSignals.gaussian(500, 3);
        double[] shifted = new double[base.length];
        for (int i = 0; i < base.length; i++) {
            shifted[i] = base[i] + 3.0;
        }

        double distance = SlicedDistanceEstimator.slicedDistance(MultivariateSample.ofColumn(shifted),
                MultivariateSample.ofColumn(base), 10, QUANTILES, 2, 5L);

        assertThat(distance).isCloseTo(3.0, within(1e-9));
    }

    @Test
    @DisplayName("Single-row samples have a constant quantile function")
    void singleRowSamples() {
        MultivariateSample x = MultivariateSample.ofColumn(2.0);
        MultivariateSample y = MultivariateSample.ofColumn(5.0);

        assertThat(SlicedDistanceEstimator.slicedDistance(x, y, 5, 1, 1, 11L)).isCloseTo(3.0, within(1e-9));
    }

    @Test
    @DisplayName("Larger shifts give larger distances")
    void distanceGrowsWithShift() {
        MultivariateSample reference = TestSignals.gaussianRows(400, 2, 0.0, 1);
        MultivariateSample near = TestSignals.gaussianRows(400, 2, 0.5, 2);
        MultivariateSample far = TestSignals.gaussianRows(400, 2, 3.0, 3);

        double nearDistance = SlicedDistanceEstimator.slicedDistance(near, reference, PROJECTIONS, QUANTILES, 2, 4L);
        double farDistance = SlicedDistanceEstimator.slicedDistance(far, reference, PROJECTIONS, QUANTILES, 2, 4L);

        assertThat(farDistance).isGreaterThan(nearDistance);
    }

    @Test
    @DisplayName("Precomputed reference matches the one-shot estimate")
    void projectedReferenceMatchesOneShot() {
        MultivariateSample reference = TestSignals.gaussianRows(300, 3, 0.0, 1);
        MultivariateSample sample = TestSignals.gaussianRows(64, 3, 0.7, 2);
        double[][] directions = SlicedDistanceEstimator.drawDirections(PROJECTIONS, 3, new Random(13L));

        ProjectedReference projected = SlicedDistanceEstimator.projectReference(reference, directions, QUANTILES, 2);

        assertThat(projected.projections()).isEqualTo(PROJECTIONS);
        assertThat(projected.dimension()).isEqualTo(3);
        assertThat(projected.distanceTo(sample))
                .isEqualTo(SlicedDistanceEstimator.slicedDistance(sample, reference, PROJECTIONS, QUANTILES, 2, 13L));
    }

    @Test
    @DisplayName("Row range overload matches a sliced sample")
    void rowRangeMatchesSlice() {
        MultivariateSample reference = TestSignals.gaussianRows(300, 2, 0.0, 1);
        double[][] directions = SlicedDistanceEstimator.drawDirections(20, 2, new Random(3L));
        ProjectedReference projected = SlicedDistanceEstimator.projectReference(reference, directions, QUANTILES, 1);

        assertThat(projected.distanceTo(reference, 100, 64))
                .isEqualTo(projected.distanceTo(reference.slice(100, 64)));
    }

    @Test
    @DisplayName("Drawn directions have unit length")
    void directionsAreUnitVectors() {
        double[][] directions = SlicedDistanceEstimator.drawDirections(100, 5, new Random(21L));

        assertThat(directions.length).isEqualTo(100);
        for (double[] direction : directions) {
            double norm = 0.0;
            for (double component : direction) {
                norm += component * component;
            }
            assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("Should reject samples of different dimensionality")
    void shouldRejectDimensionMismatch() {
        MultivariateSample x = TestSignals.gaussianRows(50, 2, 0.0, 1);
        MultivariateSample y = TestSignals.gaussianRows(50, 3, 0.0, 2);

        assertThatThrownBy(() -> SlicedDistanceEstimator.slicedDistance(x, y, 10, 16, 2, 1L))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    @DisplayName("Should reject empty samples and out-of-range parameters")
    void shouldRejectInvalidParameters() {
        MultivariateSample sample = TestSignals.gaussianRows(50, 2, 0.0, 1);
        MultivariateSample empty = MultivariateSample.of(new double[0][]);

        assertThatThrownBy(() -> SlicedDistanceEstimator.slicedDistance(empty, sample, 10, 16, 2, 1L))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> SlicedDistanceEstimator.slicedDistance(sample, sample, 0, 16, 2, 1L))
                .isInstanceOf(InvalidParametersException.class)
                .hasMessageContaining("nProjections");
        assertThatThrownBy(() -> SlicedDistanceEstimator.slicedDistance(sample, sample, 10, 0, 2, 1L))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> SlicedDistanceEstimator.slicedDistance(sample, sample, 10, 16, 0, 1L))
                .isInstanceOf(InvalidParametersException.class)
                .hasMessageContaining("power");
    }
}
