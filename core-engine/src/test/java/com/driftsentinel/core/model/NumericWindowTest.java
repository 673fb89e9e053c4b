package com.driftsentinel.core.model;

import com.driftsentinel.core.exception.DimensionMismatchException;
import com.driftsentinel.core.exception.InvalidParametersException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link NumericWindow} and {@link MultivariateSample}.
 */
class NumericWindowTest {

    @Test
    @DisplayName("Should copy input so later writes do not leak in")
    void shouldCopyInput() {
        double[] values = { 1.0, 2.0, 3.0 };
        NumericWindow window = NumericWindow.of(values);

        values[0] = 99.0;
        window.toArray()[1] = 99.0;

        assertThat(window.toArray()).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    @DisplayName("Should reject NaN and infinite samples")
    void shouldRejectNonFiniteSamples() {
        assertThatThrownBy(() -> NumericWindow.of(1.0, Double.NaN))
                .isInstanceOf(InvalidParametersException.class)
                .hasMessageContaining("values[1]");
        assertThatThrownBy(() -> NumericWindow.of(Double.POSITIVE_INFINITY))
                .isInstanceOf(InvalidParametersException.class);
    }

    @Test
    @DisplayName("Slice copies a contiguous range")
    void sliceCopiesRange() {
        NumericWindow window = NumericWindow.of(0, 1, 2, 3, 4);

        assertThat(window.slice(1, 3)).isEqualTo(NumericWindow.of(1, 2, 3));
        assertThatThrownBy(() -> window.slice(3, 3)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    @DisplayName("Scalar column is a one-feature sample")
    void scalarColumnHasOneFeature() {
        MultivariateSample column = MultivariateSample.ofColumn(NumericWindow.of(4.0, 5.0));

        assertThat(column.size()).isEqualTo(2);
        assertThat(column.dimension()).isEqualTo(1);
        assertThat(column.row(1)).containsExactly(5.0);
    }

    @Test
    @DisplayName("Should reject ragged rows")
    void shouldRejectRaggedRows() {
        assertThatThrownBy(() -> MultivariateSample.of(new double[][] { { 1, 2 }, { 3 } }))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    @DisplayName("Should reject null rows as invalid parameters")
    void shouldRejectNullRows() {
        assertThatThrownBy(() -> MultivariateSample.of(new double[][] { null, { 1 } }))
                .isInstanceOf(InvalidParametersException.class)
                .hasMessageContaining("rows[0]");
        assertThatThrownBy(() -> MultivariateSample.of(new double[][] { { 1 }, null }))
                .isInstanceOf(InvalidParametersException.class)
                .hasMessageContaining("rows[1]");
    }

    @Test
    @DisplayName("Projection is the dot product with the direction")
    void projectionIsDotProduct() {
        MultivariateSample sample = MultivariateSample.of(new double[][] { { 1, 2 }, { 3, 4 }, { 5, 6 } });

        double[] projected = sample.project(new double[] { 0.5, -1.0 }, 1, 2);

        assertThat(projected).hasSize(2);
        assertThat(projected[0]).isCloseTo(-2.5, within(1e-12));
        assertThat(projected[1]).isCloseTo(-3.5, within(1e-12));
        assertThatThrownBy(() -> sample.project(new double[] { 1.0 }))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    @DisplayName("Empty sample has no dimension")
    void emptySample() {
        MultivariateSample empty = MultivariateSample.of(new double[0][]);

        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.dimension()).isZero();
    }
}
