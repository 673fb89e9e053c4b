package com.driftsentinel.core.estimator;

import com.driftsentinel.core.exception.InvalidParametersException;
import com.driftsentinel.core.model.NumericWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Permutation (ordinal-pattern) entropy of a univariate window.
 *
 * <h3>Algorithm</h3>
 * <p>
 * A sub-window of {@code m} consecutive samples is slid across the input
 * with a step of {@code delay}. Each sub-window is reduced to the rank order
 * of its values, ties broken by position, which is one of {@code m!} ordinal
 * patterns. The Shannon entropy (natural log) of the pattern frequencies is
 * returned, optionally divided by {@code ln(m!)}.
 * </p>
 *
 * <p>
 * Only <em>observed</em> patterns enter the probability distribution. For
 * short windows this reads slightly lower than an entropy over the full
 * alphabet; calibrated thresholds depend on this exact definition.
 * </p>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class OrdinalEntropyEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(OrdinalEntropyEstimator.class);

    /** Largest embedding dimension whose patterns fit a 64-bit key. */
    public static final int MAX_EMBEDDING_DIMENSION = 15;

    private OrdinalEntropyEstimator() {
        // utility class, not instantiable
    }

    /**
     * @see #permutationEntropy(double[], int, int, boolean)
     */
    public static double permutationEntropy(NumericWindow window, int embeddingDimension, int delay,
            boolean normalize) {
        Objects.requireNonNull(window, "Window must not be null");
        return permutationEntropy(window.toArray(), embeddingDimension, delay, normalize);
    }

    /**
     * Compute the permutation entropy of {@code values}.
     *
     * @param values             univariate samples; not modified
     * @param embeddingDimension pattern length {@code m}, in
     *                           {@code [2, MAX_EMBEDDING_DIMENSION]}
     * @param delay              step {@code tau} between sub-window starts,
     *                           {@code >= 1}
     * @param normalize          divide by {@code ln(m!)} so the result lies in
     *                           {@code [0, 1]}
     * @return entropy in nats, or normalized entropy
     * @throws InvalidParametersException if a parameter is out of range or
     *                                    {@code values.length < (m - 1) * tau + 1}
     */
    public static double permutationEntropy(double[] values, int embeddingDimension, int delay,
            boolean normalize) {
        Objects.requireNonNull(values, "Values must not be null");
        int m = embeddingDimension;
        if (m < 2 || m > MAX_EMBEDDING_DIMENSION) {
            throw InvalidParametersException.invalidParameter(
                    "embeddingDimension", m, "a value in [2, " + MAX_EMBEDDING_DIMENSION + "]");
        }
        if (delay < 1) {
            throw InvalidParametersException.invalidParameter("delay", delay, ">= 1");
        }
        long required = (long) (m - 1) * delay + 1;
        if (values.length < required) {
            throw new InvalidParametersException(String.format(
                    "Signal is too short for the requested parameters: need at least %d samples, got %d",
                    required, values.length));
        }

        Map<Long, Integer> counts = new HashMap<>();
        int[] order = new int[m];
        int[] ranks = new int[m];
        int total = 0;

        for (int start = 0; start + m <= values.length; start += delay) {
            rankPattern(values, start, order, ranks);
            counts.merge(encode(ranks), 1, Integer::sum);
            total++;
        }

        double entropy = 0.0;
        for (int count : counts.values()) {
            double probability = (double) count / total;
            entropy -= probability * Math.log(probability);
        }
        if (normalize) {
            entropy /= logFactorial(m);
        }

        LOG.trace("Permutation entropy {} from {} pattern(s), {} distinct", entropy, total, counts.size());
        return entropy;
    }

    /**
     * Stable argsort of {@code values[start .. start + m)} into {@code order},
     * then invert it into {@code ranks}.
     */
    private static void rankPattern(double[] values, int start, int[] order, int[] ranks) {
        int m = order.length;
        for (int i = 0; i < m; i++) {
            int j = i;
            // Strict comparison keeps equal values in index order
            while (j > 0 && values[start + order[j - 1]] > values[start + i]) {
                order[j] = order[j - 1];
                j--;
            }
            order[j] = i;
        }
        for (int position = 0; position < m; position++) {
            ranks[order[position]] = position;
        }
    }

    private static long encode(int[] ranks) {
        long key = 0;
        long weight = 1;
        for (int rank : ranks) {
            key += rank * weight;
            weight *= ranks.length;
        }
        return key;
    }

    private static double logFactorial(int m) {
        double sum = 0.0;
        for (int i = 2; i <= m; i++) {
            sum += Math.log(i);
        }
        return sum;
    }
}
