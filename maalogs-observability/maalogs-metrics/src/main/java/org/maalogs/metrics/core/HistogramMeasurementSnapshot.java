// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Arrays;
import java.util.Objects;

/**
 * A snapshot of a histogram series: cumulative bucket counts, the sum and the count of all observations.
 * <p>
 * {@link #cumulativeCount(int)} at index {@code i} is the number of observations less than or equal to
 * {@link #upperBound(int)}. The implicit {@code +Inf} bucket is not part of the bounds, its count is {@link #count()}.
 */
public final class HistogramMeasurementSnapshot extends MeasurementSnapshot {

    private final double[] upperBounds;
    private final long[] cumulativeCounts;
    private final long count;
    private final double sum;

    /**
     * Both arrays are copied.
     *
     * @param labelValues      the label values of the series
     * @param upperBounds      the finite bucket upper bounds in increasing order
     * @param cumulativeCounts the cumulative count per bound, same length as {@code upperBounds}
     * @param count            the total number of observations
     * @param sum              the sum of all observed values
     * @throws IllegalArgumentException if bounds and counts differ in length
     */
    public HistogramMeasurementSnapshot(
            @NonNull LabelValues labelValues,
            @NonNull double[] upperBounds,
            @NonNull long[] cumulativeCounts,
            long count,
            double sum) {
        super(labelValues);
        Objects.requireNonNull(upperBounds, "upper bounds must not be null");
        Objects.requireNonNull(cumulativeCounts, "cumulative counts must not be null");
        if (upperBounds.length != cumulativeCounts.length) {
            throw new IllegalArgumentException("Expected " + upperBounds.length + " bucket counts, got "
                    + cumulativeCounts.length);
        }
        this.upperBounds = upperBounds.clone();
        this.cumulativeCounts = cumulativeCounts.clone();
        this.count = count;
        this.sum = sum;
    }

    /**
     * @return number of finite buckets
     */
    public int bucketCount() {
        return upperBounds.length;
    }

    public double upperBound(int bucketIndex) {
        return upperBounds[bucketIndex];
    }

    public long cumulativeCount(int bucketIndex) {
        return cumulativeCounts[bucketIndex];
    }

    public long count() {
        return count;
    }

    public double sum() {
        return sum;
    }

    @Override
    public String toString() {
        return "{" + super.toString() + ", bounds=" + Arrays.toString(upperBounds) + ", buckets="
                + Arrays.toString(cumulativeCounts) + ", count=" + count + ", sum=" + sum + "}";
    }
}
