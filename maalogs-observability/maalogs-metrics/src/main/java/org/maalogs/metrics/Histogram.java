// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Arrays;
import java.util.Objects;
import org.maalogs.metrics.core.HistogramMeasurementSnapshot;
import org.maalogs.metrics.core.LabelValues;
import org.maalogs.metrics.core.LabeledMetric;
import org.maalogs.metrics.core.MeasurementSnapshot;
import org.maalogs.metrics.core.Metric;
import org.maalogs.metrics.core.MetricKey;
import org.maalogs.metrics.core.MetricType;

/**
 * A {@link MetricType#HISTOGRAM}: per series, observations counted into buckets with fixed upper bounds, plus their
 * sum and count.
 * <p>
 * Bounds are finite, strictly increasing and shared by all series. A value lands in the first bucket whose bound
 * it does not exceed, or in the implicit {@code +Inf} bucket.
 */
public final class Histogram extends LabeledMetric<Histogram.Series> {

    // seconds, 5ms to 10s
    private static final double[] DEFAULT_BUCKETS = {0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0};

    private final double[] upperBounds;

    private Histogram(Builder builder) {
        super(builder);
        upperBounds = builder.upperBounds;
    }

    /**
     * @return a copy of the default bucket upper bounds
     */
    @NonNull
    public static double[] defaultBuckets() {
        return DEFAULT_BUCKETS.clone();
    }

    /**
     * @return a copy of this histogram's bucket upper bounds, without {@code +Inf}
     */
    @NonNull
    public double[] upperBounds() {
        return upperBounds.clone();
    }

    @NonNull
    public static MetricKey<Histogram> key(@NonNull String name) {
        return MetricKey.of(name, Histogram.class);
    }

    @NonNull
    public static Builder builder(@NonNull MetricKey<Histogram> key) {
        return new Builder(key);
    }

    @NonNull
    public static Builder builder(@NonNull String name) {
        return builder(key(name));
    }

    @NonNull
    @Override
    protected Series newSeries() {
        return new Series(upperBounds);
    }

    @NonNull
    @Override
    protected MeasurementSnapshot snapshotOf(@NonNull Series series, @NonNull LabelValues labelValues) {
        return series.snapshot(labelValues);
    }

    /**
     * Builder for {@link Histogram}. Uses {@link #defaultBuckets()} unless {@link #setBuckets(double...)} is called.
     */
    public static final class Builder extends Metric.Builder<Builder, Histogram> {

        private double[] upperBounds = DEFAULT_BUCKETS;

        private Builder(@NonNull MetricKey<Histogram> key) {
            super(MetricType.HISTOGRAM, key);
        }

        /**
         * Replaces the bucket upper bounds. The array is copied. A trailing {@code +Inf} is accepted and dropped,
         * that bucket always exists.
         *
         * @param bounds finite bucket upper bounds in strictly increasing order
         * @return this builder
         * @throws NullPointerException     if the bounds are {@code null}
         * @throws IllegalArgumentException if the bounds are not strictly increasing, or hold {@code NaN}
         *                                  or an infinity other than a trailing {@code +Inf}
         */
        @NonNull
        public Builder setBuckets(@NonNull double... bounds) {
            Objects.requireNonNull(bounds, "bucket bounds must not be null");
            int length = bounds.length;
            if (length > 0 && bounds[length - 1] == Double.POSITIVE_INFINITY) {
                length--;
            }
            final double[] copy = Arrays.copyOf(bounds, length);
            for (int i = 0; i < copy.length; i++) {
                if (!Double.isFinite(copy[i])) {
                    throw new IllegalArgumentException("Bucket bound must be finite, but was: " + copy[i]);
                }
                if (i > 0 && copy[i] <= copy[i - 1]) {
                    throw new IllegalArgumentException(
                            "Bucket bounds must be strictly increasing: " + Arrays.toString(bounds));
                }
            }
            upperBounds = copy;
            return this;
        }

        @NonNull
        @Override
        protected Histogram buildMetric() {
            return new Histogram(this);
        }
    }

    /**
     * One histogram series.
     * <p>
     * Observations and snapshots hold the series' monitor only for a few array writes, so the buckets, sum and
     * count in a snapshot always agree with each other.
     */
    public static final class Series {

        private final double[] upperBounds;
        // one slot per bound plus the +Inf slot, not cumulative
        private final long[] bucketCounts;
        private long count;
        private double sum;

        private Series(double[] upperBounds) {
            this.upperBounds = upperBounds;
            this.bucketCounts = new long[upperBounds.length + 1];
        }

        /**
         * Records one observation. {@code NaN} only counts in the {@code +Inf} bucket.
         *
         * @param value the observed value
         */
        public void observe(double value) {
            final int bucket = bucketIndex(value);
            synchronized (this) {
                bucketCounts[bucket]++;
                count++;
                sum += value;
            }
        }

        public synchronized long count() {
            return count;
        }

        public synchronized double sum() {
            return sum;
        }

        HistogramMeasurementSnapshot snapshot(@NonNull LabelValues labelValues) {
            final long[] counts;
            final long countCopy;
            final double sumCopy;
            synchronized (this) {
                counts = bucketCounts.clone();
                countCopy = count;
                sumCopy = sum;
            }
            final long[] cumulative = new long[upperBounds.length];
            long running = 0L;
            for (int i = 0; i < upperBounds.length; i++) {
                running += counts[i];
                cumulative[i] = running;
            }
            return new HistogramMeasurementSnapshot(labelValues, upperBounds, cumulative, countCopy, sumCopy);
        }

        // first bound >= value, upperBounds.length for +Inf
        private int bucketIndex(double value) {
            if (Double.isNaN(value)) {
                return upperBounds.length;
            }
            int low = 0;
            int high = upperBounds.length;
            while (low < high) {
                final int mid = (low + high) >>> 1;
                if (value > upperBounds[mid]) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            return low;
        }
    }
}
