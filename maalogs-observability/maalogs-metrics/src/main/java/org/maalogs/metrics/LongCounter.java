// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.concurrent.atomic.LongAdder;
import org.maalogs.metrics.core.LabelValues;
import org.maalogs.metrics.core.LabeledMetric;
import org.maalogs.metrics.core.LongMeasurementSnapshot;
import org.maalogs.metrics.core.MeasurementSnapshot;
import org.maalogs.metrics.core.Metric;
import org.maalogs.metrics.core.MetricKey;
import org.maalogs.metrics.core.MetricType;

/**
 * A {@link MetricType#COUNTER}: per series, a {@code long} that starts at zero and only goes up.
 */
public final class LongCounter extends LabeledMetric<LongCounter.Series> {

    private LongCounter(Builder builder) {
        super(builder);
    }

    @NonNull
    public static MetricKey<LongCounter> key(@NonNull String name) {
        return MetricKey.of(name, LongCounter.class);
    }

    @NonNull
    public static Builder builder(@NonNull MetricKey<LongCounter> key) {
        return new Builder(key);
    }

    @NonNull
    public static Builder builder(@NonNull String name) {
        return builder(key(name));
    }

    @NonNull
    @Override
    protected Series newSeries() {
        return new Series();
    }

    @NonNull
    @Override
    protected MeasurementSnapshot snapshotOf(@NonNull Series series, @NonNull LabelValues labelValues) {
        return new LongMeasurementSnapshot(labelValues, series.get());
    }

    public static final class Builder extends Metric.Builder<Builder, LongCounter> {

        private Builder(@NonNull MetricKey<LongCounter> key) {
            super(MetricType.COUNTER, key);
        }

        @NonNull
        @Override
        protected LongCounter buildMetric() {
            return new LongCounter(this);
        }
    }

    /**
     * One counter series. Lock-free, increments from many threads are never lost.
     */
    public static final class Series {

        private final LongAdder total = new LongAdder();

        private Series() {}

        public void increment() {
            total.increment();
        }

        /**
         * @param amount how much to add
         * @throws IllegalArgumentException if the amount is negative
         */
        public void increment(long amount) {
            if (amount < 0L) {
                throw new IllegalArgumentException("Counter cannot decrease, got increment " + amount);
            }
            total.add(amount);
        }

        public long get() {
            return total.sum();
        }
    }
}
