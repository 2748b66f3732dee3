// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.concurrent.atomic.AtomicLong;
import org.maalogs.metrics.core.LabelValues;
import org.maalogs.metrics.core.LabeledMetric;
import org.maalogs.metrics.core.LongMeasurementSnapshot;
import org.maalogs.metrics.core.MeasurementSnapshot;
import org.maalogs.metrics.core.Metric;
import org.maalogs.metrics.core.MetricKey;
import org.maalogs.metrics.core.MetricType;

/**
 * A {@link MetricType#GAUGE}: per series, the last {@code long} set, zero until the first set.
 */
public final class LongGauge extends LabeledMetric<LongGauge.Series> {

    private LongGauge(Builder builder) {
        super(builder);
    }

    @NonNull
    public static MetricKey<LongGauge> key(@NonNull String name) {
        return MetricKey.of(name, LongGauge.class);
    }

    @NonNull
    public static Builder builder(@NonNull MetricKey<LongGauge> key) {
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

    public static final class Builder extends Metric.Builder<Builder, LongGauge> {

        private Builder(@NonNull MetricKey<LongGauge> key) {
            super(MetricType.GAUGE, key);
        }

        @NonNull
        @Override
        protected LongGauge buildMetric() {
            return new LongGauge(this);
        }
    }

    public static final class Series {

        private final AtomicLong value = new AtomicLong();

        private Series() {}

        public void set(long newValue) {
            value.set(newValue);
        }

        public long get() {
            return value.get();
        }
    }
}
