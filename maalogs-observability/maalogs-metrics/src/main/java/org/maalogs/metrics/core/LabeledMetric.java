// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * A {@link Metric} keeping one mutable series per distinct set of label values.
 * <p>
 * A series is created on first use and lives as long as the metric. Looking up an existing series costs one
 * {@link ConcurrentHashMap} read. Keep label values to a small, bounded set, such as command names.
 *
 * @param <S> the series type
 */
public abstract class LabeledMetric<S> extends Metric {

    private final ConcurrentMap<LabelValues, S> series = new ConcurrentHashMap<>();

    protected LabeledMetric(@NonNull Metric.Builder<?, ?> builder) {
        super(builder);
    }

    /**
     * @return the only series of a metric declared without labels
     * @throws IllegalArgumentException if the metric has labels
     */
    @NonNull
    public final S unlabeled() {
        return labeled();
    }

    /**
     * Returns the series for the given labels, creating it if needed.
     *
     * @param namesAndValues label names and values, alternating, e.g. {@code "command", "greet"}
     * @return the series, never {@code null}
     * @throws NullPointerException     if a label value is {@code null}
     * @throws IllegalArgumentException if the names differ from {@link #labelNames()}
     */
    @NonNull
    public final S labeled(@NonNull String... namesAndValues) {
        final LabelValues labelValues = toLabelValues(namesAndValues);
        final S existing = series.get(labelValues);
        return existing != null ? existing : series.computeIfAbsent(labelValues, lv -> newSeries());
    }

    /**
     * @return a new series in its initial state
     */
    @NonNull
    protected abstract S newSeries();

    /**
     * @return an immutable copy of the series state
     */
    @NonNull
    protected abstract MeasurementSnapshot snapshotOf(@NonNull S series, @NonNull LabelValues labelValues);

    @Override
    protected final void collectMeasurementSnapshots(@NonNull Consumer<MeasurementSnapshot> consumer) {
        series.forEach((labelValues, s) -> consumer.accept(snapshotOf(s, labelValues)));
    }
}
