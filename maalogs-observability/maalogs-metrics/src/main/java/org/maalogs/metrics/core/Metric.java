// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Base class of every metric: a type, a name, an optional description and the sorted names of the labels that
 * tell its series apart.
 * <p>
 * Subclasses own the series and hand them out as {@link MeasurementSnapshot}s when the registry takes a snapshot.
 */
public abstract class Metric implements MetricInfo {

    private static final Comparator<MeasurementSnapshot> BY_LABEL_VALUES =
            Comparator.comparing(MeasurementSnapshot::labelValues);

    private final MetricType type;
    private final String name;
    private final String description;
    private final List<String> labelNames;

    protected Metric(@NonNull Builder<?, ?> builder) {
        type = builder.type;
        name = builder.key.name();
        description = builder.description;
        labelNames = List.copyOf(builder.labelNames);
    }

    @NonNull
    @Override
    public final MetricType type() {
        return type;
    }

    @NonNull
    @Override
    public final String name() {
        return name;
    }

    @Nullable
    @Override
    public final String description() {
        return description;
    }

    @NonNull
    @Override
    public final List<String> labelNames() {
        return labelNames;
    }

    @Override
    public final String toString() {
        return type + " " + name + labelNames;
    }

    // called by MetricRegistry#snapshot() only
    @NonNull
    final MetricSnapshot snapshot() {
        final List<MeasurementSnapshot> series = new ArrayList<>();
        collectMeasurementSnapshots(series::add);
        series.sort(BY_LABEL_VALUES);
        return new MetricSnapshot(this, series);
    }

    /**
     * Hands a snapshot of every existing series to the consumer, in any order.
     */
    protected abstract void collectMeasurementSnapshots(@NonNull Consumer<MeasurementSnapshot> consumer);

    /**
     * Turns {@code name, value} pairs into the {@link LabelValues} of one series.
     * <p>
     * The pairs may come in any order, but their names must be exactly the {@link #labelNames()} of this metric.
     *
     * @param namesAndValues label names and values, alternating
     * @return the label values ordered like {@link #labelNames()}
     * @throws NullPointerException     if the array or any value is {@code null}
     * @throws IllegalArgumentException if the array has odd length or the names do not match
     */
    protected final LabelValues toLabelValues(@NonNull String... namesAndValues) {
        Objects.requireNonNull(namesAndValues, "label names and values must not be null");
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Label names and values must be in pairs");
        }
        final int pairs = namesAndValues.length / 2;
        if (pairs != labelNames.size()) {
            throw new IllegalArgumentException(
                    name + " expects labels " + labelNames + ", got " + pairs + " label(s)");
        }
        if (pairs == 0) {
            return LabelValues.EMPTY;
        }

        final String[] ordered = new String[namesAndValues.length];
        for (int slot = 0; slot < pairs; slot++) {
            final String expected = labelNames.get(slot);
            final int pair = indexOfPair(namesAndValues, expected);
            if (pair < 0) {
                throw new IllegalArgumentException(name + " is missing label: " + expected);
            }
            ordered[2 * slot] = expected;
            ordered[2 * slot + 1] = Objects.requireNonNull(
                    namesAndValues[2 * pair + 1], () -> "Value of label " + expected + " must not be null");
        }
        return new LabelValues(ordered);
    }

    private static int indexOfPair(String[] namesAndValues, String labelName) {
        for (int pair = 0; pair < namesAndValues.length / 2; pair++) {
            if (labelName.equals(namesAndValues[2 * pair])) {
                return pair;
            }
        }
        return -1;
    }

    /**
     * Base builder of {@link Metric}s.
     *
     * @param <B> the concrete builder type, returned for chaining
     * @param <M> the metric type built
     */
    public abstract static class Builder<B extends Metric.Builder<B, M>, M extends Metric> {

        private final MetricType type;
        private final MetricKey<M> key;
        private final TreeSet<String> labelNames = new TreeSet<>();
        private String description;

        protected Builder(@NonNull MetricType type, @NonNull MetricKey<M> key) {
            this.type = Objects.requireNonNull(type, "type must not be null");
            this.key = Objects.requireNonNull(key, "key must not be null");
        }

        @NonNull
        public MetricKey<M> key() {
            return key;
        }

        /**
         * @param description exported as {@code # HELP} text, may be {@code null}
         * @return this builder
         */
        @NonNull
        public final B setDescription(@Nullable String description) {
            this.description = description;
            return self();
        }

        /**
         * Adds label names. Repeated names are ignored.
         *
         * @param names the label names
         * @return this builder
         * @throws IllegalArgumentException if a name is invalid, reserved, or equal to the metric name
         */
        @NonNull
        public final B addLabelNames(@NonNull String... names) {
            Objects.requireNonNull(names, "label names must not be null");
            for (String labelName : names) {
                MetricUtils.validateLabelNameCharacters(labelName);
                if (labelName.equals(key.name())) {
                    throw new IllegalArgumentException("Label name must differ from the metric name: " + labelName);
                }
                labelNames.add(labelName);
            }
            return self();
        }

        @NonNull
        public final M build() {
            return buildMetric();
        }

        /**
         * Builds the metric and registers it, see {@link MetricRegistry#register(Metric.Builder)}.
         */
        @NonNull
        public final M register(@NonNull MetricRegistry registry) {
            return Objects.requireNonNull(registry, "registry must not be null").register(this);
        }

        @NonNull
        protected abstract M buildMetric();

        @NonNull
        @SuppressWarnings("unchecked")
        protected final B self() {
            return (B) this;
        }
    }
}
