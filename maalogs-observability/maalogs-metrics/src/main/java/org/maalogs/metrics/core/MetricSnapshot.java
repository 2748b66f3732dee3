// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Iterator;
import java.util.List;

/**
 * An immutable snapshot of a {@link Metric} at a point in time, containing its {@link MeasurementSnapshot}s
 * ordered by their label values.
 */
public final class MetricSnapshot implements MetricInfo, Iterable<MeasurementSnapshot> {

    private final MetricInfo metric;
    private final List<MeasurementSnapshot> measurementSnapshots;

    MetricSnapshot(@NonNull MetricInfo metric, @NonNull List<MeasurementSnapshot> measurementSnapshots) {
        this.metric = metric;
        this.measurementSnapshots = List.copyOf(measurementSnapshots);
    }

    @Override
    @NonNull
    public MetricType type() {
        return metric.type();
    }

    @Override
    @NonNull
    public String name() {
        return metric.name();
    }

    @Override
    @Nullable
    public String description() {
        return metric.description();
    }

    @NonNull
    @Override
    public List<String> labelNames() {
        return metric.labelNames();
    }

    /**
     * @return number of series in this snapshot
     */
    public int size() {
        return measurementSnapshots.size();
    }

    @NonNull
    @Override
    public Iterator<MeasurementSnapshot> iterator() {
        return measurementSnapshots.iterator();
    }

    @Override
    public String toString() {
        return type() + " " + name() + labelNames() + "=" + measurementSnapshots;
    }
}
