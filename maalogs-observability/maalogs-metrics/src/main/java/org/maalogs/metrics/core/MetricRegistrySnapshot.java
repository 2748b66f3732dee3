// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An immutable snapshot of all metrics in a {@link MetricRegistry}, iterating {@link MetricSnapshot}s
 * in alphabetical order of metric names.
 */
public final class MetricRegistrySnapshot implements Iterable<MetricSnapshot> {

    private static final MetricRegistrySnapshot EMPTY = new MetricRegistrySnapshot(List.of());

    private final List<MetricSnapshot> snapshots;

    /**
     * @param snapshots the metric snapshots to include, in any order
     */
    public MetricRegistrySnapshot(@NonNull Collection<MetricSnapshot> snapshots) {
        this.snapshots = snapshots.stream()
                .sorted(Comparator.comparing(MetricSnapshot::name))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * @return a snapshot containing no metrics
     */
    @NonNull
    public static MetricRegistrySnapshot empty() {
        return EMPTY;
    }

    /**
     * @param metricName the metric name to look up
     * @return the snapshot of the metric with the given name, or {@code null} if there is none
     */
    @Nullable
    public MetricSnapshot get(@NonNull String metricName) {
        for (MetricSnapshot snapshot : snapshots) {
            if (snapshot.name().equals(metricName)) {
                return snapshot;
            }
        }
        return null;
    }

    /**
     * @return number of metrics in this snapshot
     */
    public int size() {
        return snapshots.size();
    }

    @NonNull
    @Override
    public Iterator<MetricSnapshot> iterator() {
        return snapshots.iterator();
    }

    @Override
    public String toString() {
        return "MetricRegistrySnapshot" + snapshots;
    }
}
