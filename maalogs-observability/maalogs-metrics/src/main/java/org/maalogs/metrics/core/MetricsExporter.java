// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.util.function.Supplier;

/**
 * Exports the metrics of a {@link MetricRegistry} to an external system.
 * <p>
 * Implementations pull {@link MetricRegistrySnapshot}s from the supplier whenever they need metrics data.
 * The supplier is safe to call from any thread.
 *
 * @see MetricRegistry#attachExporter(MetricsExporter)
 */
public interface MetricsExporter extends Closeable {

    /**
     * Bind the exporter to a supplier of {@link MetricRegistrySnapshot}.
     * Implementations must accept repeated calls, the latest supplier wins.
     *
     * @param snapshotSupplier the supplier of {@link MetricRegistrySnapshot}
     */
    void setSnapshotSupplier(@NonNull Supplier<MetricRegistrySnapshot> snapshotSupplier);

    /**
     * Begins exporting. Called once, after {@link #setSnapshotSupplier(Supplier)}. Must not block on I/O.
     *
     * @throws IllegalStateException if already started
     */
    void start();
}
