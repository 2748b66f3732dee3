// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.swirlds.config.api.Configuration;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A thread-safe set of {@link Metric}s with unique names, plus at most one {@link MetricsExporter} reading them.
 * <p>
 * Metrics are registered through their builders and looked up by {@link MetricKey}. An exporter is attached
 * with {@link #attachExporter(MetricsExporter)} or found by {@link #discoverMetricsExporter(Configuration)}.
 * Closing the registry closes the exporter.
 */
public final class MetricRegistry implements Closeable {

    private static final System.Logger logger = System.getLogger(MetricRegistry.class.getName());

    private final Map<String, Metric> metrics = new ConcurrentHashMap<>();
    private final Collection<Metric> metricsView = Collections.unmodifiableCollection(metrics.values());
    private final AtomicReference<MetricsExporter> exporter = new AtomicReference<>();

    public MetricRegistry() {
        logger.log(DEBUG, "Created metric registry");
    }

    /**
     * @return {@code true} if an exporter is attached
     */
    public boolean hasMetricsExporter() {
        return exporter.get() != null;
    }

    /**
     * @return read-only view of the registered metrics
     */
    @NonNull
    public Collection<Metric> metrics() {
        return metricsView;
    }

    /**
     * Builds the metric and registers it under its name.
     *
     * @param builder the metric builder
     * @param <M>     the metric type
     * @param <B>     the builder type
     * @return the registered metric
     * @throws NullPointerException     if the builder is {@code null}
     * @throws IllegalArgumentException if the name is taken
     */
    @NonNull
    public <M extends Metric, B extends Metric.Builder<?, M>> M register(final @NonNull B builder) {
        Objects.requireNonNull(builder, "metric builder must not be null");
        final MetricKey<M> key = builder.key();

        final Metric registered = metrics.compute(key.name(), (name, existing) -> {
            if (existing != null) {
                throw new IllegalArgumentException("Duplicate metric name: " + name + ", registered as " + existing);
            }
            return builder.build();
        });
        logger.log(DEBUG, "Registered metric {0}", registered);
        return key.type().cast(registered);
    }

    /**
     * @param key the metric key
     * @param <M> the metric type
     * @return the metric registered under the key's name
     * @throws NoSuchElementException if there is none
     * @throws ClassCastException     if it is not of the key's type
     */
    @NonNull
    public <M extends Metric> M getMetric(@NonNull MetricKey<M> key) {
        Objects.requireNonNull(key, "metric key must not be null");
        final Metric metric = metrics.get(key.name());
        if (metric == null) {
            throw new NoSuchElementException("Metric not found: " + key.name());
        }
        return key.type().cast(metric);
    }

    /**
     * Takes an immutable snapshot of every registered metric.
     * <p>
     * Series are copied one at a time, so writers wait at most for the copy of a single series and readers never
     * wait for each other.
     *
     * @return the snapshot, never {@code null}
     */
    @NonNull
    public MetricRegistrySnapshot snapshot() {
        final List<MetricSnapshot> snapshots = new ArrayList<>(metrics.size());
        for (Metric metric : metrics.values()) {
            snapshots.add(metric.snapshot());
        }
        return new MetricRegistrySnapshot(snapshots);
    }

    /**
     * Hands the exporter {@link #snapshot()} as its supplier. Starting the exporter is left to the caller.
     *
     * @param metricsExporter the exporter
     * @throws IllegalStateException if an exporter is already attached
     */
    public void attachExporter(@NonNull MetricsExporter metricsExporter) {
        Objects.requireNonNull(metricsExporter, "metrics exporter must not be null");
        if (!exporter.compareAndSet(null, metricsExporter)) {
            throw new IllegalStateException("Metrics exporter already attached: " + exporter.get().getClass());
        }
        metricsExporter.setSnapshotSupplier(this::snapshot);
        logger.log(INFO, "Attached metrics exporter: {0}", metricsExporter.getClass());
    }

    /**
     * Creates an exporter with the single {@link MetricsExporterFactory} found by service loading, attaches it and
     * then starts it, so the exporter never runs without a supplier.
     * <p>
     * Nothing is attached if there is no factory, more than one, or the factory declines.
     *
     * @param configuration passed to the factory
     * @return the started exporter, or {@code null}
     * @throws IllegalStateException if an exporter is already attached
     */
    @Nullable
    public MetricsExporter discoverMetricsExporter(@NonNull Configuration configuration) {
        Objects.requireNonNull(configuration, "configuration must not be null");
        if (hasMetricsExporter()) {
            throw new IllegalStateException("Metrics exporter already attached: " + exporter.get().getClass());
        }

        final List<MetricsExporterFactory> factories = MetricUtils.load(MetricsExporterFactory.class);
        if (factories.size() != 1) {
            logger.log(
                    factories.isEmpty() ? INFO : WARNING,
                    "Expected one metrics exporter factory, found {0}. No exporter attached.",
                    factories);
            return null;
        }

        final MetricsExporterFactory factory = factories.get(0);
        final MetricsExporter created = factory.createExporter(configuration);
        if (created == null) {
            logger.log(INFO, "Exporter factory did not create an exporter: {0}", factory.getClass());
            return null;
        }
        attachAndStart(created);
        return created;
    }

    // the supplier is in place before the exporter can serve anything
    void attachAndStart(@NonNull MetricsExporter metricsExporter) {
        attachExporter(metricsExporter);
        metricsExporter.start();
    }

    @Override
    public void close() throws IOException {
        final MetricsExporter current = exporter.getAndSet(null);
        if (current != null) {
            logger.log(INFO, "Closing metrics exporter: {0}", current.getClass());
            current.close();
        }
    }
}
