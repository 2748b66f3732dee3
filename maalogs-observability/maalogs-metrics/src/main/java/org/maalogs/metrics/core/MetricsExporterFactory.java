// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.core;

import com.swirlds.config.api.Configuration;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Set;

/**
 * A service interface for creating {@link MetricsExporter} instances from configuration.
 * <p>
 * Implementations are discovered with {@link java.util.ServiceLoader}, so they must have a public no-arg constructor
 * and be listed in {@code META-INF/services/org.maalogs.metrics.core.MetricsExporterFactory}.
 */
public interface MetricsExporterFactory {

    /**
     * Creates a new {@link MetricsExporter} from the provided configuration.
     * May return {@code null} if the configuration disables the exporter.
     *
     * @param configuration the configuration to create the exporter from, must not be {@code null}
     * @return a new instance of {@link MetricsExporter}, or {@code null} if disabled
     */
    @Nullable
    MetricsExporter createExporter(@NonNull Configuration configuration);

    /**
     * @return the configuration record types this factory reads, to be registered when building the
     * {@link Configuration} passed to {@link #createExporter(Configuration)}
     */
    @NonNull
    default Set<Class<? extends Record>> getConfigDataTypes() {
        return Set.of();
    }
}
