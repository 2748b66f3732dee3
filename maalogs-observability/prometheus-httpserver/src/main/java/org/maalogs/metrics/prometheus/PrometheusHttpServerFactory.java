// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.prometheus;

import com.swirlds.config.api.Configuration;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Set;
import org.maalogs.metrics.config.MetricsConfig;
import org.maalogs.metrics.core.MetricsExporter;
import org.maalogs.metrics.core.MetricsExporterFactory;
import org.maalogs.metrics.prometheus.config.PrometheusHttpServerConfig;

/**
 * Implementation of {@link MetricsExporterFactory} for creating Prometheus HTTP server exporters.
 * Uses {@link MetricsConfig} and {@link PrometheusHttpServerConfig} for configuration.
 * <p>
 * The returned server is not started yet, {@link org.maalogs.metrics.core.MetricRegistry} starts it once attached.
 */
public final class PrometheusHttpServerFactory implements MetricsExporterFactory {

    @Nullable
    @Override
    public MetricsExporter createExporter(@NonNull Configuration configuration) {
        MetricsConfig metricsConfig = configuration.getConfigData(MetricsConfig.class);
        if (!metricsConfig.enabled()) {
            return null;
        }

        PrometheusHttpServerConfig serverConfig = configuration.getConfigData(PrometheusHttpServerConfig.class);
        return new PrometheusHttpServer(metricsConfig.port(), serverConfig);
    }

    @NonNull
    @Override
    public Set<Class<? extends Record>> getConfigDataTypes() {
        return Set.of(PrometheusHttpServerConfig.class);
    }
}
