// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.prometheus.config;

import com.swirlds.config.api.ConfigData;
import com.swirlds.config.api.ConfigProperty;
import com.swirlds.config.api.validation.annotation.Max;
import com.swirlds.config.api.validation.annotation.Min;

/**
 * Configuration for the Prometheus HTTP server. Whether the server runs and which port it binds come from
 * {@link org.maalogs.metrics.config.MetricsConfig}.
 *
 * @param hostname the hostname to bind to, while empty means all interfaces (default: 127.0.0.1)
 * @param path the HTTP path to serve metrics on (default: /metrics)
 * @param bufferSize the initial capacity of the buffer a response is rendered into (default: 1024, range: 0-2mb)
 */
// spotless:off
@ConfigData("metrics.exporter.prometheus")
public record PrometheusHttpServerConfig(
        @ConfigProperty(defaultValue = "127.0.0.1") String hostname,
        @ConfigProperty(defaultValue = "/metrics") String path,
        @ConfigProperty(defaultValue = "1024") @Min(0) @Max(2097152) int bufferSize) {}
// spotless:on
