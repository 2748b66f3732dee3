// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.config;

import com.swirlds.config.api.ConfigData;
import com.swirlds.config.api.ConfigProperty;
import com.swirlds.config.api.validation.annotation.Max;
import com.swirlds.config.api.validation.annotation.Min;

/**
 * Host level metrics settings.
 *
 * @param enabled whether the metrics endpoint is started (default: true)
 * @param port    the local port of the metrics endpoint, 0 picks a free port (default: 9100, range: 0-65535)
 */
// spotless:off
@ConfigData("metrics")
public record MetricsConfig(
        @ConfigProperty(defaultValue = "true") boolean enabled,
        @ConfigProperty(defaultValue = "9100") @Min(0) @Max(65535) int port) {

    /** Property name of {@link #enabled()}. */
    public static final String ENABLED_PROPERTY = "metrics.enabled";

    /** Property name of {@link #port()}. */
    public static final String PORT_PROPERTY = "metrics.port";
}
// spotless:on
