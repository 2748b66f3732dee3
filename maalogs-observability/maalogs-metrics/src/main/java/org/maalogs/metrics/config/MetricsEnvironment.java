// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.config;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.swirlds.config.api.Configuration;
import com.swirlds.config.api.ConfigurationBuilder;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.maalogs.metrics.core.MetricUtils;
import org.maalogs.metrics.core.MetricsExporterFactory;

/**
 * Reads the metrics settings of the host process from environment variables and turns them into a
 * {@link Configuration} holding {@link MetricsConfig} and the configuration records of every
 * {@link MetricsExporterFactory} on the class path.
 * <ul>
 *     <li>{@value #ENABLED_VARIABLE}: {@code 1}, {@code true} or {@code yes} (any case) enable metrics,
 *     any other value disables them, metrics are enabled when the variable is absent</li>
 *     <li>{@value #PORT_VARIABLE}: the endpoint port, {@code 9100} when absent or not a valid port number</li>
 * </ul>
 */
public final class MetricsEnvironment {

    public static final String ENABLED_VARIABLE = "MAALOGS_METRICS_ENABLED";
    public static final String PORT_VARIABLE = "MAALOGS_METRICS_PORT";

    static final boolean DEFAULT_ENABLED = true;
    static final int DEFAULT_PORT = 9100;

    private static final System.Logger logger = System.getLogger(MetricsEnvironment.class.getName());

    private final boolean enabled;
    private final int port;

    private MetricsEnvironment(@NonNull Map<String, String> variables) {
        Objects.requireNonNull(variables, "environment variables must not be null");
        enabled = parseEnabled(variables.get(ENABLED_VARIABLE));
        port = parsePort(variables.get(PORT_VARIABLE));
    }

    /**
     * @return the settings read from the environment of this process
     */
    @NonNull
    public static MetricsEnvironment fromSystem() {
        return new MetricsEnvironment(System.getenv());
    }

    /**
     * @param variables environment variables by name
     * @return the settings read from the given variables
     */
    @NonNull
    public static MetricsEnvironment of(@NonNull Map<String, String> variables) {
        return new MetricsEnvironment(variables);
    }

    public boolean enabled() {
        return enabled;
    }

    public int port() {
        return port;
    }

    /**
     * @return configuration with {@link MetricsConfig} set from these settings
     */
    @NonNull
    public Configuration toConfiguration() {
        return buildConfiguration(enabled, port);
    }

    /**
     * Builds a configuration with {@link MetricsConfig} set to the given values and the configuration records
     * of all discovered {@link MetricsExporterFactory} implementations registered with their defaults.
     *
     * @param enabled whether metrics export is enabled
     * @param port    the endpoint port
     * @return the configuration
     * @throws com.swirlds.config.api.validation.ConfigViolationException if the port is out of range
     */
    @NonNull
    public static Configuration buildConfiguration(boolean enabled, int port) {
        final ConfigurationBuilder builder = ConfigurationBuilder.create().withConfigDataType(MetricsConfig.class);
        for (MetricsExporterFactory factory : MetricUtils.load(MetricsExporterFactory.class)) {
            for (Class<? extends Record> configDataType : factory.getConfigDataTypes()) {
                builder.withConfigDataType(configDataType);
            }
        }
        return builder.withValue(MetricsConfig.ENABLED_PROPERTY, Boolean.toString(enabled))
                .withValue(MetricsConfig.PORT_PROPERTY, Integer.toString(port))
                .build();
    }

    static boolean parseEnabled(String value) {
        if (value == null) {
            return DEFAULT_ENABLED;
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        return normalized.equals("1") || normalized.equals("true") || normalized.equals("yes");
    }

    static int parsePort(String value) {
        if (value == null) {
            return DEFAULT_PORT;
        }
        try {
            int port = Integer.parseInt(value);
            if (port >= 0 && port <= 65535) {
                return port;
            }
            logger.log(WARNING, "Ignoring out of range {0}={1}", PORT_VARIABLE, value);
        } catch (NumberFormatException e) {
            logger.log(WARNING, "Ignoring malformed {0}={1}", PORT_VARIABLE, value);
        }
        logger.log(DEBUG, "Using default metrics port {0,number,#}", DEFAULT_PORT);
        return DEFAULT_PORT;
    }

    @Override
    public String toString() {
        return "MetricsEnvironment{enabled=" + enabled + ", port=" + port + '}';
    }
}
