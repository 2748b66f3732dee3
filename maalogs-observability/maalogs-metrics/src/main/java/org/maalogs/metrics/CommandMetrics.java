// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.swirlds.config.api.Configuration;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.maalogs.metrics.config.MetricsConfig;
import org.maalogs.metrics.config.MetricsEnvironment;
import org.maalogs.metrics.core.MetricKey;
import org.maalogs.metrics.core.MetricRegistry;
import org.maalogs.metrics.core.MetricRegistrySnapshot;
import org.maalogs.metrics.core.MetricsExporter;

/**
 * Process-wide metrics of the commands the application executes.
 * <p>
 * The registry behind this class is created on first use and lives as long as the process. It holds
 * <ul>
 *     <li>{@value #COMMAND_TOTAL_NAME}: counter of executed commands by {@code command} and {@code status}</li>
 *     <li>{@value #COMMAND_DURATION_NAME}: histogram of command durations in seconds by {@code command}</li>
 *     <li>{@value #APP_UP_NAME}: gauge set to {@code 1} once the registry exists</li>
 * </ul>
 * Recording never fails the caller. The export endpoint is optional and started at most once per process with
 * {@link #startServer(int)}.
 */
public final class CommandMetrics {

    public static final String COMMAND_TOTAL_NAME = "tauri_command_total";
    public static final String COMMAND_DURATION_NAME = "tauri_command_duration_seconds";
    public static final String APP_UP_NAME = "tauri_app_up";

    public static final MetricKey<LongCounter> COMMAND_TOTAL = LongCounter.key(COMMAND_TOTAL_NAME);
    public static final MetricKey<Histogram> COMMAND_DURATION = Histogram.key(COMMAND_DURATION_NAME);
    public static final MetricKey<LongGauge> APP_UP = LongGauge.key(APP_UP_NAME);

    public static final String COMMAND_LABEL = "command";
    public static final String STATUS_LABEL = "status";

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    private static final System.Logger logger = System.getLogger(CommandMetrics.class.getName());

    private final MetricRegistry registry;
    private final LongCounter commandTotal;
    private final Histogram commandDuration;
    private final AtomicBoolean serverRequested = new AtomicBoolean(false);

    CommandMetrics(@NonNull MetricRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");

        commandTotal = registry.register(LongCounter.builder(COMMAND_TOTAL)
                .setDescription("Tauri command total")
                .addLabelNames(COMMAND_LABEL, STATUS_LABEL));
        commandDuration = registry.register(Histogram.builder(COMMAND_DURATION)
                .setDescription("Tauri command duration")
                .addLabelNames(COMMAND_LABEL));
        registry.register(LongGauge.builder(APP_UP).setDescription("Tauri app up"))
                .unlabeled()
                .set(1L);
    }

    // initialization-on-demand holder, the JVM guarantees a single construction
    private static final class Holder {
        private static final CommandMetrics INSTANCE = new CommandMetrics(new MetricRegistry());
    }

    @NonNull
    static CommandMetrics instance() {
        return Holder.INSTANCE;
    }

    /**
     * Records one completed command: increments its counter for the status and observes its duration.
     * <p>
     * Never throws. Invalid arguments are logged and ignored.
     *
     * @param command         the command name, e.g. {@code greet}
     * @param status          the outcome, usually {@link #STATUS_SUCCESS} or {@link #STATUS_ERROR}
     * @param durationSeconds the command duration in seconds
     */
    public static void record(String command, String status, double durationSeconds) {
        instance().recordCommand(command, status, durationSeconds);
    }

    /**
     * Runs the operation and records it under the given command name, with status {@link #STATUS_SUCCESS} when it
     * returns and {@link #STATUS_ERROR} when it throws. The exception is rethrown unchanged.
     *
     * @param command   the command name
     * @param operation the operation to run
     * @param <T>       the result type
     * @return the result of the operation
     */
    public static <T> T time(@NonNull String command, @NonNull Supplier<T> operation) {
        return instance().timeCommand(command, operation);
    }

    /**
     * @return an immutable snapshot of all metrics of this process
     */
    @NonNull
    public static MetricRegistrySnapshot snapshot() {
        return instance().registry.snapshot();
    }

    /**
     * @return the process-wide registry, for registering additional metrics exported by the same endpoint
     */
    @NonNull
    public static MetricRegistry registry() {
        return instance().registry;
    }

    /**
     * Starts the export endpoint on {@code 127.0.0.1:port} in the background.
     * <p>
     * Returns immediately. Failures, including the port being in use, are logged and never reach the caller.
     * Only the first call in a process has an effect.
     *
     * @param port the local port to listen on
     */
    public static void startServer(int port) {
        instance().startExporter(() -> MetricsEnvironment.buildConfiguration(true, port));
    }

    /**
     * Starts the export endpoint if the given environment enables metrics, see {@link #startServer(int)}.
     *
     * @param environment the metrics settings of the host
     */
    public static void startServer(@NonNull MetricsEnvironment environment) {
        Objects.requireNonNull(environment, "environment must not be null");
        if (!environment.enabled()) {
            logger.log(INFO, "Metrics endpoint disabled by {0}", MetricsEnvironment.ENABLED_VARIABLE);
            return;
        }
        instance().startExporter(environment::toConfiguration);
    }

    void recordCommand(String command, String status, double durationSeconds) {
        try {
            commandTotal.labeled(COMMAND_LABEL, command, STATUS_LABEL, status).increment();
            commandDuration.labeled(COMMAND_LABEL, command).observe(durationSeconds);
        } catch (RuntimeException e) {
            logger.log(WARNING, "Failed to record command metrics. command=" + command + ", status=" + status, e);
        }
    }

    <T> T timeCommand(@NonNull String command, @NonNull Supplier<T> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        final long start = System.nanoTime();
        final T result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            recordCommand(command, STATUS_ERROR, secondsSince(start));
            throw e;
        }
        recordCommand(command, STATUS_SUCCESS, secondsSince(start));
        return result;
    }

    /**
     * @return the started exporter, or {@code null} if nothing was started
     */
    @Nullable
    MetricsExporter startExporter(@NonNull Supplier<Configuration> configurationSupplier) {
        if (!serverRequested.compareAndSet(false, true)) {
            logger.log(WARNING, "Metrics endpoint already requested, ignoring repeated start");
            return null;
        }
        try {
            final Configuration configuration = configurationSupplier.get();
            final MetricsConfig metricsConfig = configuration.getConfigData(MetricsConfig.class);
            if (!metricsConfig.enabled()) {
                logger.log(INFO, "Metrics endpoint disabled by configuration");
                return null;
            }
            return registry.discoverMetricsExporter(configuration);
        } catch (RuntimeException e) {
            logger.log(WARNING, "Metrics endpoint not started", e);
            return null;
        }
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
