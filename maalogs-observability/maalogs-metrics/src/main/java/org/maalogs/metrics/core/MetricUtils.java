// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.core;

import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Name validation and service loading shared by the metrics modules.
 */
public final class MetricUtils {

    /** Metric names accepted by the Prometheus text format. */
    public static final String METRIC_NAME_REGEX = "^[a-zA-Z_:][a-zA-Z0-9_:]*$";

    /** Label names accepted by the Prometheus text format. */
    public static final String LABEL_NAME_REGEX = "^[a-zA-Z_][a-zA-Z0-9_]*$";

    /** Label added by histogram buckets, not available to callers. */
    public static final String BUCKET_LABEL = "le";

    private static final Pattern METRIC_NAME_PATTERN = Pattern.compile(METRIC_NAME_REGEX);
    private static final Pattern LABEL_NAME_PATTERN = Pattern.compile(LABEL_NAME_REGEX);

    private MetricUtils() {}

    /**
     * @param metricName the name to check against {@value #METRIC_NAME_REGEX}
     * @return the name
     * @throws NullPointerException     if the name is {@code null}
     * @throws IllegalArgumentException if the name does not match
     */
    public static String validateMetricNameCharacters(String metricName) {
        return requireMatch(METRIC_NAME_PATTERN, metricName, "metric name");
    }

    /**
     * @param labelName the name to check against {@value #LABEL_NAME_REGEX}
     * @return the name
     * @throws NullPointerException     if the name is {@code null}
     * @throws IllegalArgumentException if the name does not match or is {@value #BUCKET_LABEL}
     */
    public static String validateLabelNameCharacters(String labelName) {
        requireMatch(LABEL_NAME_PATTERN, labelName, "label name");
        if (BUCKET_LABEL.equals(labelName)) {
            throw new IllegalArgumentException("Label name '" + BUCKET_LABEL + "' is reserved for histogram buckets");
        }
        return labelName;
    }

    private static String requireMatch(Pattern pattern, String name, String what) {
        Objects.requireNonNull(name, what + " must not be null");
        if (!pattern.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid " + what + " '" + name + "', expected " + pattern.pattern());
        }
        return name;
    }

    /**
     * Instantiates every provider of the service registered under {@code META-INF/services}.
     *
     * @param serviceType the service interface
     * @param <T>         the service type
     * @return the providers, possibly empty
     */
    public static <T> List<T> load(Class<T> serviceType) {
        return ServiceLoader.load(serviceType).stream()
                .map(ServiceLoader.Provider::get)
                .collect(Collectors.toList());
    }
}
