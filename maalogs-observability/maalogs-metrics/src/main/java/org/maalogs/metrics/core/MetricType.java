// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.core;

/**
 * The type of metric, as understood by the Prometheus text exposition format.
 */
public enum MetricType {
    /**
     * A cumulative metric that represents a single monotonically increasing counter value.
     */
    COUNTER,
    /**
     * A metric that represents a single numerical value that can arbitrarily go up and down.
     */
    GAUGE,
    /**
     * A metric that samples observations into cumulative buckets and tracks their sum and count.
     */
    HISTOGRAM
}
