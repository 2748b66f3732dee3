// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * An immutable copy of one series of a {@link Metric}.
 */
public abstract class MeasurementSnapshot {

    private final LabelValues labelValues;

    protected MeasurementSnapshot(@NonNull LabelValues labelValues) {
        this.labelValues = Objects.requireNonNull(labelValues, "label values must not be null");
    }

    /**
     * @return the label values of the series, ordered like {@link MetricInfo#labelNames()}
     */
    @NonNull
    public LabelValues labelValues() {
        return labelValues;
    }

    @Override
    public String toString() {
        return "labelValues=" + labelValues;
    }
}
