// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A snapshot of a measurement that holds a single {@code long} value.
 */
public final class LongMeasurementSnapshot extends MeasurementSnapshot {

    private final long value;

    public LongMeasurementSnapshot(@NonNull LabelValues labelValues, long value) {
        super(labelValues);
        this.value = value;
    }

    /**
     * @return the {@code long} value of this measurement snapshot
     */
    public long get() {
        return value;
    }

    @Override
    public String toString() {
        return "{" + super.toString() + ", value=" + value + "}";
    }
}
