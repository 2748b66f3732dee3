// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * Values of the labels identifying one series of a metric, e.g. {@code command="greet", status="success"}.
 * <p>
 * Instances are created by {@link Metric#toLabelValues(String...)}, which orders the pairs by label name,
 * so two instances for the same series are always equal regardless of the order the caller passed the labels in.
 */
public final class LabelValues implements Comparable<LabelValues> {

    static final LabelValues EMPTY = new LabelValues();

    private final String[] namesAndValues;

    private int hashCode = 0;

    LabelValues(String... namesAndValues) {
        this.namesAndValues = namesAndValues;
    }

    /**
     * @return number of label values, equal to the number of label names of the owning metric
     */
    public int size() {
        return namesAndValues.length / 2;
    }

    /**
     * @param index the index of the label value, in the order of the metric's label names
     * @return the label value at the specified index
     */
    @NonNull
    public String get(int index) {
        return namesAndValues[2 * index + 1];
    }

    @Override
    public int compareTo(@NonNull LabelValues other) {
        int sizeComparison = Integer.compare(size(), other.size());
        if (sizeComparison != 0) {
            return sizeComparison;
        }
        for (int i = 0; i < size(); i++) {
            int valueComparison = get(i).compareTo(other.get(i));
            if (valueComparison != 0) {
                return valueComparison;
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof LabelValues that) {
            if (size() != that.size()) {
                return false;
            }
            for (int i = 0; i < size(); i++) {
                if (!Objects.equals(get(i), that.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    @Override
    public int hashCode() {
        int h = hashCode;
        if (h == 0) {
            h = 1;
            for (int i = 0; i < size(); i++) {
                h = 31 * h + Objects.hashCode(get(i));
            }
            hashCode = h;
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(size() * 16);
        sb.append('[');
        for (int i = 0; i < size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(get(i));
        }
        return sb.append(']').toString();
    }
}
