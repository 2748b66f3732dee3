// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.List;

/**
 * What an exporter needs to know about a metric besides its values.
 */
public interface MetricInfo {

    @NonNull
    MetricType type();

    @NonNull
    String name();

    /**
     * @return the help text, or {@code null} if the metric has none
     */
    @Nullable
    String description();

    /**
     * @return the label names in alphabetical order, possibly empty
     */
    @NonNull
    List<String> labelNames();
}
