// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.maalogs.metrics.core.LongMeasurementSnapshot;
import org.maalogs.metrics.core.MetricRegistry;
import org.maalogs.metrics.core.MetricSnapshot;
import org.maalogs.metrics.core.MetricType;

public class LongGaugeTest {

    @Test
    void testSet() {
        LongGauge gauge = LongGauge.builder("test_gauge").build();
        LongGauge.Series series = gauge.unlabeled();

        assertThat(gauge.type()).isEqualTo(MetricType.GAUGE);
        assertThat(series.get()).isEqualTo(0);

        series.set(5);
        series.set(-2);

        assertThat(series.get()).isEqualTo(-2);
        assertThat(gauge.unlabeled()).isSameAs(series);
    }

    @Test
    void testSnapshotOnlyAfterFirstAccess() {
        MetricRegistry registry = new MetricRegistry();
        LongGauge gauge = registry.register(LongGauge.builder("test_gauge"));

        assertThat(registry.snapshot().get("test_gauge").size()).isEqualTo(0);

        gauge.unlabeled().set(42);

        MetricSnapshot snapshot = registry.snapshot().get("test_gauge");
        assertThat(snapshot.size()).isEqualTo(1);
        LongMeasurementSnapshot measurement = (LongMeasurementSnapshot) snapshot.iterator().next();
        assertThat(measurement.get()).isEqualTo(42);
        assertThat(measurement.labelValues().size()).isEqualTo(0);
    }
}
