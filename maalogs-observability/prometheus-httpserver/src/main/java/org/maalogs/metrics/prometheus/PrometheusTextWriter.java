// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.prometheus;

import static java.lang.System.Logger.Level.WARNING;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import org.maalogs.metrics.core.HistogramMeasurementSnapshot;
import org.maalogs.metrics.core.LabelValues;
import org.maalogs.metrics.core.LongMeasurementSnapshot;
import org.maalogs.metrics.core.MeasurementSnapshot;
import org.maalogs.metrics.core.MetricRegistrySnapshot;
import org.maalogs.metrics.core.MetricSnapshot;
import org.maalogs.metrics.core.MetricType;
import org.maalogs.metrics.core.MetricUtils;

/**
 * Writes metrics in the Prometheus text exposition format, version 0.0.4.
 * <p>
 * Every metric starts with its {@code # HELP} and {@code # TYPE} lines, followed by one sample per line.
 * Histograms are written as {@code _bucket} samples with an {@code le} label per bound, including {@code +Inf},
 * then {@code _sum} and {@code _count}.
 *
 * <p>See <a href="https://prometheus.io/docs/instrumenting/exposition_formats/">Exposition formats</a> for details.
 */
final class PrometheusTextWriter {

    private static final System.Logger logger = System.getLogger(PrometheusTextWriter.class.getName());

    private static final EnumMap<MetricType, byte[]> METRIC_TYPES = new EnumMap<>(MetricType.class);
    private static final byte[] UNTYPED = "untyped".getBytes(StandardCharsets.UTF_8);

    static {
        METRIC_TYPES.put(MetricType.GAUGE, "gauge".getBytes(StandardCharsets.UTF_8));
        METRIC_TYPES.put(MetricType.COUNTER, "counter".getBytes(StandardCharsets.UTF_8));
        METRIC_TYPES.put(MetricType.HISTOGRAM, "histogram".getBytes(StandardCharsets.UTF_8));
    }

    private static final byte COMMA = ',';
    private static final byte QUOTE = '"';
    private static final byte SPACE = ' ';
    private static final byte NEW_LINE = '\n';
    private static final byte OPEN_BRACKET = '{';
    private static final byte CLOSE_BRACKET = '}';
    private static final byte[] EQUALS_QUOTE = "=\"".getBytes(StandardCharsets.UTF_8);

    private static final byte[] BUCKET_SUFFIX = "_bucket".getBytes(StandardCharsets.UTF_8);
    private static final byte[] SUM_SUFFIX = "_sum".getBytes(StandardCharsets.UTF_8);
    private static final byte[] COUNT_SUFFIX = "_count".getBytes(StandardCharsets.UTF_8);
    private static final byte[] LE_LABEL = MetricUtils.BUCKET_LABEL.getBytes(StandardCharsets.UTF_8);

    private static final byte[] TYPE = "# TYPE ".getBytes(StandardCharsets.UTF_8);
    private static final byte[] HELP = "# HELP ".getBytes(StandardCharsets.UTF_8);

    private static final String POSITIVE_INF = "+Inf";
    private static final String NEGATIVE_INF = "-Inf";
    private static final String NAN = "NaN";

    // integral doubles up to this magnitude are written without fraction
    private static final double MAX_EXACT_INTEGRAL = 1e15;

    void write(MetricRegistrySnapshot registrySnapshot, OutputStream output) throws IOException {
        for (MetricSnapshot metricSnapshot : registrySnapshot) {
            writeMetric(metricSnapshot, output);
        }
        output.flush();
    }

    private void writeMetric(MetricSnapshot metricSnapshot, OutputStream output) throws IOException {
        byte[] metricNameBytes = writeMetricMetadata(metricSnapshot, output);

        for (MeasurementSnapshot measurementSnapshot : metricSnapshot) {
            if (measurementSnapshot instanceof LongMeasurementSnapshot longSnapshot) {
                writeSample(metricNameBytes, null, metricSnapshot, measurementSnapshot, null, output);
                writeValue(Long.toString(longSnapshot.get()), output);
            } else if (measurementSnapshot instanceof HistogramMeasurementSnapshot histogramSnapshot) {
                writeHistogram(metricNameBytes, metricSnapshot, histogramSnapshot, output);
            } else {
                logger.log(
                        WARNING,
                        "Skipping unsupported measurement snapshot type: {0}",
                        measurementSnapshot.getClass().getName());
            }
        }
    }

    private void writeHistogram(
            byte[] metricNameBytes,
            MetricSnapshot metricSnapshot,
            HistogramMeasurementSnapshot snapshot,
            OutputStream output)
            throws IOException {
        for (int i = 0; i < snapshot.bucketCount(); i++) {
            String bound = formatDouble(snapshot.upperBound(i));
            writeSample(metricNameBytes, BUCKET_SUFFIX, metricSnapshot, snapshot, bound, output);
            writeValue(Long.toString(snapshot.cumulativeCount(i)), output);
        }
        writeSample(metricNameBytes, BUCKET_SUFFIX, metricSnapshot, snapshot, POSITIVE_INF, output);
        writeValue(Long.toString(snapshot.count()), output);

        writeSample(metricNameBytes, SUM_SUFFIX, metricSnapshot, snapshot, null, output);
        writeValue(formatDouble(snapshot.sum()), output);

        writeSample(metricNameBytes, COUNT_SUFFIX, metricSnapshot, snapshot, null, output);
        writeValue(Long.toString(snapshot.count()), output);
    }

    private byte[] writeMetricMetadata(MetricSnapshot metricSnapshot, OutputStream output) throws IOException {
        byte[] metricNameBytes = metricSnapshot.name().getBytes(StandardCharsets.UTF_8);

        String description = metricSnapshot.description();
        if (description != null && !description.isBlank()) {
            output.write(HELP);
            output.write(metricNameBytes);
            output.write(SPACE);
            output.write(escapeHelp(description).getBytes(StandardCharsets.UTF_8));
            output.write(NEW_LINE);
        }

        output.write(TYPE);
        output.write(metricNameBytes);
        output.write(SPACE);
        output.write(METRIC_TYPES.getOrDefault(metricSnapshot.type(), UNTYPED));
        output.write(NEW_LINE);

        return metricNameBytes;
    }

    private void writeSample(
            byte[] metricNameBytes,
            byte[] suffix,
            MetricSnapshot metricSnapshot,
            MeasurementSnapshot measurementSnapshot,
            String bucketBound,
            OutputStream output)
            throws IOException {
        output.write(metricNameBytes);
        if (suffix != null) {
            output.write(suffix);
        }

        if (!metricSnapshot.labelNames().isEmpty() || bucketBound != null) {
            output.write(OPEN_BRACKET);
            boolean firstLabel = appendLabels(metricSnapshot, measurementSnapshot, output);
            if (bucketBound != null) {
                appendLabel(LE_LABEL, bucketBound, output, firstLabel);
            }
            output.write(CLOSE_BRACKET);
        }

        output.write(SPACE);
    }

    private void writeValue(String value, OutputStream output) throws IOException {
        output.write(value.getBytes(StandardCharsets.UTF_8));
        output.write(NEW_LINE);
    }

    // returns whether nothing was written
    private boolean appendLabels(
            MetricSnapshot metricSnapshot, MeasurementSnapshot measurementSnapshot, OutputStream output)
            throws IOException {
        List<String> labelNames = metricSnapshot.labelNames();
        LabelValues labelValues = measurementSnapshot.labelValues();

        boolean firstLabel = true;
        for (int i = 0; i < labelNames.size(); i++) {
            firstLabel = appendLabel(
                    labelNames.get(i).getBytes(StandardCharsets.UTF_8), labelValues.get(i), output, firstLabel);
        }
        return firstLabel;
    }

    private boolean appendLabel(byte[] name, String value, OutputStream output, boolean firstLabel)
            throws IOException {
        if (!firstLabel) {
            output.write(COMMA);
        }
        output.write(name);
        output.write(EQUALS_QUOTE);
        output.write(escapeLabelValue(value).getBytes(StandardCharsets.UTF_8));
        output.write(QUOTE);
        return false;
    }

    /**
     * Formats a sample value: integral values without fraction, others in their shortest decimal form,
     * infinities as {@code +Inf} / {@code -Inf} and {@code NaN}.
     *
     * @param value the value to format
     * @return the formatted value
     */
    static String formatDouble(double value) {
        if (value == Double.POSITIVE_INFINITY) {
            return POSITIVE_INF;
        } else if (value == Double.NEGATIVE_INFINITY) {
            return NEGATIVE_INF;
        } else if (Double.isNaN(value)) {
            return NAN;
        } else if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_INTEGRAL) {
            return Long.toString((long) value);
        } else {
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
    }

    /**
     * Escape backslash {@code \}, double quote {@code "} and newline {@code \n} characters in label values.
     */
    static String escapeLabelValue(final String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    /**
     * Escape backslash {@code \} and newline {@code \n} characters in help text.
     */
    static String escapeHelp(final String value) {
        return value.replace("\\", "\\\\").replace("\n", "\\n");
    }
}
