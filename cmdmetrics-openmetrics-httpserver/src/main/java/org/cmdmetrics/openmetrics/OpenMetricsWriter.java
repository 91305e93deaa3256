// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.openmetrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.List;
import java.util.Locale;
import org.cmdmetrics.core.LabelValues;
import org.cmdmetrics.core.MetricRegistrySnapshot;
import org.cmdmetrics.core.MetricSnapshot;
import org.cmdmetrics.core.MetricType;

/**
 * A writer that writes metrics in the Prometheus text format or in the OpenMetrics text format.
 * <p>
 * Each metric is written as a {@code # HELP} and a {@code # TYPE} line followed by one line per sample.
 * Counter samples always carry the {@code _total} suffix. In OpenMetrics the family name in metadata lines
 * is the name without that suffix and the output ends with {@code # EOF}.
 * <p>
 * Values are written in the shortest form that parses back to the same double, e.g. {@code 42}, {@code 0.25}
 * or {@code 1.5E-12}, unless a {@link DecimalFormat} pattern is given.
 * <p>
 * This class in not thread-safe, due to the use of {@link DecimalFormat}.
 *
 * <p>See <a href="https://github.com/prometheus/OpenMetrics/blob/main/specification/OpenMetrics.md">OpenMetrics</a>
 * and <a href="https://prometheus.io/docs/instrumenting/exposition_formats/">Exposition formats</a> for details.
 */
class OpenMetricsWriter {

    private static final String COUNTER_SUFFIX = "_total";

    private static final byte COMMA = ',';
    private static final byte QUOTE = '"';
    private static final byte SPACE = ' ';
    private static final byte NEW_LINE = '\n';
    private static final byte OPEN_BRACKET = '{';
    private static final byte CLOSE_BRACKET = '}';
    private static final byte[] EQUALS_QUOTE = "=\"".getBytes(StandardCharsets.UTF_8);

    private static final byte[] TYPE = "# TYPE ".getBytes(StandardCharsets.UTF_8);
    private static final byte[] HELP = "# HELP ".getBytes(StandardCharsets.UTF_8);

    private static final byte[] END = "# EOF\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] POSITIVE_INF = "+Inf".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NEGATIVE_INF = "-Inf".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NAN = "NaN".getBytes(StandardCharsets.UTF_8);

    // whole values below this magnitude are written without exponent
    private static final double MAX_PLAIN_INTEGER = 1e15;

    @Nullable
    private final DecimalFormat formatter;

    /**
     * @param decimalFormat the {@link DecimalFormat} pattern of values, empty for the shortest exact form
     */
    OpenMetricsWriter(@NonNull String decimalFormat) {
        formatter = decimalFormat.isEmpty()
                ? null
                : new DecimalFormat(decimalFormat, DecimalFormatSymbols.getInstance(Locale.ROOT));
    }

    final void write(
            @NonNull MetricRegistrySnapshot registrySnapshot,
            @NonNull ExpositionFormat format,
            @NonNull OutputStream output)
            throws IOException {
        for (MetricSnapshot metricSnapshot : registrySnapshot) {
            writeMetric(metricSnapshot, format, output);
        }

        if (format == ExpositionFormat.OPENMETRICS) {
            output.write(END);
        }
        output.flush();
    }

    private void writeMetric(MetricSnapshot metricSnapshot, ExpositionFormat format, OutputStream output)
            throws IOException {
        final String sampleName = sampleName(metricSnapshot);
        final String familyName = format == ExpositionFormat.OPENMETRICS ? familyName(metricSnapshot) : sampleName;
        final byte[] familyNameBytes = familyName.getBytes(StandardCharsets.UTF_8);

        output.write(HELP);
        output.write(familyNameBytes);
        output.write(SPACE);
        output.write(escapeHelp(metricSnapshot.help(), format).getBytes(StandardCharsets.UTF_8));
        output.write(NEW_LINE);

        output.write(TYPE);
        output.write(familyNameBytes);
        output.write(SPACE);
        output.write(metricSnapshot.type().typeName().getBytes(StandardCharsets.UTF_8));
        output.write(NEW_LINE);

        final byte[] sampleNameBytes = sampleName.getBytes(StandardCharsets.UTF_8);
        for (MetricSnapshot.Sample sample : metricSnapshot.samples()) {
            output.write(sampleNameBytes);
            writeLabels(metricSnapshot.labelNames(), sample.labelValues(), output);
            output.write(SPACE);
            output.write(convertValue(sample.value()));
            output.write(NEW_LINE);
        }
    }

    private static String sampleName(MetricSnapshot metricSnapshot) {
        String name = metricSnapshot.name();
        if (metricSnapshot.type() == MetricType.COUNTER && !name.endsWith(COUNTER_SUFFIX)) {
            return name + COUNTER_SUFFIX;
        }
        return name;
    }

    private static String familyName(MetricSnapshot metricSnapshot) {
        String name = metricSnapshot.name();
        if (metricSnapshot.type() == MetricType.COUNTER && name.endsWith(COUNTER_SUFFIX)) {
            return name.substring(0, name.length() - COUNTER_SUFFIX.length());
        }
        return name;
    }

    private void writeLabels(List<String> labelNames, LabelValues labelValues, OutputStream output)
            throws IOException {
        if (labelNames.isEmpty()) {
            return;
        }

        output.write(OPEN_BRACKET);
        for (int i = 0; i < labelNames.size(); i++) {
            if (i > 0) {
                output.write(COMMA);
            }
            output.write(labelNames.get(i).getBytes(StandardCharsets.UTF_8));
            output.write(EQUALS_QUOTE);
            output.write(escapeLabelValue(labelValues.get(i)).getBytes(StandardCharsets.UTF_8));
            output.write(QUOTE);
        }
        output.write(CLOSE_BRACKET);
    }

    private byte[] convertValue(double value) {
        if (value == Double.POSITIVE_INFINITY) {
            return POSITIVE_INF;
        } else if (value == Double.NEGATIVE_INFINITY) {
            return NEGATIVE_INF;
        } else if (Double.isNaN(value)) {
            return NAN;
        } else if (formatter != null) {
            return formatter.format(value).getBytes(StandardCharsets.UTF_8);
        } else {
            return formatShortest(value).getBytes(StandardCharsets.UTF_8);
        }
    }

    private static String formatShortest(double value) {
        if (value == Math.rint(value) && Math.abs(value) < MAX_PLAIN_INTEGER) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Escape newline {@code \n}, double quote {@code "} and backslash {@code \} characters in label values.
     *
     * @param value the string value to escape
     * @return the escaped string
     */
    private static String escapeLabelValue(final String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    /**
     * Escape help text. Prometheus text format keeps double quotes in help text as they are.
     */
    private static String escapeHelp(final String value, final ExpositionFormat format) {
        if (format == ExpositionFormat.OPENMETRICS) {
            return escapeLabelValue(value);
        }
        return value.replace("\\", "\\\\").replace("\n", "\\n");
    }
}
