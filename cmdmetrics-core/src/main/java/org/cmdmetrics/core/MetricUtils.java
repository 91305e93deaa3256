// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Utility class for metrics-related validations.
 */
public final class MetricUtils {

    /** Regex for validating metric names. */
    public static final String METRIC_NAME_REGEX = "^[a-zA-Z_:][a-zA-Z0-9_:]*$";

    /** Regex for validating label names. */
    public static final String LABEL_NAME_REGEX = "^[a-zA-Z_][a-zA-Z0-9_]*$";

    private static final Pattern METRIC_NAME_PATTERN = Pattern.compile(METRIC_NAME_REGEX);
    private static final Pattern LABEL_NAME_PATTERN = Pattern.compile(LABEL_NAME_REGEX);

    /** Prefix of label names reserved for internal use by scrapers. */
    private static final String RESERVED_LABEL_PREFIX = "__";

    private MetricUtils() {}

    /**
     * Validates that the provided metric name adheres to the required character set. <br>
     * Pattern to validate is: {@value #METRIC_NAME_REGEX} <br>
     * Definition in ABNF (Augmented Backus-Naur Form):
     * <pre>
     *   name = name-initial-char *name-char
     *   name-initial-char = ALPHA / "_" / ":"
     *   name-char = name-initial-char / DIGIT
     * </pre>
     * @param metricName the name to validate
     * @return the validated name
     * @throws NullPointerException if metric name is {@code null}
     * @throws IllegalArgumentException if metric name is blank or contains invalid characters
     */
    @NonNull
    public static String validateMetricNameCharacters(String metricName) {
        return validateNameCharacters(METRIC_NAME_PATTERN, metricName);
    }

    /**
     * Validates that the provided label name adheres to the required character set
     * and does not use the reserved {@code __} prefix. <br>
     * Pattern to validate is: {@value #LABEL_NAME_REGEX}
     *
     * @param labelName the label name to validate
     * @return the validated name
     * @throws NullPointerException if label name is {@code null}
     * @throws IllegalArgumentException if label name is blank, contains invalid characters or is reserved
     */
    @NonNull
    public static String validateLabelNameCharacters(String labelName) {
        validateNameCharacters(LABEL_NAME_PATTERN, labelName);
        if (labelName.startsWith(RESERVED_LABEL_PREFIX)) {
            throw new IllegalArgumentException("Label name must not start with '__': " + labelName);
        }
        return labelName;
    }

    private static String validateNameCharacters(Pattern pattern, String name) {
        MetricUtils.throwArgBlank(name, "name");
        if (!pattern.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "Name contains illegal character: " + name + ". Required pattern is " + pattern.pattern());
        }
        return name;
    }

    /**
     * Validates that provided argument is not null or blank.
     *
     * @param argument     the argument checked
     * @param argumentName the name of the argument
     * @return the validated argument
     * @throws NullPointerException of passed argument is {@code null}
     * @throws IllegalArgumentException of passed argument is blank using {@link String#isBlank()}
     */
    @NonNull
    public static String throwArgBlank(@NonNull final String argument, @NonNull final String argumentName)
            throws NullPointerException, IllegalArgumentException {
        Objects.requireNonNull(argument, argumentName + " cannot be null");
        if (argument.isBlank()) {
            throw new IllegalArgumentException(argumentName + " cannot be blank");
        }
        return argument;
    }
}
