// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Locale;
import java.util.Objects;

/**
 * The type of metric that is compliant with the text exposition formats.
 */
public enum MetricType {
    /**
     * A cumulative metric that represents a single monotonically increasing counter value.
     */
    COUNTER,
    /**
     * A metric that represents a single numerical value that can arbitrarily go up and down and set to any value.
     */
    GAUGE;

    /**
     * @return the lower case name used in job definitions and in {@code # TYPE} lines
     */
    @NonNull
    public String typeName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the metric type from its case-insensitive name, e.g. {@code gauge} or {@code Counter}.
     *
     * @param value the type name, must not be {@code null}
     * @return the parsed type
     * @throws NullPointerException if value is {@code null}
     * @throws IllegalArgumentException if value does not name a known type
     */
    @NonNull
    public static MetricType fromTypeName(@NonNull String value) {
        Objects.requireNonNull(value, "metric type must not be null");
        for (MetricType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown metric type: " + value);
    }
}
