// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * A label is an immutable name-value pair attached to a sample to differentiate series within the same metric.
 */
public record Label(@NonNull String name, @NonNull String value) {

    /**
     * Constructs a new label with the specified name and value.
     *
     * @param name  the name of the label, must match {@value MetricUtils#LABEL_NAME_REGEX}
     * @param value the value of the label, may be empty but not {@code null}
     * @throws NullPointerException if name or value is {@code null}
     * @throws IllegalArgumentException if name is blank or doesn't match regex {@value MetricUtils#LABEL_NAME_REGEX}
     */
    public Label {
        MetricUtils.validateLabelNameCharacters(name);
        Objects.requireNonNull(value, "label value must not be null");
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
