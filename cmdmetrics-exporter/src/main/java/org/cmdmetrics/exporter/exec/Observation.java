// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.exec;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * One value produced by a command run.
 *
 * @param component the sub-measurement name, {@code main} for a scalar output
 * @param value     the value
 */
public record Observation(@NonNull String component, double value) {

    public Observation {
        Objects.requireNonNull(component, "component must not be null");
    }
}
