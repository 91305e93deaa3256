// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.core;

import java.util.List;
import java.util.Set;

/**
 * Thrown when an observation carries label names that differ from the label names a metric was registered with.
 */
public class LabelMismatchException extends IllegalArgumentException {

    private final String metricName;
    private final List<String> expectedLabelNames;
    private final Set<String> actualLabelNames;

    public LabelMismatchException(String metricName, List<String> expectedLabelNames, Set<String> actualLabelNames) {
        super("Labels mismatch for metric " + metricName + ": registered with " + expectedLabelNames + ", got "
                + actualLabelNames);
        this.metricName = metricName;
        this.expectedLabelNames = List.copyOf(expectedLabelNames);
        this.actualLabelNames = Set.copyOf(actualLabelNames);
    }

    public String getMetricName() {
        return metricName;
    }

    public List<String> getExpectedLabelNames() {
        return expectedLabelNames;
    }

    public Set<String> getActualLabelNames() {
        return actualLabelNames;
    }
}
