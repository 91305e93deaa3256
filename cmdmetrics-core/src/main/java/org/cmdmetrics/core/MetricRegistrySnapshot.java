// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Iterator;
import java.util.List;

/**
 * A snapshot of all metrics in a {@link MetricRegistry} at a specific point in time, allowing iteration over
 * {@link MetricSnapshot}s in registration order.
 * <p>
 * Each metric snapshot is consistent on its own. Different metrics may be copied at slightly different times.
 */
public final class MetricRegistrySnapshot implements Iterable<MetricSnapshot> {

    private final List<MetricSnapshot> snapshots;

    MetricRegistrySnapshot(@NonNull List<MetricSnapshot> snapshots) {
        this.snapshots = List.copyOf(snapshots);
    }

    @NonNull
    @Override
    public Iterator<MetricSnapshot> iterator() {
        return snapshots.iterator();
    }

    /**
     * @return the metric snapshots in registration order
     */
    @NonNull
    public List<MetricSnapshot> metrics() {
        return snapshots;
    }

    /**
     * @param metricName the metric name
     * @return the snapshot of the metric with the given name or {@code null} if not registered
     */
    @Nullable
    public MetricSnapshot get(@NonNull String metricName) {
        for (MetricSnapshot snapshot : snapshots) {
            if (snapshot.name().equals(metricName)) {
                return snapshot;
            }
        }
        return null;
    }

    public int size() {
        return snapshots.size();
    }
}
