// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.util.function.Supplier;

/**
 * Interface for exporting a {@link MetricRegistry}.
 * <p>
 * Implementations pull {@link MetricRegistrySnapshot}s from the supplier whenever they need to expose
 * the current values, e.g. on each scrape request. The supplier is thread-safe.
 *
 * @see MetricRegistry.Builder#setMetricsExporter(MetricsExporter)
 */
public interface MetricsExporter extends Closeable {

    /**
     * Initialize the exporter with a supplier of {@link MetricRegistrySnapshot}.
     * Implementations should be able to handle multiple calls to this method, the last supplier wins.
     *
     * @param snapshotSupplier the supplier of {@link MetricRegistrySnapshot}
     */
    void setSnapshotSupplier(@NonNull Supplier<MetricRegistrySnapshot> snapshotSupplier);
}
