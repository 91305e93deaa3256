// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.exec;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.cmdmetrics.exporter.job.Job;

/**
 * Base class of the failures of a single command run. None of them affects other runs.
 */
public abstract class CommandExecutionException extends Exception {

    private final transient Job job;

    protected CommandExecutionException(@NonNull Job job, @NonNull String message) {
        super(message);
        this.job = Objects.requireNonNull(job, "job must not be null");
    }

    protected CommandExecutionException(@NonNull Job job, @NonNull String message, Throwable cause) {
        super(message, cause);
        this.job = Objects.requireNonNull(job, "job must not be null");
    }

    /**
     * @return the job whose run failed
     */
    @NonNull
    public Job getJob() {
        return job;
    }
}
