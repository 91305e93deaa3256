// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.exec;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import org.cmdmetrics.exporter.job.Job;

/**
 * The command did not finish in time and was killed.
 */
public class CommandTimeoutException extends CommandExecutionException {

    private final Duration timeout;

    public CommandTimeoutException(Job job, @NonNull Duration timeout) {
        super(job, "Command " + job.command() + " did not finish within " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    @NonNull
    public Duration getTimeout() {
        return timeout;
    }
}
