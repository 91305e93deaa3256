// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.job;

/**
 * Thrown when a job definition file or one of its entries cannot be turned into a {@link Job}.
 */
public class JobDefinitionException extends Exception {

    public JobDefinitionException(String message) {
        super(message);
    }

    public JobDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
