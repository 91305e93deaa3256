// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.openmetrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.List;
import java.util.Locale;

/**
 * Text formats the metrics endpoint can answer with.
 */
public enum ExpositionFormat {
    /**
     * Prometheus text format 0.0.4, served unless the client asks for OpenMetrics.
     */
    PROMETHEUS_TEXT("text/plain; version=0.0.4; charset=utf-8"),
    /**
     * OpenMetrics text format 1.0.0, terminated by {@code # EOF}.
     */
    OPENMETRICS("application/openmetrics-text; version=1.0.0; charset=utf-8");

    private static final String OPENMETRICS_MEDIA_TYPE = "application/openmetrics-text";

    private final String contentType;

    ExpositionFormat(String contentType) {
        this.contentType = contentType;
    }

    /**
     * @return value of the {@code Content-Type} response header
     */
    @NonNull
    public String contentType() {
        return contentType;
    }

    /**
     * Selects the format from the values of the {@code Accept} request header.
     *
     * @param acceptHeaders the header values, {@code null} if the header is absent
     * @return {@link #OPENMETRICS} if any value names its media type, {@link #PROMETHEUS_TEXT} otherwise
     */
    @NonNull
    public static ExpositionFormat negotiate(@Nullable List<String> acceptHeaders) {
        if (acceptHeaders == null) {
            return PROMETHEUS_TEXT;
        }
        for (String acceptHeader : acceptHeaders) {
            if (acceptHeader.toLowerCase(Locale.ROOT).contains(OPENMETRICS_MEDIA_TYPE)) {
                return OPENMETRICS;
            }
        }
        return PROMETHEUS_TEXT;
    }
}
