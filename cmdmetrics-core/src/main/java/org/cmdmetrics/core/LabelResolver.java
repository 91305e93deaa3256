// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * Builds the label set of a single observation from global labels, job labels and the runtime component.
 * <p>
 * Merge order is fixed: global labels first, then job labels overriding global values with the same name.
 * A {@value #COMPONENT_LABEL} label supplied by configuration is renamed to {@value #USER_DEFINED_COMPONENT_LABEL},
 * because {@value #COMPONENT_LABEL} is always assigned from the command output.
 */
public final class LabelResolver {

    /** Label carrying the sub-measurement name of a command output. */
    public static final String COMPONENT_LABEL = "component";

    /** Name a configured {@value #COMPONENT_LABEL} label is exposed under. */
    public static final String USER_DEFINED_COMPONENT_LABEL = "user_defined_component";

    /** Component of an output consisting of a single number. */
    public static final String MAIN_COMPONENT = "main";

    private LabelResolver() {}

    /**
     * Resolves the labels of an observation.
     *
     * @param globalLabels the global labels, must not be {@code null}
     * @param jobLabels    the job labels, must not be {@code null}
     * @param component    the component of the observation, must not be {@code null}
     * @return the merged label set, ending with {@value #COMPONENT_LABEL}
     * @throws NullPointerException if any argument is {@code null}
     */
    @NonNull
    public static LabelSet resolve(
            @NonNull LabelSet globalLabels, @NonNull LabelSet jobLabels, @NonNull String component) {
        Objects.requireNonNull(globalLabels, "global labels must not be null");
        Objects.requireNonNull(jobLabels, "job labels must not be null");
        Objects.requireNonNull(component, "component must not be null");

        LabelSet.Builder builder = LabelSet.builder().putAll(globalLabels).putAll(jobLabels);

        String userComponent = builder.remove(COMPONENT_LABEL);
        if (userComponent != null) {
            builder.put(USER_DEFINED_COMPONENT_LABEL, userComponent);
        }

        return builder.put(COMPONENT_LABEL, component).build();
    }
}
