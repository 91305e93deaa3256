// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.exec;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.cmdmetrics.core.LabelResolver;

/**
 * The classified standard output of a command run.
 *
 * @see OutputClassifier#classify(String)
 */
public sealed interface CommandOutput {

    /**
     * @return the observations of this output, empty for a {@link ParseFailure}
     */
    @NonNull
    List<Observation> observations();

    /**
     * The output is a single number, observed as component {@value LabelResolver#MAIN_COMPONENT}.
     *
     * @param value the number
     */
    record Numeric(double value) implements CommandOutput {

        @NonNull
        @Override
        public List<Observation> observations() {
            return List.of(new Observation(LabelResolver.MAIN_COMPONENT, value));
        }
    }

    /**
     * The output is a JSON object of numbers, each key observed as a component.
     *
     * @param values the numbers by component in output order
     */
    record Labelled(@NonNull Map<String, Double> values) implements CommandOutput {

        public Labelled {
            Objects.requireNonNull(values, "values must not be null");
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        @NonNull
        @Override
        public List<Observation> observations() {
            List<Observation> observations = new ArrayList<>(values.size());
            values.forEach((component, value) -> observations.add(new Observation(component, value)));
            return observations;
        }
    }

    /**
     * The output has neither supported shape.
     *
     * @param raw the trimmed output
     */
    record ParseFailure(@NonNull String raw) implements CommandOutput {

        @NonNull
        @Override
        public List<Observation> observations() {
            return List.of();
        }
    }
}
