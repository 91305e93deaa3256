// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable, insertion ordered mapping of label names to label values.
 * <p>
 * Label names are validated on insertion, values may be empty but never {@code null}.
 * Two label sets are equal if they contain the same mappings, regardless of their order.
 * New label sets are created via {@link #builder()} or {@link #of(Map)}.
 */
public final class LabelSet {

    private static final LabelSet EMPTY = new LabelSet(new LinkedHashMap<>());

    private final Map<String, String> labels;

    private LabelSet(LinkedHashMap<String, String> labels) {
        this.labels = Collections.unmodifiableMap(labels);
    }

    /**
     * @return the empty label set
     */
    @NonNull
    public static LabelSet empty() {
        return EMPTY;
    }

    /**
     * Creates a label set from the given map, keeping the iteration order of the map.
     *
     * @param labels the label names and values, must not be {@code null}
     * @return the created label set
     * @throws NullPointerException if the map, any name or any value is {@code null}
     * @throws IllegalArgumentException if any label name is invalid
     */
    @NonNull
    public static LabelSet of(@NonNull Map<String, String> labels) {
        Objects.requireNonNull(labels, "labels must not be null");
        Builder builder = builder();
        labels.forEach(builder::put);
        return builder.build();
    }

    /**
     * @return a new empty {@link Builder}
     */
    @NonNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a new {@link Builder} initialized with the labels of this set
     */
    @NonNull
    public Builder toBuilder() {
        return new Builder().putAll(this);
    }

    /**
     * @return the label names in insertion order, unmodifiable
     */
    @NonNull
    public Set<String> names() {
        return labels.keySet();
    }

    /**
     * @param name the label name
     * @return the label value or {@code null} if there is no such label
     */
    @Nullable
    public String get(@NonNull String name) {
        return labels.get(name);
    }

    public boolean contains(@NonNull String name) {
        return labels.containsKey(name);
    }

    public int size() {
        return labels.size();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    /**
     * @return unmodifiable map view of this label set in insertion order
     */
    @NonNull
    public Map<String, String> asMap() {
        return labels;
    }

    /**
     * @return the labels of this set as list in insertion order
     */
    @NonNull
    public List<Label> labels() {
        List<Label> result = new ArrayList<>(labels.size());
        labels.forEach((name, value) -> result.add(new Label(name, value)));
        return result;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof LabelSet that && labels.equals(that.labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return labels.toString();
    }

    /**
     * Builder of {@link LabelSet} instances. Putting an existing name replaces its value and keeps its position.
     */
    public static final class Builder {

        private final LinkedHashMap<String, String> labels = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Puts a label into the set, replacing the value of an existing label with the same name.
         *
         * @param name  the label name, must match {@value MetricUtils#LABEL_NAME_REGEX}
         * @param value the label value, must not be {@code null}
         * @return this builder
         */
        @NonNull
        public Builder put(@NonNull String name, @NonNull String value) {
            MetricUtils.validateLabelNameCharacters(name);
            Objects.requireNonNull(value, "label value must not be null for label: " + name);
            labels.put(name, value);
            return this;
        }

        /**
         * Puts all labels of the given set, overriding values of labels with the same name.
         *
         * @param other the labels to add, must not be {@code null}
         * @return this builder
         */
        @NonNull
        public Builder putAll(@NonNull LabelSet other) {
            Objects.requireNonNull(other, "labels must not be null");
            labels.putAll(other.labels);
            return this;
        }

        /**
         * Removes the label with the given name.
         *
         * @param name the label name
         * @return the removed value or {@code null} if there was no such label
         */
        @Nullable
        public String remove(@NonNull String name) {
            return labels.remove(name);
        }

        public boolean contains(@NonNull String name) {
            return labels.containsKey(name);
        }

        @NonNull
        public LabelSet build() {
            if (labels.isEmpty()) {
                return EMPTY;
            }
            return new LabelSet(new LinkedHashMap<>(labels));
        }
    }
}
