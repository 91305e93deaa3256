// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Arrays;
import java.util.List;

/**
 * Label values of one sample, ordered like the label names of the metric it belongs to.
 */
public final class LabelValues {

    static final LabelValues EMPTY = new LabelValues();

    private final String[] values;

    private int hashCode = 0;

    LabelValues(String... values) {
        this.values = values;
    }

    /**
     * @return number of label values (is equal to number of label names of the metric it belongs to)
     */
    public int size() {
        return values.length;
    }

    /**
     * Get the label value at the specified index.
     *
     * @param index the index of the label value to retrieve
     * @return the label value at the specified index
     * @throws IndexOutOfBoundsException if index is out of range
     */
    @NonNull
    public String get(int index) {
        return values[index];
    }

    /**
     * @return the values as unmodifiable list
     */
    @NonNull
    public List<String> asList() {
        return List.of(values);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof LabelValues that && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        int h = hashCode;
        if (h == 0) {
            h = Arrays.hashCode(values);
            hashCode = h;
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(values.length * 16);
        sb.append('[');
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(values[i]);
        }
        return sb.append(']').toString();
    }
}
