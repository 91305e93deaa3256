// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Classifies the standard output of a command.
 * <p>
 * The whole trimmed output must be either a decimal number, such as {@code 42}, {@code 5.}, {@code -1.5}
 * or {@code 2e3}, or a JSON object whose values are all numbers, such as {@code {"health": 200, "DB": 1}}.
 * {@code NaN}, {@code Infinity}, hexadecimal literals and type suffixes are not numbers.
 * Thread-safe.
 */
public final class OutputClassifier {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final ObjectMapper objectMapper;

    public OutputClassifier() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    OutputClassifier(@NonNull ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "object mapper must not be null");
    }

    /**
     * @param stdout the captured standard output
     * @return {@link CommandOutput.Numeric}, {@link CommandOutput.Labelled} or {@link CommandOutput.ParseFailure}
     */
    @NonNull
    public CommandOutput classify(@NonNull String stdout) {
        Objects.requireNonNull(stdout, "output must not be null");
        final String output = stdout.trim();

        if (NUMBER.matcher(output).matches()) {
            return new CommandOutput.Numeric(Double.parseDouble(output));
        }
        if (output.startsWith("{")) {
            return classifyObject(output);
        }
        return new CommandOutput.ParseFailure(output);
    }

    private CommandOutput classifyObject(String output) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            return new CommandOutput.ParseFailure(output);
        }
        if (root == null || !root.isObject()) {
            return new CommandOutput.ParseFailure(output);
        }

        final Map<String, Double> values = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                return new CommandOutput.ParseFailure(output);
            }
            values.put(field.getKey(), field.getValue().doubleValue());
        }
        return new CommandOutput.Labelled(values);
    }
}
