// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cmdmetrics.core.LabelResolver;
import org.cmdmetrics.core.LabelSet;
import org.cmdmetrics.core.MetricType;

/**
 * Loads {@link Job}s from the JSON definition files of a directory.
 * <p>
 * Each file holds an optional {@code global_labels} object and a {@code scripts} array:
 * <pre>
 * {
 *   "global_labels": {"dc": "X"},
 *   "scripts": [
 *     {"script": "/opt/check.sh", "params": ["-v", "db"], "interval": 30, "metric": "service_check",
 *      "HELP": "Service check", "TYPE": "gauge", "labels": {"dc": "Y"}, "timeout": 10}
 *   ]
 * }
 * </pre>
 * Files are read in name order. A file that cannot be read or lacks the {@code scripts} array is skipped,
 * as is any invalid entry. Neither stops the remaining definitions from loading.
 */
public final class JobDefinitionLoader {

    private static final Logger logger = LogManager.getLogger(JobDefinitionLoader.class);

    /** Glob of definition files in the config directory. */
    public static final String DEFINITION_FILE_GLOB = "*.json";

    private static final String GLOBAL_LABELS = "global_labels";
    private static final String SCRIPTS = "scripts";
    private static final String SCRIPT = "script";
    private static final String PARAMS = "params";
    private static final String INTERVAL = "interval";
    private static final String METRIC = "metric";
    private static final String HELP = "HELP";
    private static final String TYPE = "TYPE";
    private static final String LABELS = "labels";
    private static final String TIMEOUT = "timeout";

    private final ObjectMapper objectMapper;

    public JobDefinitionLoader() {
        this(new ObjectMapper());
    }

    JobDefinitionLoader(@NonNull ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "object mapper must not be null");
    }

    /**
     * Loads the jobs of all definition files in the given directory.
     *
     * @param configDir the directory holding the definition files
     * @return the valid jobs in file name order, empty if there are none
     */
    @NonNull
    public List<Job> load(@NonNull Path configDir) {
        Objects.requireNonNull(configDir, "config dir must not be null");

        if (!Files.isDirectory(configDir)) {
            logger.error("Config directory {} does not exist or is not a directory", configDir.toAbsolutePath());
            return List.of();
        }

        final List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(configDir, DEFINITION_FILE_GLOB)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            logger.error("Failed to list config directory {}", configDir.toAbsolutePath(), e);
            return List.of();
        }
        files.sort(null);

        final List<Job> jobs = new ArrayList<>();
        for (Path file : files) {
            try {
                jobs.addAll(loadFile(file));
            } catch (JobDefinitionException e) {
                logger.error("Skipping config file {}: {}", file.toAbsolutePath(), e.getMessage());
            }
        }
        logger.info("Loaded {} job(s) from {} config file(s) in {}", jobs.size(), files.size(), configDir);
        return jobs;
    }

    /**
     * Loads the jobs of a single definition file. Invalid entries are logged and skipped.
     *
     * @param file the definition file
     * @return the valid jobs of the file in definition order
     * @throws JobDefinitionException if the file cannot be read, is no valid JSON or has no {@code scripts} array
     */
    @NonNull
    public List<Job> loadFile(@NonNull Path file) throws JobDefinitionException {
        final JsonNode root;
        try (InputStream input = Files.newInputStream(file)) {
            root = objectMapper.readTree(input);
        } catch (JsonProcessingException e) {
            throw new JobDefinitionException("not a valid JSON file", e);
        } catch (IOException e) {
            throw new JobDefinitionException("cannot be read: " + e, e);
        }

        if (root == null || !root.isObject()) {
            throw new JobDefinitionException("does not have the proper structure, expected a JSON object");
        }
        final JsonNode scripts = root.get(SCRIPTS);
        if (scripts == null || !scripts.isArray()) {
            throw new JobDefinitionException("does not have the proper structure, expected a '" + SCRIPTS + "' array");
        }

        final LabelSet globalLabels;
        try {
            globalLabels = parseLabels(root.get(GLOBAL_LABELS), GLOBAL_LABELS);
        } catch (IllegalArgumentException e) {
            throw new JobDefinitionException(e.getMessage(), e);
        }
        final String fileName = file.getFileName().toString();
        warnOnComponentLabel(globalLabels, fileName);

        final List<Job> jobs = new ArrayList<>(scripts.size());
        for (int i = 0; i < scripts.size(); i++) {
            final String id = fileName + "#" + i;
            try {
                Job job = parseJob(id, scripts.get(i), globalLabels);
                warnOnComponentLabel(job.labels(), id);
                logger.debug("Job {} scheduled to run {} every {}s", id, job.command(), job.interval().toSeconds());
                jobs.add(job);
            } catch (JobDefinitionException | IllegalArgumentException e) {
                logger.error("Skipping invalid job definition {}: {}", id, e.getMessage());
            }
        }
        return jobs;
    }

    private Job parseJob(String id, JsonNode entry, LabelSet globalLabels) throws JobDefinitionException {
        if (!entry.isObject()) {
            throw new JobDefinitionException("expected a JSON object");
        }

        final String script = requiredText(entry, SCRIPT);
        final String metric = requiredText(entry, METRIC);

        final Job.Builder builder = Job.builder(metric, parseCommand(script, entry.get(PARAMS)))
                .setId(id)
                .setGlobalLabels(globalLabels)
                .setLabels(parseLabels(entry.get(LABELS), LABELS));

        final Long interval = optionalPositiveSeconds(entry, INTERVAL);
        if (interval != null) {
            builder.setInterval(Duration.ofSeconds(interval));
        }
        final Long timeout = optionalPositiveSeconds(entry, TIMEOUT);
        if (timeout != null) {
            builder.setTimeout(Duration.ofSeconds(timeout));
        }
        final String help = optionalText(entry, HELP);
        if (help != null) {
            builder.setHelp(help);
        }
        final String type = optionalText(entry, TYPE);
        if (type != null) {
            builder.setType(MetricType.fromTypeName(type));
        }
        return builder.build();
    }

    /**
     * Joins script and params and splits the result on whitespace.
     */
    private static List<String> parseCommand(String script, @Nullable JsonNode params) throws JobDefinitionException {
        final StringBuilder commandLine = new StringBuilder(script);
        if (params != null && !params.isNull()) {
            if (params.isArray()) {
                for (JsonNode param : params) {
                    if (!param.isValueNode() || param.isNull()) {
                        throw new JobDefinitionException("'" + PARAMS + "' must only contain strings or numbers");
                    }
                    commandLine.append(' ').append(param.asText());
                }
            } else if (params.isValueNode()) {
                commandLine.append(' ').append(params.asText());
            } else {
                throw new JobDefinitionException("'" + PARAMS + "' must be an array");
            }
        }

        final String trimmed = commandLine.toString().trim();
        if (trimmed.isEmpty()) {
            throw new JobDefinitionException("'" + SCRIPT + "' must not be blank");
        }
        return List.of(trimmed.split("\\s+"));
    }

    private static LabelSet parseLabels(@Nullable JsonNode labels, String field) {
        if (labels == null || labels.isNull()) {
            return LabelSet.empty();
        }
        if (!labels.isObject()) {
            throw new IllegalArgumentException("'" + field + "' must be a JSON object");
        }

        final LabelSet.Builder builder = LabelSet.builder();
        final Iterator<Map.Entry<String, JsonNode>> fields = labels.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> label = fields.next();
            if (!label.getValue().isValueNode() || label.getValue().isNull()) {
                throw new IllegalArgumentException(
                        "value of label '" + label.getKey() + "' in '" + field + "' must be a string or number");
            }
            builder.put(label.getKey(), label.getValue().asText());
        }
        return builder.build();
    }

    private static void warnOnComponentLabel(LabelSet labels, String source) {
        if (labels.contains(LabelResolver.COMPONENT_LABEL)) {
            logger.warn(
                    "Found <{}> label defined in {}, automatically renamed to <{}>",
                    LabelResolver.COMPONENT_LABEL,
                    source,
                    LabelResolver.USER_DEFINED_COMPONENT_LABEL);
        }
    }

    private static String requiredText(JsonNode entry, String field) throws JobDefinitionException {
        final String value = optionalText(entry, field);
        if (value == null || value.isBlank()) {
            throw new JobDefinitionException("'" + field + "' is required");
        }
        return value;
    }

    @Nullable
    private static String optionalText(JsonNode entry, String field) throws JobDefinitionException {
        final JsonNode value = entry.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new JobDefinitionException("'" + field + "' must be a string");
        }
        return value.asText();
    }

    /**
     * Reads a positive whole number of seconds, given as JSON number or numeric string.
     */
    @Nullable
    private static Long optionalPositiveSeconds(JsonNode entry, String field) throws JobDefinitionException {
        final JsonNode value = entry.get(field);
        if (value == null || value.isNull()) {
            return null;
        }

        final long seconds;
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            seconds = value.longValue();
        } else if (value.isTextual()) {
            try {
                seconds = Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new JobDefinitionException("'" + field + "' must be a whole number of seconds: " + value);
            }
        } else {
            throw new JobDefinitionException("'" + field + "' must be a whole number of seconds: " + value);
        }

        if (seconds <= 0) {
            throw new JobDefinitionException("'" + field + "' must be positive: " + seconds);
        }
        return seconds;
    }
}
