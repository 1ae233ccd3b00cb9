/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.quill.workflow;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses workflow definitions using SnakeYAML with a safe constructor.
 *
 * <pre>
 * workflow:
 *   id: blog-post
 *   version: "2"
 *   steps:
 *     - id: outline
 *       ref: outline_writer
 *       timeout: 30s
 *     - id: seo
 *       ref: keyword_extractor
 *       dependsOn: [outline]
 *       condition: { type: if, key: seo_enabled }
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private static final String DEFAULT_VERSION = "1";

    private final Yaml yaml;

    public YamlWorkflowDefinitionParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    @Override
    public WorkflowDefinition parse(Path file) throws WorkflowParseException {
        try {
            String content = Files.readString(file);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read workflow file: " + file, e);
        }
    }

    @Override
    public WorkflowDefinition parseFromString(String content) throws WorkflowParseException {
        Object loaded;
        try {
            loaded = yaml.load(content);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }

        Map<String, Object> root = asMap(loaded);
        Map<String, Object> workflow = getMapValue(root, "workflow");
        if (workflow == null) {
            // bare document without the workflow wrapper
            workflow = root;
        }
        return parseWorkflow(workflow);
    }

    private WorkflowDefinition parseWorkflow(Map<String, Object> data) throws WorkflowParseException {
        String id = requireString(data, "id", "workflow.id");
        String version = getStringValue(data, "version", DEFAULT_VERSION);
        String description = getStringValue(data, "description", null);

        Object stepsValue = data.get("steps");
        if (stepsValue != null && !(stepsValue instanceof List)) {
            throw new WorkflowParseException("workflow.steps", "Steps must be a list");
        }

        List<StepSpec> steps = new ArrayList<>();
        List<?> stepList = stepsValue != null ? (List<?>) stepsValue : List.of();
        for (int i = 0; i < stepList.size(); i++) {
            String path = "workflow.steps[" + i + "]";
            if (!(stepList.get(i) instanceof Map)) {
                throw new WorkflowParseException(path, "Step must be a mapping");
            }
            steps.add(parseStep(asMap(stepList.get(i)), path));
        }

        return new WorkflowDefinition(id, version, description, steps);
    }

    private StepSpec parseStep(Map<String, Object> data, String path) throws WorkflowParseException {
        String id = requireString(data, "id", path + ".id");
        String ref = requireString(data, "ref", path + ".ref");

        StepSpec.Builder builder = StepSpec.builder(id, ref)
                .dependsOn(parseStringList(data.get("dependsOn"), path + ".dependsOn"))
                .continueOnError(getBooleanValue(data, "continueOnError", false, path))
                .parallel(getBooleanValue(data, "parallel", true, path))
                .exclusiveTag(getStringValue(data, "exclusiveTag", null));

        int retries = getIntValue(data, "retries", 0, path + ".retries");
        if (retries < 0) {
            throw new WorkflowParseException(path + ".retries", "Retries cannot be negative: " + retries);
        }
        builder.retries(retries);

        String timeout = getStringValue(data, "timeout", null);
        if (timeout != null) {
            builder.timeout(parseDuration(timeout, path + ".timeout"));
        }

        Object condition = data.get("condition");
        if (condition != null) {
            builder.condition(parseCondition(condition, path + ".condition"));
        }

        Object params = data.get("params");
        if (params != null) {
            if (!(params instanceof Map)) {
                throw new WorkflowParseException(path + ".params", "Params must be a mapping");
            }
            builder.params(asMap(params));
        }
        return builder.build();
    }

    private StepCondition parseCondition(Object value, String path) throws WorkflowParseException {
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(path, "Condition must be a mapping with 'type' and 'key' or 'keys'");
        }
        Map<String, Object> data = asMap(value);
        String typeName = requireString(data, "type", path + ".type");

        StepCondition.Type type;
        try {
            type = StepCondition.Type.fromString(typeName);
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + ".type", "Unknown condition type: " + typeName);
        }

        List<String> keys = new ArrayList<>();
        String key = getStringValue(data, "key", null);
        if (key != null) {
            keys.add(key);
        }
        keys.addAll(parseStringList(data.get("keys"), path + ".keys"));
        if (keys.isEmpty()) {
            throw new WorkflowParseException(path, "Condition requires 'key' or 'keys'");
        }
        if (type != StepCondition.Type.REQUIRES && keys.size() > 1) {
            throw new WorkflowParseException(path, "Condition type '" + typeName + "' accepts a single key");
        }
        return StepCondition.of(type, keys);
    }

    /**
     * Parses durations such as {@code 500ms}, {@code 30s}, {@code 5m}, {@code 2h};
     * a bare number is taken as milliseconds.
     */
    static Duration parseDuration(String value, String path) throws WorkflowParseException {
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        try {
            Duration duration;
            if (trimmed.endsWith("ms")) {
                duration = Duration.ofMillis(Long.parseLong(trimmed.substring(0, trimmed.length() - 2).trim()));
            } else if (trimmed.endsWith("s")) {
                duration = Duration.ofSeconds(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
            } else if (trimmed.endsWith("m")) {
                duration = Duration.ofMinutes(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
            } else if (trimmed.endsWith("h")) {
                duration = Duration.ofHours(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
            } else {
                duration = Duration.ofMillis(Long.parseLong(trimmed));
            }
            if (duration.isNegative() || duration.isZero()) {
                throw new WorkflowParseException(path, "Duration must be positive: " + value);
            }
            return duration;
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(path, "Invalid duration: " + value, e);
        }
    }

    // Utility methods for safe type conversion
    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private static Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value instanceof Map ? asMap(value) : null;
    }

    private static String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static String requireString(Map<String, Object> data, String key, String path)
            throws WorkflowParseException {
        String value = getStringValue(data, key, null);
        if (value == null || value.trim().isEmpty()) {
            throw new WorkflowParseException(path, "Required field '" + key + "' is missing");
        }
        return value.trim();
    }

    private static boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue,
                                           String path) throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(text);
        }
        throw new WorkflowParseException(path + "." + key, "Expected a boolean but got: " + value);
    }

    private static int getIntValue(Map<String, Object> data, String key, int defaultValue, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(path, "Expected an integer but got: " + value, e);
        }
    }

    private static List<String> parseStringList(Object value, String path) throws WorkflowParseException {
        if (value == null) {
            return List.of();
        }
        if (value instanceof String) {
            return List.of(((String) value).trim());
        }
        if (!(value instanceof List)) {
            throw new WorkflowParseException(path, "Expected a list of strings");
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item != null) {
                result.add(item.toString().trim());
            }
        }
        return result;
    }
}
