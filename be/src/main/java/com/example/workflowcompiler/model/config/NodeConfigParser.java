package com.example.workflowcompiler.model.config;

import com.example.workflowcompiler.model.NodeType;
import com.example.workflowcompiler.model.RetryPolicy;
import com.example.workflowcompiler.model.WorkflowNode;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Parses the opaque node payload into the {@link NodeConfig} matching the node variant.
 * <p>
 * Pure function of the node. The validator calls it to report problems; later stages call it again on
 * validated nodes, where it cannot fail.
 * </p>
 */
public final class NodeConfigParser {

    private static final Set<String> HTTP_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");
    private static final Set<String> CHANNELS = Set.of("email", "sms", "push", "webhook");

    private NodeConfigParser() {
    }

    /**
     * @throws InvalidNodeConfigException on the first malformed or missing key
     */
    public static NodeConfig parse(WorkflowNode node) {
        Map<String, Object> config = node.config();
        NodeType type = node.nodeType();
        if (type == null) {
            throw new InvalidNodeConfigException("node_type", "node type is required");
        }
        switch (type) {
            case ACTIVITY:
                return new ActivityConfig(optionalString(config, "task_queue"), optionalDuration(config, "timeout"));
            case HTTP_CALL:
                return new HttpCallConfig(httpMethod(config), requiredString(config, "url"), optionalDuration(config, "timeout"));
            case DATABASE_QUERY:
                return new DatabaseQueryConfig(requiredString(config, "query"), optionalDuration(config, "timeout"));
            case NOTIFICATION:
                return new NotificationConfig(channel(config), optionalString(config, "recipient"), optionalString(config, "template"));
            case TRANSFORM:
                return new TransformConfig(optionalString(config, "expression"), mappings(config));
            case WAIT_TIMER:
                return new TimerConfig(timerDuration(config));
            case WAIT_SIGNAL:
                return new SignalConfig(requiredString(config, "signal_name"), optionalDuration(config, "timeout"));
            case SUB_WORKFLOW:
                return new SubWorkflowConfig(requiredString(config, "workflow_name"), optionalString(config, "task_queue"));
            default:
                return ControlConfig.INSTANCE;
        }
    }

    /**
     * Parses a retry policy. Returns {@code null} when the node has none.
     *
     * @throws InvalidNodeConfigException if a field is out of range or an interval is malformed
     */
    public static RetrySettings parseRetryPolicy(RetryPolicy policy) {
        if (policy == null) {
            return null;
        }
        if (policy.maxAttemptsOrDefault() < 0) {
            throw new InvalidNodeConfigException("retries.max_attempts", "max_attempts must be >= 0");
        }
        if (policy.backoffCoefficientOrDefault() < 1.0) {
            throw new InvalidNodeConfigException("retries.backoff_coefficient", "backoff_coefficient must be >= 1.0");
        }
        Duration initial = retryInterval("retries.initial_interval", policy.initialInterval());
        Duration max = retryInterval("retries.max_interval", policy.maxInterval());
        if (initial != null && max != null && initial.compareTo(max) > 0) {
            throw new InvalidNodeConfigException("retries.max_interval", "max_interval must not be shorter than initial_interval");
        }
        return new RetrySettings(policy.maxAttemptsOrDefault(), initial, max, policy.backoffCoefficientOrDefault());
    }

    private static Duration retryInterval(String key, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return positive(key, parseDuration(key, value));
    }

    private static String httpMethod(Map<String, Object> config) {
        String method = optionalString(config, "method");
        if (method == null) {
            return "GET";
        }
        String upper = method.trim().toUpperCase(Locale.ROOT);
        if (!HTTP_METHODS.contains(upper)) {
            throw new InvalidNodeConfigException("config.method", "method must be one of " + HTTP_METHODS.stream().sorted().toList());
        }
        return upper;
    }

    private static String channel(Map<String, Object> config) {
        String channel = requiredString(config, "channel").trim().toLowerCase(Locale.ROOT);
        if (!CHANNELS.contains(channel)) {
            throw new InvalidNodeConfigException("config.channel", "channel must be one of " + CHANNELS.stream().sorted().toList());
        }
        return channel;
    }

    private static SortedMap<String, String> mappings(Map<String, Object> config) {
        Object raw = config.get("mappings");
        SortedMap<String, String> result = new TreeMap<>();
        if (raw == null) {
            return result;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new InvalidNodeConfigException("config.mappings", "mappings must be an object of target to source variable");
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getValue() instanceof String source) || source.isBlank()) {
                throw new InvalidNodeConfigException("config.mappings", "mapping for '" + entry.getKey() + "' must name a source variable");
            }
            result.put(String.valueOf(entry.getKey()), source.trim());
        }
        return result;
    }

    private static Duration timerDuration(Map<String, Object> config) {
        Object seconds = config.get("duration_seconds");
        if (seconds != null) {
            if (!(seconds instanceof Number number) || number.doubleValue() <= 0) {
                throw new InvalidNodeConfigException("config.duration_seconds", "duration_seconds must be a positive number");
            }
            return positive("config.duration_seconds", Duration.ofMillis(Math.round(number.doubleValue() * 1000)));
        }
        Duration duration = optionalDuration(config, "duration");
        if (duration == null) {
            throw new InvalidNodeConfigException("config.duration", "wait_timer requires a duration");
        }
        return duration;
    }

    private static Duration optionalDuration(Map<String, Object> config, String key) {
        Object raw = config.get(key);
        if (raw == null) {
            return null;
        }
        String configKey = "config." + key;
        if (raw instanceof Number number) {
            return positive(configKey, Duration.ofMillis(Math.round(number.doubleValue() * 1000)));
        }
        if (!(raw instanceof String text)) {
            throw new InvalidNodeConfigException(configKey, key + " must be a duration string");
        }
        return positive(configKey, parseDuration(configKey, text));
    }

    private static Duration parseDuration(String key, String text) {
        try {
            return DurationParser.parse(text);
        } catch (IllegalArgumentException e) {
            throw new InvalidNodeConfigException(key, e.getMessage());
        }
    }

    private static Duration positive(String key, Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            throw new InvalidNodeConfigException(key, key.substring(key.indexOf('.') + 1) + " must be positive");
        }
        return duration;
    }

    private static String requiredString(Map<String, Object> config, String key) {
        String value = optionalString(config, key);
        if (value == null || value.isBlank()) {
            throw new InvalidNodeConfigException("config." + key, key + " is required");
        }
        return value;
    }

    private static String optionalString(Map<String, Object> config, String key) {
        Object raw = config.get(key);
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof String value)) {
            throw new InvalidNodeConfigException("config." + key, key + " must be a string");
        }
        return value;
    }
}
