package com.example.workflowcompiler.emit;

import java.time.Duration;
import java.util.Objects;

/**
 * Code generation settings shared by all emitters.
 *
 * @param defaultActivityTimeout start-to-close timeout for activities without their own {@code timeout}
 * @param taskQueueSuffix        appended to the package name to form the worker task queue
 * @param goModule               module path prefix for importing the generated package; blank imports the
 *                               package by its bare name
 */
public record EmitterSettings(Duration defaultActivityTimeout, String taskQueueSuffix, String goModule) {

    public static final EmitterSettings DEFAULTS = new EmitterSettings(Duration.ofMinutes(10), "-task-queue", "");

    public EmitterSettings {
        Objects.requireNonNull(defaultActivityTimeout, "defaultActivityTimeout");
        if (defaultActivityTimeout.isZero() || defaultActivityTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultActivityTimeout must be positive");
        }
        taskQueueSuffix = taskQueueSuffix != null ? taskQueueSuffix : "";
        goModule = goModule != null ? goModule.trim() : "";
    }

    public String taskQueue(String packageName) {
        return packageName + taskQueueSuffix;
    }

    public String importPath(String packageName) {
        if (goModule.isEmpty()) {
            return packageName;
        }
        return goModule.endsWith("/") ? goModule + packageName : goModule + "/" + packageName;
    }
}
