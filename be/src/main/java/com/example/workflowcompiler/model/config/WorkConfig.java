package com.example.workflowcompiler.model.config;

import java.time.Duration;

/**
 * Configuration of a node executed as an activity.
 */
public sealed interface WorkConfig extends NodeConfig
        permits ActivityConfig, HttpCallConfig, DatabaseQueryConfig, NotificationConfig, TransformConfig {

    /** Start-to-close timeout override, or {@code null} for the compiler default. */
    Duration timeout();
}
