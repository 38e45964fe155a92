package com.example.workflowcompiler.model.config;

/**
 * Control nodes (start, end, decision, gateway, join) carry no configuration.
 */
public enum ControlConfig implements NodeConfig {
    INSTANCE
}
