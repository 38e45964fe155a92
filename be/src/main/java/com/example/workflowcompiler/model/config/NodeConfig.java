package com.example.workflowcompiler.model.config;

/**
 * Typed form of a node's configuration payload. The concrete type is determined by the node variant.
 */
public sealed interface NodeConfig
        permits WorkConfig, TimerConfig, SignalConfig, SubWorkflowConfig, ControlConfig {
}
