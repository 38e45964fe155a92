package com.example.workflowcompiler.controlflow;

import com.example.workflowcompiler.model.NodeType;
import com.example.workflowcompiler.model.config.NodeConfig;
import com.example.workflowcompiler.model.config.RetrySettings;

/**
 * Everything the emitters need to know about one executable node. {@code retry} is {@code null} when the
 * node declares no retry policy or is not a work node.
 */
public record StepDescriptor(
        String nodeId,
        NodeType type,
        String identifier,
        String label,
        NodeConfig config,
        RetrySettings retry
) {}
