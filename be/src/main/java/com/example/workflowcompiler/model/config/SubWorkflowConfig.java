package com.example.workflowcompiler.model.config;

public record SubWorkflowConfig(String workflowName, String taskQueue) implements NodeConfig {}
