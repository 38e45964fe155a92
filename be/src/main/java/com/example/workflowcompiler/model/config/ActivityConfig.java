package com.example.workflowcompiler.model.config;

import java.time.Duration;

public record ActivityConfig(String taskQueue, Duration timeout) implements WorkConfig {}
