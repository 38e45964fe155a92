package com.example.workflowcompiler.model.config;

import java.time.Duration;

public record DatabaseQueryConfig(String query, Duration timeout) implements WorkConfig {}
