package com.example.workflowcompiler.model.config;

import java.time.Duration;

public record HttpCallConfig(String method, String url, Duration timeout) implements WorkConfig {}
