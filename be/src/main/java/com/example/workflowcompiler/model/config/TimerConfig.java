package com.example.workflowcompiler.model.config;

import java.time.Duration;

public record TimerConfig(Duration duration) implements NodeConfig {}
