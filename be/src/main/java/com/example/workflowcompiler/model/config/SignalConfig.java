package com.example.workflowcompiler.model.config;

import java.time.Duration;

/**
 * Waits for a named signal; {@code timeout} is optional.
 */
public record SignalConfig(String signalName, Duration timeout) implements NodeConfig {}
