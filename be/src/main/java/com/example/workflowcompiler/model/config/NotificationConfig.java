package com.example.workflowcompiler.model.config;

import java.time.Duration;

public record NotificationConfig(String channel, String recipient, String template) implements WorkConfig {

    @Override
    public Duration timeout() {
        return null;
    }
}
