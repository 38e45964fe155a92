package com.example.workflowcompiler.model.config;

import lombok.Getter;

/**
 * Thrown when a node's configuration payload does not match its variant.
 * <p>
 * {@link #getKey()} names the offending key ({@code config.duration}, {@code retries.max_interval}).
 * </p>
 */
@Getter
public class InvalidNodeConfigException extends RuntimeException {

    private final String key;

    public InvalidNodeConfigException(String key, String message) {
        super(message);
        this.key = key;
    }
}
