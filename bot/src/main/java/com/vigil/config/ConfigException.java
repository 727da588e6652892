package com.vigil.config;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Configuration could not be read or failed validation. Fatal for the process.
 */
public class ConfigException extends RuntimeException {

    @Getter
    private final List<String> issues;

    public ConfigException(String message) {
        super(message);
        this.issues = Collections.emptyList();
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.issues = Collections.emptyList();
    }

    public ConfigException(List<String> issues) {
        super("Invalid config: " + String.join("; ", issues));
        this.issues = Collections.unmodifiableList(issues);
    }
}
