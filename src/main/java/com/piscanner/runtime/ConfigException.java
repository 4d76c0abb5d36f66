package com.piscanner.runtime;

/**
 * Configuration problem detected at startup. Always fatal for the run.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
