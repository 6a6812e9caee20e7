package com.classsched.classsched_api.exception;

/**
 * Raised when a preset or a request override cannot be turned into a valid
 * solver configuration.
 */
public class ConfigurationException extends SchedulerException {

    public ConfigurationException(String message) {
        super(message);
    }
}
