package com.classsched.classsched_api.exception;

/**
 * Base for every error the scheduler raises before a search is started.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
