package com.classsched.classsched_api.exception;

/**
 * Raised when the fact set is inconsistent: dangling references, repeated
 * rows, values out of range.
 */
public class DataIntegrityException extends SchedulerException {

    public DataIntegrityException(String message) {
        super(message);
    }
}
