package com.di.epistream.exception;

/**
 * Infrastructure failure that ends a run before any partition starts
 * (store unreachable, reference data missing, unreadable input).
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
