package com.pluginmarket.pipeline.exception;

/**
 * The builder service could not be reached or refused the job.
 */
public class BuilderDispatchException extends RuntimeException {

    public BuilderDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
