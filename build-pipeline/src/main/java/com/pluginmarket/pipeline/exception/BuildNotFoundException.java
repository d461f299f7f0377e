package com.pluginmarket.pipeline.exception;

public class BuildNotFoundException extends RuntimeException {

    public BuildNotFoundException(String buildId) {
        super("Build not found: " + buildId);
    }
}
