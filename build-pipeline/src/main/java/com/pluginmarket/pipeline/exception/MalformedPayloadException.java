package com.pluginmarket.pipeline.exception;

/**
 * Inbound payload could not be parsed or lacks required fields.
 * The message is safe to return to the caller.
 */
public class MalformedPayloadException extends RuntimeException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
