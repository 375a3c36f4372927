package com.telemetra.service.core.normalize;

/** The container structure of an upload (JSON syntax, CSV header) could not be recognized. */
public class MalformedPayloadException extends IllegalArgumentException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
