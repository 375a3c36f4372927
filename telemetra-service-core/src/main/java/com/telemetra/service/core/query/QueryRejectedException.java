package com.telemetra.service.core.query;

/** The query text violates the gateway policy; the message is safe to show to the caller. */
public class QueryRejectedException extends RuntimeException {

    public QueryRejectedException(String message) {
        super(message);
    }

    public QueryRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
