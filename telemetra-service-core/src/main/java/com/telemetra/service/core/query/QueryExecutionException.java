package com.telemetra.service.core.query;

/** The store failed to run an accepted query. The message never carries driver detail. */
public class QueryExecutionException extends RuntimeException {

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
