package com.telemetra.controller.rest.tenant;

public class TenantUnresolvedException extends RuntimeException {

    public TenantUnresolvedException(String message) {
        super(message);
    }

    public TenantUnresolvedException(String message, Throwable cause) {
        super(message, cause);
    }
}
