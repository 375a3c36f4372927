package com.telemetra.controller.rest.tenant;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

/**
 * Supplies the tenant of an authenticated request. Authentication happens upstream; implementations
 * only read what the gateway established and never trust body or query fields.
 */
public interface TenantResolver {

    /** @throws TenantUnresolvedException when the request carries no usable tenant */
    UUID resolve(HttpServletRequest request);
}
