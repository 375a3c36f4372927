package com.telemetra.controller.rest.tenant;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Reads the tenant id from a header set by the authenticating gateway. */
@Component
public class HeaderTenantResolver implements TenantResolver {

    private final String headerName;

    public HeaderTenantResolver(@Value("${telemetra.tenant.header:X-Tenant-Id}") String headerName) {
        this.headerName = headerName;
    }

    @Override
    public UUID resolve(HttpServletRequest request) {
        String raw = request.getHeader(headerName);
        if (raw == null || raw.isBlank()) {
            throw new TenantUnresolvedException("Missing organization context");
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException ex) {
            throw new TenantUnresolvedException("Invalid organization context", ex);
        }
    }
}
