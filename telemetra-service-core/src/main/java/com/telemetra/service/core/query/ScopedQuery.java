package com.telemetra.service.core.query;

import java.util.UUID;

/**
 * Query ready for execution: {@code sql} wraps the caller's statement in a derived table filtered
 * on the tenant column, with the tenant as its only bind parameter.
 */
public record ScopedQuery(String sql, UUID tenantId, int limit) {}
