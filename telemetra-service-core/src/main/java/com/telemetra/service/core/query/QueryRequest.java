package com.telemetra.service.core.query;

/** Ad-hoc query as submitted; {@code limit} may be null. */
public record QueryRequest(String query, Integer limit) {}
