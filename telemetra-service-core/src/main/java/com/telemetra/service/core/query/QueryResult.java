package com.telemetra.service.core.query;

import java.util.List;

/** Tabular result; every row is aligned with {@code columns} and may hold nulls. */
public record QueryResult(List<String> columns, List<List<Object>> rows, int count) {}
