package com.telemetra.service.core.query;

public interface ScopedQueryExecutor {

    /**
     * @throws QueryRejectedException when the statement does not expose the tenant column
     * @throws QueryExecutionException for every other failure
     */
    QueryResult execute(ScopedQuery query);
}
