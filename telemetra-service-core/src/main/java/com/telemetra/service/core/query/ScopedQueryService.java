package com.telemetra.service.core.query;

import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class ScopedQueryService {

    private final ScopedQueryRewriter rewriter;
    private final ScopedQueryExecutor executor;

    public QueryResult run(UUID tenantId, QueryRequest request) {
        if (request == null) {
            throw new QueryRejectedException("Query must not be empty");
        }
        ScopedQuery scoped = rewriter.validateAndScope(tenantId, request.query(), request.limit());
        long started = System.nanoTime();
        QueryResult result = executor.execute(scoped);
        log.info(
                "Ad-hoc query tenant={} rows={} limit={} took={}ms",
                tenantId,
                result.count(),
                scoped.limit(),
                (System.nanoTime() - started) / 1_000_000);
        return result;
    }
}
