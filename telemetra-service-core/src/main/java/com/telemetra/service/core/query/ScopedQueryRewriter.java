package com.telemetra.service.core.query;

import com.telemetra.service.core.config.TelemetraProperties;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates an ad-hoc query and wraps it so that only the caller's tenant rows can come back:
 *
 * <pre>
 * SELECT * FROM (
 * &lt;query&gt;
 * ) AS tenant_scoped WHERE tenant_scoped.&lt;tenant column&gt; = ? LIMIT &lt;n&gt;
 * </pre>
 *
 * The tenant is bound as a parameter, never spliced into the text.
 */
@Component
@Slf4j
public class ScopedQueryRewriter {

    static final String DERIVED_ALIAS = "tenant_scoped";
    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final QueryGuard guard;
    private final QueryLimits limits;
    private final String tenantColumn;

    public ScopedQueryRewriter(TelemetraProperties properties, QueryLimits limits) {
        this.tenantColumn = properties.getQuery().getTenantColumn();
        if (!SIMPLE_IDENTIFIER.matcher(tenantColumn).matches()) {
            throw new IllegalStateException("Invalid tenant column name: " + tenantColumn);
        }
        this.guard = new QueryGuard(tenantColumn);
        this.limits = limits;
    }

    public ScopedQuery validateAndScope(UUID tenantId, String rawQuery, Integer limit) {
        if (tenantId == null) {
            throw new IllegalArgumentException("tenantId is required");
        }
        if (rawQuery == null || rawQuery.isBlank()) {
            throw new QueryRejectedException("Query must not be empty");
        }
        List<SqlToken> tokens = SqlTokenizer.tokenize(rawQuery);
        int end = guard.check(tokens);
        String body = end < tokens.size()
                ? rawQuery.substring(0, tokens.get(end).position())
                : rawQuery;
        int n = limits.clamp(limit);
        // newline before ')' keeps a trailing line comment from swallowing it
        String sql = "SELECT * FROM (\n" + body.strip() + "\n) AS " + DERIVED_ALIAS + " WHERE " + DERIVED_ALIAS + "."
                + tenantColumn + " = ? LIMIT " + n;
        log.debug("Scoped query tenant={} limit={}: {}", tenantId, n, sql);
        return new ScopedQuery(sql, tenantId, n);
    }
}
