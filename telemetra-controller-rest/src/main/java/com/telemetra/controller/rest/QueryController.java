package com.telemetra.controller.rest;

import com.telemetra.controller.rest.tenant.TenantResolver;
import com.telemetra.service.core.query.QueryRequest;
import com.telemetra.service.core.query.QueryResult;
import com.telemetra.service.core.query.ScopedQueryService;
import com.telemetra.service.core.schema.TableSchema;
import com.telemetra.service.core.schema.TableSchemaProvider;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/query")
public class QueryController {

    private final ScopedQueryService queries;
    private final TableSchemaProvider schemas;
    private final TenantResolver tenants;

    public QueryController(ScopedQueryService queries, TableSchemaProvider schemas, TenantResolver tenants) {
        this.queries = queries;
        this.schemas = schemas;
        this.tenants = tenants;
    }

    /** Body: {"query":"SELECT ...", "limit":1000}. Results are always limited to the caller's organization. */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public QueryResult run(@RequestBody QueryBody body, HttpServletRequest request) {
        if (body == null || body.query == null || body.query.isBlank()) {
            throw new IllegalArgumentException("Missing 'query' field");
        }
        return queries.run(tenants.resolve(request), new QueryRequest(body.query, body.limit));
    }

    @GetMapping(value = "/schema", produces = MediaType.APPLICATION_JSON_VALUE)
    public TableSchema schema() {
        return schemas.schema();
    }

    public static class QueryBody {
        public String query;
        public Integer limit; // optional (default 1000)
    }
}
