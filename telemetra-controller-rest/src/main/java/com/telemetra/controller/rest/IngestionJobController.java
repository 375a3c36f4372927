package com.telemetra.controller.rest;

import com.telemetra.controller.rest.tenant.TenantResolver;
import com.telemetra.service.core.job.IngestionJob;
import com.telemetra.service.core.job.IngestionJobService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.UUID;
import org.springframework.web.bind.annotation.*;

/** Read-only polling of background ingestion jobs. */
@RestController
@RequestMapping("/api/ingest/jobs")
public class IngestionJobController {
    private final IngestionJobService jobs;
    private final TenantResolver tenants;

    public IngestionJobController(IngestionJobService jobs, TenantResolver tenants) {
        this.jobs = jobs;
        this.tenants = tenants;
    }

    @GetMapping("/{id}")
    public IngestionJob get(@PathVariable("id") UUID id, HttpServletRequest request) {
        return jobs.get(tenants.resolve(request), id);
    }

    @GetMapping
    public List<IngestionJob> list(
            @RequestParam(value = "limit", required = false) Integer limit, HttpServletRequest request) {
        return jobs.list(tenants.resolve(request), limit);
    }
}
