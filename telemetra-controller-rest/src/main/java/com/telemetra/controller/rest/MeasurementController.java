package com.telemetra.controller.rest;

import com.telemetra.controller.rest.tenant.TenantResolver;
import com.telemetra.service.core.ingest.MeasurementQueryService;
import com.telemetra.service.core.ingest.MeasurementRecord;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/measurements")
public class MeasurementController {
    private final MeasurementQueryService measurements;
    private final TenantResolver tenants;

    public MeasurementController(MeasurementQueryService measurements, TenantResolver tenants) {
        this.measurements = measurements;
        this.tenants = tenants;
    }

    @GetMapping
    public List<MeasurementRecord> recent(
            @RequestParam(value = "device_id", required = false) String deviceId,
            @RequestParam(value = "metric", required = false) String metric,
            @RequestParam(value = "limit", required = false) Integer limit,
            HttpServletRequest request) {
        return measurements.recent(tenants.resolve(request), deviceId, metric, limit);
    }
}
