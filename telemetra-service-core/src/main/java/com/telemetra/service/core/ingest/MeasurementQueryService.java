package com.telemetra.service.core.ingest;

import com.telemetra.service.core.query.QueryLimits;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Tenant-scoped listing of stored measurements, newest first. */
@Service
@RequiredArgsConstructor
public class MeasurementQueryService {

    private final MeasurementRepository repository;
    private final QueryLimits limits;

    public List<MeasurementRecord> recent(UUID tenantId, String deviceId, String metric, Integer limit) {
        return repository.findRecent(tenantId, trimToNull(deviceId), trimToNull(metric), limits.clamp(limit));
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
