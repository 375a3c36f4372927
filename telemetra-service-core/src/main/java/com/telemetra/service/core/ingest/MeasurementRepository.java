package com.telemetra.service.core.ingest;

import com.telemetra.service.core.normalize.MeasurementRow;
import java.util.List;
import java.util.UUID;

public interface MeasurementRepository {

    /**
     * Inserts the rows for the tenant, silently skipping rows whose natural key
     * {@code (tenant, device, metric, recorded_at)} already exists.
     *
     * @return number of rows actually inserted
     */
    int insertIgnoringDuplicates(UUID tenantId, List<MeasurementRow> rows);

    /** Newest first; {@code deviceId} and {@code metric} are optional filters. */
    List<MeasurementRecord> findRecent(UUID tenantId, String deviceId, String metric, int limit);
}
