package com.telemetra.service.core.query;

import com.telemetra.service.core.config.TelemetraProperties;
import org.springframework.stereotype.Component;

/**
 * Row caps for ad-hoc and preview queries.
 * <p>
 * - {@code null} or non-positive requests fall back to the default.
 * - Larger requests are clamped to the hard maximum.
 */
@Component
public class QueryLimits {

    private final TelemetraProperties properties;

    public QueryLimits(TelemetraProperties properties) {
        this.properties = properties;
    }

    public int clamp(Integer requested) {
        TelemetraProperties.Query query = properties.getQuery();
        int max = Math.max(1, query.getMaxLimit());
        int lim = (requested == null) ? query.getDefaultLimit() : requested;
        if (lim <= 0) lim = query.getDefaultLimit();
        if (lim > max) lim = max;
        return Math.max(1, lim);
    }
}
