package com.telemetra.service.core.normalize;

/** Structural shape of an upload, decided once before any row is read. */
public enum PayloadShape {
    /** {@code {"device_id":..., "metric":..., "rows":[...]}}; rows inherit device and metric. */
    JSON_OBJECT,
    /** {@code [{...}, {...}]}; every element carries its own fields, resolved through aliases. */
    JSON_ARRAY,
    /** Header row plus delimited records. */
    DELIMITED
}
