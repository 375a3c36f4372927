package com.telemetra.service.core.job;

import java.io.IOException;
import java.io.InputStream;
import java.util.UUID;

/** Durable holding area for uploads waiting on a background job. */
public interface PayloadSpool {

    /** Stores the stream and returns an opaque reference for {@link #open} and {@link #delete}. */
    String store(UUID jobId, InputStream payload) throws IOException;

    InputStream open(String ref) throws IOException;

    void delete(String ref);
}
