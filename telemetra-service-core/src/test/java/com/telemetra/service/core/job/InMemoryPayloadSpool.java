package com.telemetra.service.core.job;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

class InMemoryPayloadSpool implements PayloadSpool {

    final Map<String, byte[]> payloads = new ConcurrentHashMap<>();

    @Override
    public String store(UUID jobId, InputStream payload) throws IOException {
        String ref = jobId.toString();
        try (InputStream in = payload) {
            payloads.put(ref, in.readAllBytes());
        }
        return ref;
    }

    @Override
    public InputStream open(String ref) throws IOException {
        byte[] bytes = payloads.get(ref);
        if (bytes == null) {
            throw new IOException("No spooled payload " + ref);
        }
        return new ByteArrayInputStream(bytes);
    }

    @Override
    public void delete(String ref) {
        payloads.remove(ref);
    }
}
