package com.telemetra.service.core.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

import com.telemetra.service.core.normalize.PayloadFormat;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class IngestionJobServiceTest {

    @Mock
    private IngestionJobExecutor executor;

    private InMemoryIngestionJobRepository repository;
    private InMemoryPayloadSpool spool;
    private IngestionJobService service;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        repository = new InMemoryIngestionJobRepository();
        spool = new InMemoryPayloadSpool();
        service = new IngestionJobService(
                repository, spool, executor, Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void submitSpoolsPayloadAndDispatchesPendingJob() throws Exception {
        UUID tenant = UUID.randomUUID();

        IngestionJob job = service.submit(
                tenant, "readings.csv", PayloadFormat.CSV, new ByteArrayInputStream("a,b".getBytes(StandardCharsets.UTF_8)));

        assertThat(job.status()).isEqualTo(JobStatus.PENDING);
        assertThat(job.totalRows()).isNull();
        assertThat(job.progress()).isZero();
        assertThat(spool.payloads).containsKey(job.payloadRef());
        assertThat(service.get(tenant, job.id()).status()).isEqualTo(JobStatus.PENDING);
        verify(executor).enqueue(job.id());
    }

    @Test
    void jobsAreOnlyVisibleToTheirTenant() throws Exception {
        UUID tenant = UUID.randomUUID();
        IngestionJob job = service.submit(
                tenant, "x.json", PayloadFormat.JSON, new ByteArrayInputStream("[]".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> service.get(UUID.randomUUID(), job.id()))
                .isInstanceOf(IngestionJobNotFoundException.class);
        assertThatThrownBy(() -> service.get(tenant, UUID.randomUUID()))
                .isInstanceOf(IngestionJobNotFoundException.class);
        assertThat(service.list(tenant, 5)).extracting(IngestionJob::id).containsExactly(job.id());
        assertThat(service.list(UUID.randomUUID(), null)).isEmpty();
    }
}
