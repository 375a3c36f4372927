package com.telemetra.service.core.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.telemetra.service.core.config.TelemetraProperties;
import com.telemetra.service.core.normalize.PayloadFormat;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class IngestionJobExecutorTest {

    @Mock
    private IngestionJobRunner runner;

    private InMemoryIngestionJobRepository repository;
    private InMemoryPayloadSpool spool;
    private IngestionJobExecutor executor;
    private final Clock clock = Clock.fixed(Instant.parse("2025-01-01T01:00:00Z"), ZoneOffset.UTC);

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        repository = new InMemoryIngestionJobRepository();
        spool = new InMemoryPayloadSpool();
        TelemetraProperties properties = new TelemetraProperties();
        properties.getJobs().setWorkers(2);
        properties.getJobs().setQueueCapacity(4);
        executor = new IngestionJobExecutor(runner, repository, spool, properties, clock);
        executor.start();
    }

    @AfterEach
    void tearDown() {
        executor.stop();
    }

    @Test
    void enqueuedJobIsHandedToRunner() {
        UUID id = UUID.randomUUID();
        when(runner.run(id)).thenReturn(true);

        executor.enqueue(id);
        executor.waitForDrain();

        verify(runner, timeout(1000)).run(id);
    }

    @Test
    void sweepPicksUpPendingJobsAndFailsStaleOnes() {
        UUID pending = insert(Instant.parse("2025-01-01T00:59:00Z"));
        UUID stale = insert(Instant.parse("2024-12-31T00:00:00Z"));
        repository.claim(stale, Instant.parse("2024-12-31T00:00:00Z"));
        spool.payloads.put("ref-" + stale, new byte[] {1});

        executor.sweep();
        executor.waitForDrain();

        verify(runner, timeout(1000)).run(pending);
        IngestionJob failed = repository.findById(stale).orElseThrow();
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(spool.payloads).doesNotContainKey("ref-" + stale);
    }

    private UUID insert(Instant createdAt) {
        UUID id = UUID.randomUUID();
        repository.insert(IngestionJob.builder()
                .id(id)
                .tenantId(UUID.randomUUID())
                .sourceFormat(PayloadFormat.JSON)
                .payloadRef("ref-" + id)
                .status(JobStatus.PENDING)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build());
        return id;
    }
}
