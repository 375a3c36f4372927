package com.telemetra.service.core.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetra.service.core.config.TelemetraProperties;
import com.telemetra.service.core.job.IngestionJob;
import com.telemetra.service.core.job.IngestionJobService;
import com.telemetra.service.core.job.JobStatus;
import com.telemetra.service.core.normalize.MalformedPayloadException;
import com.telemetra.service.core.normalize.PayloadFormat;
import com.telemetra.service.core.normalize.RowNormalizer;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

class IngestionServiceTest {

    private static final UUID TENANT = UUID.randomUUID();

    @Mock
    private IngestionJobService jobService;

    private InMemoryMeasurementRepository repository;
    private IngestionService service;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        repository = new InMemoryMeasurementRepository();
        TelemetraProperties properties = new TelemetraProperties();
        properties.getIngest().setAsyncThresholdBytes(512);
        MeasurementIngestExecutor executor = new MeasurementIngestExecutor(
                repository, new TransactionTemplate(mock(PlatformTransactionManager.class)), properties);
        service = new IngestionService(new RowNormalizer(new ObjectMapper()), executor, jobService, properties);
    }

    @Test
    void smallPayloadIsIngestedInline() throws Exception {
        byte[] body = ("[{\"device_id\": \"d\", \"metric\": \"m\", \"recorded_at\": 1700000000, \"value\": 1},"
                        + " {\"device_id\": \"d\", \"metric\": \"m\"}]")
                .getBytes(StandardCharsets.UTF_8);

        IngestionOutcome outcome =
                service.ingest(TENANT, null, "application/json", body.length, new ByteArrayResource(body));

        assertThat(outcome).isInstanceOf(IngestionOutcome.Completed.class);
        assertThat(((IngestionOutcome.Completed) outcome).result()).isEqualTo(new IngestionResult(1, 1, 0));
        verifyNoInteractions(jobService);
    }

    @Test
    void largePayloadBecomesJob() throws Exception {
        byte[] body = ("device_id,metric,recorded_at,value\n" + "d,m,2025-01-01T00:00:00Z,1\n".repeat(40))
                .getBytes(StandardCharsets.UTF_8);
        IngestionJob pending =
                IngestionJob.builder().id(UUID.randomUUID()).status(JobStatus.PENDING).build();
        when(jobService.submit(eq(TENANT), eq("big.csv"), eq(PayloadFormat.CSV), any(InputStream.class)))
                .thenReturn(pending);

        IngestionOutcome outcome = service.ingest(TENANT, "big.csv", null, body.length, new ByteArrayResource(body));

        assertThat(outcome).isEqualTo(new IngestionOutcome.Queued(pending));
        verify(jobService).submit(eq(TENANT), eq("big.csv"), eq(PayloadFormat.CSV), any(InputStream.class));
        assertThat(repository.size()).isZero();
    }

    @Test
    void malformedInlinePayloadWritesNothing() {
        byte[] body = "[{\"device_id\": \"d\", \"metric\": \"m\", \"recorded_at\": 1700000000}, {"
                .getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() ->
                        service.ingest(TENANT, "x.json", null, body.length, new ByteArrayResource(body)))
                .isInstanceOf(MalformedPayloadException.class);
        assertThat(repository.calls()).isZero();
    }
}
