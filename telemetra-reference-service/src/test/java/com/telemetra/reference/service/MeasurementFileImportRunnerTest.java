package com.telemetra.reference.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetra.service.core.config.TelemetraProperties;
import com.telemetra.service.core.ingest.IngestionResult;
import com.telemetra.service.core.ingest.MeasurementIngestExecutor;
import com.telemetra.service.core.ingest.MeasurementRepository;
import com.telemetra.service.core.normalize.MeasurementRow;
import com.telemetra.service.core.normalize.RowNormalizer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

class MeasurementFileImportRunnerTest {

    private static final UUID TENANT = UUID.fromString("12121212-1212-1212-1212-121212121212");

    @TempDir
    Path dir;

    @Mock
    MeasurementRepository repository;

    private RowNormalizer normalizer;
    private MeasurementIngestExecutor executor;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        normalizer = new RowNormalizer(new ObjectMapper());
        executor = new MeasurementIngestExecutor(
                repository, new TransactionTemplate(mock(PlatformTransactionManager.class)), new TelemetraProperties());
        when(repository.insertIgnoringDuplicates(eq(TENANT), anyList()))
                .thenAnswer(inv -> inv.<List<MeasurementRow>>getArgument(1).size());
    }

    @Test
    void importsCsvFileInBatches() throws Exception {
        Path file = dir.resolve("readings.csv");
        Files.writeString(
                file,
                """
                device_id,timestamp,metric,value
                sensor-1,2024-03-01T10:00:00Z,temperature,21.5
                sensor-1,2024-03-01T10:01:00Z,temperature,21.6
                sensor-2,,temperature,20.0
                sensor-2,2024-03-01T10:00:00Z,temperature,19.9
                """,
                StandardCharsets.UTF_8);
        MeasurementFileImportRunner runner = new MeasurementFileImportRunner(normalizer, executor, "", "", 2);

        IngestionResult result = runner.importFile(file, TENANT);

        assertThat(result).isEqualTo(new IngestionResult(3, 1, 0));
    }

    @Test
    void importsJsonFileDetectedFromContent() throws Exception {
        Path file = dir.resolve("export.dat");
        Files.writeString(
                file,
                "[{\"device_id\":\"s-1\",\"timestamp\":\"2024-03-01T10:00:00Z\",\"metric\":\"pm25\",\"value\":4}]",
                StandardCharsets.UTF_8);
        MeasurementFileImportRunner runner = new MeasurementFileImportRunner(normalizer, executor, "", "", 1000);

        assertThat(runner.importFile(file, TENANT)).isEqualTo(new IngestionResult(1, 0, 0));
    }

    @Test
    void runIsSkippedWithoutFileAndTenant() {
        MeasurementFileImportRunner runner = new MeasurementFileImportRunner(normalizer, executor, "", "", 1000);

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(repository);
    }

    @Test
    void runUsesConfiguredFileAndTenant() throws Exception {
        Path file = dir.resolve("one.csv");
        Files.writeString(file, "device_id,timestamp,metric,value\nd,2024-03-01T10:00:00Z,t,1\n", StandardCharsets.UTF_8);
        MeasurementFileImportRunner runner =
                new MeasurementFileImportRunner(normalizer, executor, file.toString(), TENANT.toString(), 1000);

        runner.run(new DefaultApplicationArguments());

        verify(repository).insertIgnoringDuplicates(eq(TENANT), any());
    }

    @Test
    void missingFileFailsStartup() {
        MeasurementFileImportRunner runner = new MeasurementFileImportRunner(
                normalizer, executor, dir.resolve("absent.csv").toString(), TENANT.toString(), 1000);

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("absent.csv");
    }
}
