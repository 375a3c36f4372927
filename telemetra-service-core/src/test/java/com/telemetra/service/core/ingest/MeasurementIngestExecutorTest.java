package com.telemetra.service.core.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.telemetra.service.core.config.TelemetraProperties;
import com.telemetra.service.core.normalize.MeasurementRow;
import com.telemetra.service.core.normalize.PayloadShape;
import com.telemetra.service.core.normalize.RowSource;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

class MeasurementIngestExecutorTest {

    private static final UUID TENANT = UUID.fromString("11111111-1111-1111-1111-111111111111");

    private InMemoryMeasurementRepository repository;
    private MeasurementIngestExecutor executor;

    @BeforeEach
    void setup() {
        repository = new InMemoryMeasurementRepository();
        TelemetraProperties properties = new TelemetraProperties();
        properties.getIngest().setMaxBatchAttempts(3);
        executor = new MeasurementIngestExecutor(
                repository, new TransactionTemplate(mock(PlatformTransactionManager.class)), properties);
    }

    @Test
    void writesInBatchesAndReportsCumulativeTotals() {
        List<long[]> progress = new ArrayList<>();

        IngestionResult result = executor.ingest(
                TENANT,
                source(rows(5), 2),
                2,
                (totals, rowsRead) -> progress.add(new long[] {totals.created(), totals.failed(), rowsRead}));

        assertThat(result).isEqualTo(new IngestionResult(5, 2, 0));
        assertThat(repository.batchSizes()).containsExactly(2, 2, 1);
        assertThat(progress).extracting(p -> p[0]).containsExactly(2L, 4L, 5L);
        assertThat(progress).extracting(p -> p[2]).isSorted();
    }

    @Test
    void duplicatesOnNaturalKeyAreNotCounted() {
        executor.ingest(TENANT, source(rows(3), 0), 10);

        IngestionResult again = executor.ingest(TENANT, source(rows(4), 0), 10);

        assertThat(again.created()).isEqualTo(1);
        assertThat(repository.size()).isEqualTo(4);
    }

    @Test
    void failedBatchIsCountedAndLaterBatchesStillCommit() {
        repository.succeedNext();
        repository.failNext(new DataIntegrityViolationException("value out of range"));

        IngestionResult result = executor.ingest(TENANT, source(rows(6), 0), 2);

        assertThat(result.created()).isEqualTo(4);
        assertThat(result.failed()).isEqualTo(2);
        assertThat(repository.size()).isEqualTo(4);
    }

    @Test
    void givenUpBatchIsReportedWithItsPosition() {
        repository.succeedNext();
        repository.failNext(new DataIntegrityViolationException("value out of range"));
        List<String> reported = new ArrayList<>();

        executor.ingest(TENANT, source(rows(5), 0), 2, new BatchListener() {
            @Override
            public void afterBatch(IngestionResult totals, long rowsRead) {}

            @Override
            public void batchFailed(int batchNumber, int rows, DataAccessException cause) {
                reported.add(batchNumber + ":" + rows + ":" + cause.getMessage());
            }
        });

        assertThat(reported).containsExactly("2:2:value out of range");
    }

    @Test
    void deadlockIsRetriedWithTheSameBatch() {
        repository.failNext(new UncategorizedSQLException("insert", "INSERT", new SQLException("deadlock", "40P01")));

        IngestionResult result = executor.ingest(TENANT, source(rows(3), 0), 10);

        assertThat(result.created()).isEqualTo(3);
        assertThat(result.failed()).isZero();
        assertThat(repository.calls()).isEqualTo(2);
    }

    @Test
    void transientFailureGivesUpAfterMaxAttempts() {
        for (int i = 0; i < 3; i++) {
            repository.failNext(new PessimisticLockingFailureException("lock timeout"));
        }

        IngestionResult result = executor.ingest(TENANT, source(rows(2), 0), 10);

        assertThat(result.failed()).isEqualTo(2);
        assertThat(result.created()).isZero();
        assertThat(repository.calls()).isEqualTo(3);
    }

    @Test
    void lostStorePropagates() {
        repository.failNext(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> executor.ingest(TENANT, source(rows(2), 0), 10))
                .isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void recognisesTransientSqlStates() {
        assertThat(MeasurementIngestExecutor.isTransient(
                        new UncategorizedSQLException("x", "x", new SQLException("serialization", "40001"))))
                .isTrue();
        assertThat(MeasurementIngestExecutor.isTransient(new DataIntegrityViolationException("dup")))
                .isFalse();
    }

    private static List<MeasurementRow> rows(int n) {
        List<MeasurementRow> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            rows.add(new MeasurementRow("dev-1", "temperature", Instant.ofEpochSecond(1_700_000_000L + i), 20.0 + i, null));
        }
        return rows;
    }

    private static RowSource source(List<MeasurementRow> rows, long rejected) {
        return RowSource.of(PayloadShape.JSON_ARRAY, rows, rejected);
    }
}
