package com.telemetra.service.storage.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetra.service.core.ingest.MeasurementRecord;
import com.telemetra.service.core.ingest.MeasurementRepository;
import com.telemetra.service.core.normalize.MeasurementRow;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcMeasurementRepository implements MeasurementRepository {

    private static final TypeReference<LinkedHashMap<String, Object>> TAGS_TYPE = new TypeReference<>() {};

    static final String INSERT_SQL =
            """
            INSERT INTO iot_measurements (id, organization_id, device_id, metric, recorded_at, value, tags)
            VALUES (?, ?, ?, ?, ?, ?, cast(? as jsonb))
            ON CONFLICT (organization_id, device_id, metric, recorded_at) DO NOTHING
            """;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    @Override
    public int insertIgnoringDuplicates(UUID tenantId, List<MeasurementRow> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        int[] counts = jdbcTemplate.batchUpdate(INSERT_SQL, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                MeasurementRow row = rows.get(i);
                ps.setObject(1, UUID.randomUUID());
                ps.setObject(2, tenantId);
                ps.setString(3, row.deviceId());
                ps.setString(4, row.metric());
                ps.setTimestamp(5, Timestamp.from(row.recordedAt()));
                if (row.value() == null) {
                    ps.setNull(6, Types.DOUBLE);
                } else {
                    ps.setDouble(6, row.value());
                }
                if (row.tags() == null) {
                    ps.setNull(7, Types.VARCHAR);
                } else {
                    ps.setString(7, toJson(row.tags()));
                }
            }

            @Override
            public int getBatchSize() {
                return rows.size();
            }
        });
        int inserted = 0;
        for (int count : counts) {
            // ON CONFLICT DO NOTHING reports 0 for a skipped duplicate
            if (count > 0) {
                inserted += count;
            } else if (count == Statement.SUCCESS_NO_INFO) {
                log.warn("Driver returned SUCCESS_NO_INFO for a measurement insert; created count will be low");
            }
        }
        return inserted;
    }

    @Override
    public List<MeasurementRecord> findRecent(UUID tenantId, String deviceId, String metric, int limit) {
        StringBuilder sql = new StringBuilder(
                """
                SELECT id, device_id, metric, recorded_at, value, tags::text AS tags, ingested_at
                  FROM iot_measurements
                 WHERE organization_id = :tenant
                """);
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("tenant", tenantId);
        if (deviceId != null && !deviceId.isBlank()) {
            sql.append("   AND device_id = :device\n");
            params.addValue("device", deviceId);
        }
        if (metric != null && !metric.isBlank()) {
            sql.append("   AND metric = :metric\n");
            params.addValue("metric", metric);
        }
        sql.append(" ORDER BY recorded_at DESC\n LIMIT :limit");
        params.addValue("limit", limit);
        log.debug("Measurement preview SQL: {} params={}", sql, params.getValues());
        return jdbc.query(sql.toString(), params, this::mapRecord);
    }

    private MeasurementRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        double value = rs.getDouble("value");
        Double boxed = rs.wasNull() ? null : value;
        return new MeasurementRecord(
                rs.getObject("id", UUID.class),
                rs.getString("device_id"),
                rs.getString("metric"),
                toInstant(rs.getTimestamp("recorded_at")),
                boxed,
                fromJson(rs.getString("tags")),
                toInstant(rs.getTimestamp("ingested_at")));
    }

    private String toJson(Map<String, Object> tags) {
        try {
            return objectMapper.writeValueAsString(tags);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Tags are not serializable to JSON", ex);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, TAGS_TYPE);
        } catch (JsonProcessingException ex) {
            log.warn("Stored tags are not a JSON object: {}", ex.getOriginalMessage());
            return null;
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
