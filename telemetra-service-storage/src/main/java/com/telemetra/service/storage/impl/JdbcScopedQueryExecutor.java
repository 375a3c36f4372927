package com.telemetra.service.storage.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetra.service.core.config.TelemetraProperties;
import com.telemetra.service.core.query.QueryExecutionException;
import com.telemetra.service.core.query.QueryRejectedException;
import com.telemetra.service.core.query.QueryResult;
import com.telemetra.service.core.query.ScopedQuery;
import com.telemetra.service.core.query.ScopedQueryExecutor;
import com.telemetra.service.storage.config.JdbcConfig;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs scoped queries on a dedicated {@link JdbcTemplate} (statement timeout, row cap) inside a
 * read-only transaction. Driver messages are logged, never returned.
 */
@Component
@Slf4j
public class JdbcScopedQueryExecutor implements ScopedQueryExecutor {

    static final String UNDEFINED_COLUMN = "42703";
    static final String GENERIC_FAILURE = "The query could not be executed";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate readOnlyTx;
    private final ObjectMapper objectMapper;
    private final String tenantColumn;

    @Autowired
    public JdbcScopedQueryExecutor(
            @Qualifier(JdbcConfig.SCOPED_QUERY_JDBC_TEMPLATE) JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            ObjectMapper objectMapper,
            TelemetraProperties properties) {
        this(jdbcTemplate, readOnly(new TransactionTemplate(transactionManager)), objectMapper, properties);
    }

    JdbcScopedQueryExecutor(
            JdbcTemplate jdbcTemplate,
            TransactionTemplate readOnlyTx,
            ObjectMapper objectMapper,
            TelemetraProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.readOnlyTx = readOnly(readOnlyTx);
        this.objectMapper = objectMapper;
        this.tenantColumn = properties.getQuery().getTenantColumn();
    }

    private static TransactionTemplate readOnly(TransactionTemplate tx) {
        tx.setReadOnly(true);
        return tx;
    }

    @Override
    public QueryResult execute(ScopedQuery query) {
        try {
            ResultSetExtractor<QueryResult> extractor = this::extract;
            return readOnlyTx.execute(status -> jdbcTemplate.query(query.sql(), extractor, query.tenantId()));
        } catch (DataAccessException ex) {
            if (isMissingTenantColumn(ex)) {
                log.info("Rejected ad-hoc query without {} for tenant {}", tenantColumn, query.tenantId());
                throw new QueryRejectedException(
                        "The query result must include the " + tenantColumn
                                + " column so it can be limited to your organization; select it explicitly or use SELECT *",
                        ex);
            }
            log.warn("Ad-hoc query failed for tenant {}: {}", query.tenantId(), ex.getMostSpecificCause().getMessage(), ex);
            throw new QueryExecutionException(GENERIC_FAILURE, ex);
        }
    }

    private QueryResult extract(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        boolean[] json = new boolean[columnCount];
        for (int i = 1; i <= columnCount; i++) {
            columns.add(meta.getColumnLabel(i));
            String typeName = meta.getColumnTypeName(i);
            json[i - 1] = typeName != null
                    && (typeName.equalsIgnoreCase("json") || typeName.equalsIgnoreCase("jsonb"));
        }
        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(json[i - 1] ? readJson(rs.getString(i)) : convert(rs.getObject(i)));
            }
            rows.add(row);
        }
        return new QueryResult(columns, rows, rows.size());
    }

    private Object readJson(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException ex) {
            log.debug("Returning unparseable json column as text: {}", ex.getOriginalMessage());
            return raw;
        }
    }

    static Object convert(Object value) throws SQLException {
        if (value == null
                || value instanceof Number
                || value instanceof String
                || value instanceof Boolean
                || value instanceof UUID) {
            return value;
        }
        if (value instanceof Timestamp ts) {
            return ts.toInstant();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof java.sql.Time time) {
            return time.toLocalTime();
        }
        if (value instanceof Array array) {
            Object elements = array.getArray();
            if (elements instanceof Object[] objects) {
                List<Object> list = new ArrayList<>(objects.length);
                for (Object element : objects) {
                    list.add(convert(element));
                }
                return list;
            }
            return String.valueOf(elements);
        }
        if (value instanceof byte[]) {
            return value;
        }
        return value.toString();
    }

    private boolean isMissingTenantColumn(Throwable ex) {
        String column = tenantColumn.toLowerCase(Locale.ROOT);
        Throwable cause = ex;
        while (cause != null) {
            if (cause instanceof SQLException sqlEx
                    && UNDEFINED_COLUMN.equals(sqlEx.getSQLState())
                    && sqlEx.getMessage() != null
                    && sqlEx.getMessage().toLowerCase(Locale.ROOT).contains(column)) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
