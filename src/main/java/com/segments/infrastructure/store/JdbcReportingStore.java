package com.segments.infrastructure.store;

import com.segments.domain.exception.StoreException;
import com.segments.domain.model.TableName;
import com.segments.domain.query.CompiledQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link ReportingStore} over MySQL via Spring JDBC.
 *
 * Introspection reads {@code information_schema} of the connection's current schema.
 * Streaming uses a separate template whose fetch size switches the driver to
 * row-by-row streaming.
 */
@Slf4j
public class JdbcReportingStore implements ReportingStore {

    private static final String LIST_COLUMNS = """
            SELECT column_name
            FROM information_schema.columns
            WHERE table_schema = DATABASE()
              AND table_name = ?
            ORDER BY ordinal_position
            """;

    private static final String LIST_TABLES = """
            SELECT table_name
            FROM information_schema.tables
            WHERE table_schema = DATABASE()
            ORDER BY table_name ASC
            """;

    private final JdbcTemplate jdbcTemplate;
    private final JdbcTemplate streamingTemplate;

    public JdbcReportingStore(JdbcTemplate jdbcTemplate, JdbcTemplate streamingTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.streamingTemplate = streamingTemplate;
    }

    @Override
    public List<Map<String, Object>> query(CompiledQuery query) {
        log.debug("Executing: {} {}", query.getSql(), query.getParams());
        return execute("query", () -> jdbcTemplate.queryForList(query.getJdbcSql(), query.arguments()));
    }

    @Override
    public long queryForLong(CompiledQuery query) {
        log.debug("Executing: {} {}", query.getSql(), query.getParams());
        Number value = execute("scalar query",
                () -> jdbcTemplate.queryForObject(query.getJdbcSql(), Number.class, query.arguments()));
        return value != null ? value.longValue() : 0L;
    }

    @Override
    public long stream(CompiledQuery query, RowSink sink) {
        log.debug("Streaming: {} {}", query.getSql(), query.getParams());
        Long streamed = execute("streaming query", () -> streamingTemplate.query(query.getJdbcSql(), rs -> {
            ResultSetMetaData meta = rs.getMetaData();
            int width = meta.getColumnCount();
            List<String> names = new ArrayList<>(width);
            for (int i = 1; i <= width; i++) {
                names.add(meta.getColumnLabel(i));
            }

            long rows = 0;
            try {
                sink.columns(names);
                while (rs.next()) {
                    List<Object> values = new ArrayList<>(width);
                    for (int i = 1; i <= width; i++) {
                        values.add(rs.getObject(i));
                    }
                    sink.row(values);
                    rows++;
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed writing streamed rows", e);
            }
            return rows;
        }, query.arguments()));
        return streamed != null ? streamed : 0L;
    }

    @Override
    public List<String> listColumns(TableName table) {
        return execute("column introspection",
                () -> jdbcTemplate.queryForList(LIST_COLUMNS, String.class, table.value()));
    }

    @Override
    public List<String> listTables() {
        return execute("table listing",
                () -> jdbcTemplate.queryForList(LIST_TABLES, String.class));
    }

    @Override
    public void ping() {
        execute("ping", () -> jdbcTemplate.queryForObject("SELECT 1", Integer.class));
    }

    private <T> T execute(String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("Store {} failed: {}", what, e.getMessage(), e);
            throw new StoreException("Database error: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
