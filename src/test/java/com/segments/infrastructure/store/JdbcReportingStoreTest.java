package com.segments.infrastructure.store;

import com.segments.domain.exception.StoreException;
import com.segments.domain.model.TableName;
import com.segments.domain.query.CompiledQuery;
import com.segments.domain.query.SqlBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcReportingStoreTest {

    private static final TableName TABLE = TableName.of("user_cluster");

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private JdbcTemplate streamingTemplate;

    private JdbcReportingStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcReportingStore(jdbcTemplate, streamingTemplate);
    }

    private static CompiledQuery bySegment(String select) {
        return new SqlBuilder()
                .append(select).table(TABLE)
                .append(" WHERE `Segment` = ").bind("segment", "Casual")
                .build();
    }

    @Test
    void testQuery_BindsPositionally() {
        CompiledQuery query = bySegment("SELECT * FROM ");
        List<Map<String, Object>> rows = List.of(Map.of("Name", "Asha"));
        when(jdbcTemplate.queryForList("SELECT * FROM `user_cluster` WHERE `Segment` = ?", "Casual"))
                .thenReturn(rows);

        assertEquals(rows, store.query(query));
    }

    @Test
    void testQueryForLong_NullReadsAsZero() {
        CompiledQuery query = bySegment("SELECT COUNT(*) AS total FROM ");
        when(jdbcTemplate.queryForObject(query.getJdbcSql(), Number.class, "Casual")).thenReturn(null);

        assertEquals(0L, store.queryForLong(query));
    }

    @Test
    void testQuery_FailureBecomesStoreError() {
        CompiledQuery query = bySegment("SELECT * FROM ");
        when(jdbcTemplate.queryForList(query.getJdbcSql(), "Casual"))
                .thenThrow(new BadSqlGrammarException("query", query.getJdbcSql(),
                        new SQLException("Unknown column 'Segment' in 'where clause'")));

        StoreException e = assertThrows(StoreException.class, () -> store.query(query));
        assertEquals("Database error: Unknown column 'Segment' in 'where clause'", e.getMessage());
        assertEquals("STORE_ERROR", e.getKind());
    }

    @Test
    void testPing_Unreachable() {
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class))
                .thenThrow(new CannotGetJdbcConnectionException("Failed to obtain JDBC Connection",
                        new SQLException("Connection refused")));

        StoreException e = assertThrows(StoreException.class, () -> store.ping());
        assertEquals("Database error: Connection refused", e.getMessage());
    }

    @Test
    void testListColumns() {
        when(jdbcTemplate.queryForList(contains("information_schema.columns"), eq(String.class), eq("user_cluster")))
                .thenReturn(List.of("User ID", "Segment"));

        assertEquals(List.of("User ID", "Segment"), store.listColumns(TABLE));
    }

    @Test
    void testStream_WritesHeaderThenRows() throws Exception {
        // Given
        CompiledQuery query = bySegment("SELECT * FROM ");
        ResultSet resultSet = mock(ResultSet.class);
        ResultSetMetaData meta = mock(ResultSetMetaData.class);
        when(resultSet.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(2);
        when(meta.getColumnLabel(1)).thenReturn("Name");
        when(meta.getColumnLabel(2)).thenReturn("Segment");
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getObject(1)).thenReturn("Asha", "Ravi");
        when(resultSet.getObject(2)).thenReturn("Casual");
        when(streamingTemplate.query(eq(query.getJdbcSql()), ArgumentMatchers.<ResultSetExtractor<Long>>any(),
                eq("Casual")))
                .thenAnswer(invocation -> {
                    ResultSetExtractor<Long> extractor = invocation.getArgument(1);
                    return extractor.extractData(resultSet);
                });

        List<String> header = new ArrayList<>();
        List<List<Object>> rows = new ArrayList<>();
        RowSink sink = new RowSink() {
            @Override
            public void columns(List<String> names) {
                header.addAll(names);
            }

            @Override
            public void row(List<Object> values) {
                rows.add(values);
            }
        };

        // When
        long written = store.stream(query, sink);

        // Then
        assertEquals(2L, written);
        assertEquals(List.of("Name", "Segment"), header);
        assertEquals(List.of(List.of("Asha", "Casual"), List.of("Ravi", "Casual")), rows);
        verifyNoInteractions(jdbcTemplate);
    }
}
