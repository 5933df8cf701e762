package com.segments.infrastructure.store;

import com.segments.domain.model.TableName;
import com.segments.domain.query.CompiledQuery;

import java.util.List;
import java.util.Map;

/**
 * Read-only access to the backing relational store.
 *
 * Every method reports failures as {@link com.segments.domain.exception.StoreException}.
 */
public interface ReportingStore {

    /**
     * Execute a query and return its rows, each keyed by result column label.
     */
    List<Map<String, Object>> query(CompiledQuery query);

    /**
     * Execute a single-value query (e.g. a {@code COUNT(*)}). Null results read as zero.
     */
    long queryForLong(CompiledQuery query);

    /**
     * Execute a query and hand rows to {@code sink} one at a time without buffering them.
     *
     * @return number of rows streamed
     */
    long stream(CompiledQuery query, RowSink sink);

    /**
     * Column names of {@code table} in ordinal order; empty if the table does not exist.
     */
    List<String> listColumns(TableName table);

    List<String> listTables();

    void ping();
}
