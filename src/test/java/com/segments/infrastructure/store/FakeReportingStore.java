package com.segments.infrastructure.store;

import com.segments.domain.model.TableName;
import com.segments.domain.query.CompiledQuery;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * In-memory store scripted by SQL fragment: the first rule whose fragment occurs in the
 * named-placeholder text of a query supplies its result.
 */
public class FakeReportingStore implements ReportingStore {

    private final Map<String, List<String>> columns = new LinkedHashMap<>();
    private final Map<String, List<Map<String, Object>>> rowRules = new LinkedHashMap<>();
    private final Map<String, Long> scalarRules = new LinkedHashMap<>();
    private final List<CompiledQuery> executed = new ArrayList<>();
    private RuntimeException failure;
    private int introspections;

    public FakeReportingStore withColumns(String table, String... names) {
        columns.put(table, List.of(names));
        return this;
    }

    public FakeReportingStore withColumns(String table, List<String> names) {
        columns.put(table, List.copyOf(names));
        return this;
    }

    public FakeReportingStore onQuery(String sqlFragment, List<Map<String, Object>> rows) {
        rowRules.put(sqlFragment, rows);
        return this;
    }

    public FakeReportingStore onScalar(String sqlFragment, long value) {
        scalarRules.put(sqlFragment, value);
        return this;
    }

    public FakeReportingStore failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    public List<CompiledQuery> executed() {
        return executed;
    }

    public int introspections() {
        return introspections;
    }

    @Override
    public List<Map<String, Object>> query(CompiledQuery query) {
        record(query);
        return rowRules.entrySet().stream()
                .filter(rule -> query.getSql().contains(rule.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unexpected query: " + query.getSql()));
    }

    @Override
    public long queryForLong(CompiledQuery query) {
        record(query);
        return scalarRules.entrySet().stream()
                .filter(rule -> query.getSql().contains(rule.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unexpected scalar query: " + query.getSql()));
    }

    @Override
    public long stream(CompiledQuery query, RowSink sink) {
        List<Map<String, Object>> rows = query(query);
        try {
            if (!rows.isEmpty()) {
                sink.columns(new ArrayList<>(rows.get(0).keySet()));
            }
            for (Map<String, Object> row : rows) {
                sink.row(new ArrayList<>(row.values()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return rows.size();
    }

    @Override
    public List<String> listColumns(TableName table) {
        failIfBroken();
        introspections++;
        return columns.getOrDefault(table.value(), List.of());
    }

    @Override
    public List<String> listTables() {
        failIfBroken();
        return new ArrayList<>(new TreeSet<>(columns.keySet()));
    }

    @Override
    public void ping() {
        failIfBroken();
    }

    private void record(CompiledQuery query) {
        failIfBroken();
        executed.add(query);
    }

    private void failIfBroken() {
        if (failure != null) {
            throw failure;
        }
    }
}
