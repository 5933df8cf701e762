package com.segments.domain.service;

import com.segments.domain.model.TableList;
import com.segments.domain.model.TableName;
import com.segments.domain.model.TablePreview;
import com.segments.domain.query.QueryCompiler;
import com.segments.infrastructure.store.ReportingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Table discovery, previews and the store health probe.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableService {

    private final ReportingStore store;
    private final QueryCompiler queryCompiler;

    public TableList listTables() {
        return new TableList(store.listTables());
    }

    public TablePreview preview(TableName table, int limit) {
        List<Map<String, Object>> rows = store.query(queryCompiler.preview(table, limit));
        log.debug("Preview of '{}': {} rows", table, rows.size());
        return new TablePreview(table.value(), rows.size(), rows);
    }

    public void checkHealth() {
        store.ping();
    }
}
