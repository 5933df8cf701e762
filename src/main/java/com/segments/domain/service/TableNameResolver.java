package com.segments.domain.service;

import com.segments.config.ReportingProperties;
import com.segments.domain.model.TableName;
import org.springframework.stereotype.Component;

/**
 * Turns the optional table name of a request into a validated {@link TableName}.
 */
@Component
public class TableNameResolver {

    private final TableName defaultTable;

    public TableNameResolver(ReportingProperties properties) {
        // fail at startup on a bad default rather than on every request
        this.defaultTable = TableName.of(properties.getDefaultTable());
    }

    public TableName resolve(String requested) {
        return requested == null || requested.isEmpty() ? defaultTable : TableName.of(requested);
    }
}
