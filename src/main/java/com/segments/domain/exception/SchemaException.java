package com.segments.domain.exception;

import lombok.Getter;

/**
 * A required logical field has no physical column in the resolved table.
 *
 * The table is incompatible with the reporting schema; this is a configuration
 * problem, not a missing-data problem.
 */
@Getter
public class SchemaException extends ReportingException {

    private final String field;
    private final String table;

    public SchemaException(String field, String table) {
        super("Column '" + field + "' not found in table '" + table + "'.");
        this.field = field;
        this.table = table;
    }

    @Override
    public String getKind() {
        return "SCHEMA_ERROR";
    }
}
