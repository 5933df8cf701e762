package com.segments.domain.model;

import com.segments.domain.query.CompiledQuery;
import lombok.Value;

import java.util.List;

/**
 * A checked, ready-to-stream export: the filter it was built for, the row count seen
 * when it was prepared, and the query that produces the rows.
 */
@Value
public class UserExport {

    TableName table;
    List<String> segments;
    long rowCount;
    CompiledQuery query;

    /**
     * {@code users.csv}, or {@code users_<segment>_<segment>.csv} with spaces as underscores.
     */
    public String fileName() {
        if (segments == null || segments.isEmpty()) {
            return "users.csv";
        }
        return "users_" + String.join("_", segments).replace(' ', '_') + ".csv";
    }
}
