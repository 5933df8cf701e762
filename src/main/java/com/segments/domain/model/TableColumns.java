package com.segments.domain.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Introspected column catalog of one table, in ordinal order.
 */
@Value
public class TableColumns {

    TableName table;
    Set<String> names;

    public static TableColumns of(TableName table, List<String> names) {
        return new TableColumns(table, Collections.unmodifiableSet(new LinkedHashSet<>(names)));
    }

    public boolean contains(String column) {
        return names.contains(column);
    }
}
