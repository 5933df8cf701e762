package com.segments.domain.query;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A built statement.
 *
 * {@code sql} uses named placeholders ({@code :segment}); {@code jdbcSql} is the same text
 * with positional {@code ?} markers whose values are {@link #arguments()}, in bind order.
 */
@Value
public class CompiledQuery {

    String sql;
    String jdbcSql;
    Map<String, Object> params;

    public CompiledQuery(String sql, String jdbcSql, Map<String, Object> params) {
        this.sql = sql;
        this.jdbcSql = jdbcSql;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public Object[] arguments() {
        return new ArrayList<>(params.values()).toArray();
    }
}
