package com.segments.domain.query;

import com.segments.domain.model.TableName;
import com.segments.domain.model.WeekColumn;
import com.segments.domain.schema.ResolvedColumn;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Accumulates query text and bound parameters side by side.
 *
 * Trust boundary: identifiers only enter the text through {@link #table(TableName)},
 * {@link #column(ResolvedColumn)} and {@link #week(WeekColumn)}, all of which come from
 * a validated table name or the introspected column catalog. Values only enter
 * through {@link #bind(String, Object)} and {@link #bindAll(String, Collection)}.
 *
 * Two texts are kept: one with named placeholders for logs and assertions, and one with
 * positional {@code ?} markers for execution. Quoted identifiers may contain single
 * quotes, so the executable text is never re-parsed for placeholders.
 */
public class SqlBuilder {

    private final StringBuilder text = new StringBuilder();
    private final StringBuilder jdbcText = new StringBuilder();
    private final Map<String, Object> params = new LinkedHashMap<>();

    public SqlBuilder append(String fragment) {
        text.append(fragment);
        jdbcText.append(fragment);
        return this;
    }

    public SqlBuilder table(TableName table) {
        return append(quote(table.value()));
    }

    public SqlBuilder column(ResolvedColumn column) {
        return append(quote(column.getName()));
    }

    public SqlBuilder week(WeekColumn week) {
        return append(quote(week.getRaw()));
    }

    /**
     * Append a placeholder for {@code value} and record the binding.
     */
    public SqlBuilder bind(String name, Object value) {
        if (params.containsKey(name)) {
            throw new IllegalArgumentException("Parameter already bound: " + name);
        }
        params.put(name, value);
        text.append(':').append(name);
        jdbcText.append('?');
        return this;
    }

    /**
     * Append {@code :name_0, :name_1, ...} for an IN list.
     */
    public SqlBuilder bindAll(String name, Collection<?> values) {
        StringJoiner joiner = new StringJoiner(", ");
        StringJoiner jdbcJoiner = new StringJoiner(", ");
        int idx = 0;
        for (Object value : values) {
            String key = name + "_" + idx++;
            if (params.containsKey(key)) {
                throw new IllegalArgumentException("Parameter already bound: " + key);
            }
            params.put(key, value);
            joiner.add(":" + key);
            jdbcJoiner.add("?");
        }
        text.append(joiner);
        jdbcText.append(jdbcJoiner);
        return this;
    }

    public CompiledQuery build() {
        return new CompiledQuery(text.toString(), jdbcText.toString(), params);
    }

    static String quote(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }
}
