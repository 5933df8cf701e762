package com.segments.domain.schema;

import com.segments.domain.model.LogicalField;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.NoSuchElementException;

/**
 * Outcome of resolving a {@link LogicalField} against a table: the physical column
 * name, or an explicit absence.
 */
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ResolvedColumn {

    private final LogicalField field;
    private final String name;

    public static ResolvedColumn present(LogicalField field, String name) {
        return new ResolvedColumn(field, name);
    }

    public static ResolvedColumn absent(LogicalField field) {
        return new ResolvedColumn(field, null);
    }

    public LogicalField getField() {
        return field;
    }

    public boolean isPresent() {
        return name != null;
    }

    public String getName() {
        if (name == null) {
            throw new NoSuchElementException(field.getDisplayName() + " is not available");
        }
        return name;
    }
}
