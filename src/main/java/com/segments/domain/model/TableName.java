package com.segments.domain.model;

import com.segments.domain.exception.ValidationException;
import lombok.EqualsAndHashCode;

import java.util.regex.Pattern;

/**
 * Validated physical table name.
 *
 * Table names cannot be bound as statement parameters, so they are restricted to
 * letters, digits, spaces, underscores, hyphens and parentheses before they are
 * allowed anywhere near query text.
 */
@EqualsAndHashCode
public final class TableName {

    private static final Pattern ALLOWED = Pattern.compile("^[A-Za-z0-9_ ()-]+$");

    private final String value;

    private TableName(String value) {
        this.value = value;
    }

    /**
     * Validate and trim a raw table name.
     *
     * @throws ValidationException if the name is blank or has characters outside the allowed set
     */
    public static TableName of(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Table name cannot be empty.");
        }
        String candidate = raw.strip();
        if (!ALLOWED.matcher(candidate).matches()) {
            throw new ValidationException(
                    "Table name may only contain letters, numbers, spaces, underscores, parentheses, or hyphens.");
        }
        return new TableName(candidate);
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
