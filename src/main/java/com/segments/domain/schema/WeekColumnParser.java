package com.segments.domain.schema;

import com.segments.domain.model.WeekColumn;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recognizes week columns ({@code 2024-01-01 - 2024-01-07}, optionally prefixed with a single
 * quote by some exporters that guard numeric-looking names) and turns them into a chronological catalog.
 *
 * A range whose start falls after its end is still accepted.
 */
public final class WeekColumnParser {

    static final Pattern WEEK_PATTERN =
            Pattern.compile("^'?\\d{4}-\\d{2}-\\d{2} - \\d{4}-\\d{2}-\\d{2}$");

    static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private static final String SEPARATOR = " - ";

    private WeekColumnParser() {
    }

    /**
     * Parse every week column in {@code columnNames}, sorted ascending by start date.
     * Names that do not match, or hold an impossible calendar date, are skipped.
     */
    public static List<WeekColumn> parse(Collection<String> columnNames) {
        List<WeekColumn> weeks = new ArrayList<>();
        for (String name : columnNames) {
            parseColumn(name).ifPresent(weeks::add);
        }
        // stable: equal start dates keep ordinal order
        weeks.sort(Comparator.comparing(WeekColumn::getStartDate));
        return List.copyOf(weeks);
    }

    public static Optional<WeekColumn> parseColumn(String columnName) {
        if (columnName == null || !WEEK_PATTERN.matcher(columnName).matches()) {
            return Optional.empty();
        }
        String label = columnName.startsWith("'") ? columnName.substring(1) : columnName;
        int sep = label.indexOf(SEPARATOR);
        if (sep < 0 || label.indexOf(SEPARATOR, sep + 1) >= 0) {
            return Optional.empty();
        }
        try {
            LocalDate start = LocalDate.parse(label.substring(0, sep), DATE_FORMAT);
            LocalDate end = LocalDate.parse(label.substring(sep + SEPARATOR.length()), DATE_FORMAT);
            return Optional.of(new WeekColumn(columnName, label, start, end));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
