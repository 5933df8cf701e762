package com.segments.domain.service;

import com.segments.domain.exception.NotFoundException;
import com.segments.domain.exception.ValidationException;
import com.segments.domain.model.LogicalField;
import com.segments.domain.model.TableColumns;
import com.segments.domain.model.TableName;
import com.segments.domain.model.TimelinePoint;
import com.segments.domain.model.UserExport;
import com.segments.domain.model.UserSearchResponse;
import com.segments.domain.model.UserTimelineResponse;
import com.segments.domain.model.WeekColumn;
import com.segments.domain.query.QueryCompiler;
import com.segments.domain.schema.ColumnResolver;
import com.segments.domain.schema.ResolvedColumn;
import com.segments.domain.schema.SchemaCatalog;
import com.segments.infrastructure.store.ReportingStore;
import com.segments.infrastructure.store.RowSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * User-level reports: search, weekly timeline and export.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserReportService {

    private final ReportingStore store;
    private final SchemaCatalog schemaCatalog;
    private final ColumnResolver columnResolver;
    private final QueryCompiler queryCompiler;
    private final ReportMetrics metrics;

    /**
     * Users whose name, email, phone or id contains {@code term}, ignoring case.
     */
    public UserSearchResponse search(TableName table, String term, int limit) {
        if (term == null || term.isBlank()) {
            throw new ValidationException("Search term cannot be empty.");
        }
        return metrics.timed("user_search", () -> {
            TableColumns columns = schemaCatalog.columns(table);
            List<Map<String, Object>> rows = store.query(queryCompiler.search(table,
                    columnResolver.require(LogicalField.NAME, columns),
                    columnResolver.require(LogicalField.EMAIL, columns),
                    columnResolver.require(LogicalField.PHONE, columns),
                    columnResolver.require(LogicalField.USER_ID, columns),
                    term, limit));

            log.info("User search in '{}' matched {} rows", table, rows.size());
            return new UserSearchResponse(rows.size(), rows);
        });
    }

    /**
     * Weekly activity of one user, restricted to weeks inside [start, end].
     *
     * @throws ValidationException if start is after end
     * @throws NotFoundException if the table has no week columns or the user does not exist
     */
    public UserTimelineResponse timeline(TableName table, long userId, LocalDate start, LocalDate end) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new ValidationException("Start date must be before or equal to end date.");
        }
        return metrics.timed("user_timeline", () -> {
            TableColumns columns = schemaCatalog.columns(table);
            ResolvedColumn userIdColumn = columnResolver.require(LogicalField.USER_ID, columns);
            ResolvedColumn name = columnResolver.require(LogicalField.NAME, columns);
            ResolvedColumn segment = columnResolver.require(LogicalField.SEGMENT, columns);
            List<WeekColumn> weeks = schemaCatalog.requireWeeks(table);

            Map<String, Object> row = RowValues.first(store.query(
                            queryCompiler.userTimeline(table, userIdColumn, name, segment, weeks, userId)))
                    .orElseThrow(() -> new NotFoundException("User not found."));

            List<TimelinePoint> points = new ArrayList<>();
            for (int i = 0; i < weeks.size(); i++) {
                WeekColumn week = weeks.get(i);
                if (week.within(start, end)) {
                    points.add(TimelinePoint.of(week, RowValues.asLong(row.get(QueryCompiler.weekAlias(i)))));
                }
            }

            log.info("Timeline for user {} in '{}': {} weeks", userId, table, points.size());

            return UserTimelineResponse.builder()
                    .userId(RowValues.asLong(row.get(QueryCompiler.USER_ID)))
                    .name(RowValues.text(row.get(QueryCompiler.NAME)))
                    .segment(RowValues.text(row.get(QueryCompiler.SEGMENT)))
                    .points(points)
                    .build();
        });
    }

    /**
     * Check that an export has rows and build its query. Runs before any output is written,
     * so an empty export can still be reported as not found.
     */
    public UserExport prepareExport(TableName table, List<String> segments) {
        return metrics.timed("user_export_count", () -> {
            TableColumns columns = schemaCatalog.columns(table);
            ResolvedColumn segment = columnResolver.require(LogicalField.SEGMENT, columns);
            ResolvedColumn name = columnResolver.require(LogicalField.NAME, columns);

            long rowCount = store.queryForLong(queryCompiler.exportCount(table, segment, segments));
            if (rowCount == 0) {
                throw new NotFoundException("No users found for the provided filters.");
            }

            List<String> filter = segments == null ? List.of() : List.copyOf(segments);
            return new UserExport(table, filter, rowCount, queryCompiler.export(table, segment, name, segments));
        });
    }

    /**
     * Stream every row of a prepared export into {@code sink}.
     *
     * @return rows written
     */
    public long streamExport(UserExport export, RowSink sink) {
        return metrics.timed("user_export", () -> {
            long startTime = System.currentTimeMillis();
            long written = store.stream(export.getQuery(), sink);
            log.info("Exported {} rows from '{}' ({} ms)", written, export.getTable(),
                    System.currentTimeMillis() - startTime);
            return written;
        });
    }
}
