package com.segments.api;

import com.segments.domain.model.SegmentInsightResponse;
import com.segments.domain.model.SegmentStatsResponse;
import com.segments.domain.model.SegmentTrendResponse;
import com.segments.domain.model.TableName;
import com.segments.domain.model.TrendQuery;
import com.segments.domain.model.UserExport;
import com.segments.domain.model.UserSearchResponse;
import com.segments.domain.model.UserTimelineResponse;
import com.segments.domain.service.SegmentReportService;
import com.segments.domain.service.TableNameResolver;
import com.segments.domain.service.UserReportService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

/**
 * REST API for segment and user reports.
 *
 * Endpoints:
 * - GET /api/v1/stats/segments - Users per segment and category
 * - GET /api/v1/segments/{segment}/insights - Metrics and recent activity of a segment
 * - GET /api/v1/segments/trends - Weekly totals per segment
 * - GET /api/v1/users/search - Find users by name, email, phone or id
 * - GET /api/v1/users/{userId}/timeline - Weekly activity of a user
 * - GET /api/v1/export/users - CSV export, optionally filtered by segment
 *
 * Every endpoint accepts an optional table_name; the configured default table is used otherwise.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ReportingController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final SegmentReportService segmentReportService;
    private final UserReportService userReportService;
    private final TableNameResolver tableNameResolver;

    @GetMapping("/stats/segments")
    public ResponseEntity<SegmentStatsResponse> segmentStats(
            @RequestParam(name = "table_name", required = false) String tableName) {

        TableName table = tableNameResolver.resolve(tableName);
        log.info("Segment stats: table={}", table);

        return ResponseEntity.ok(segmentReportService.segmentStats(table));
    }

    /**
     * GET /api/v1/segments/{segment}/insights?table_name=xxx&weeks=8
     *
     * weeks: how many recent weeks to summarize (1..24, default 8)
     */
    @GetMapping("/segments/{segment}/insights")
    public ResponseEntity<SegmentInsightResponse> segmentInsights(
            @PathVariable String segment,
            @RequestParam(name = "table_name", required = false) String tableName,
            @RequestParam(defaultValue = "8") @Min(1) @Max(24) int weeks) {

        TableName table = tableNameResolver.resolve(tableName);
        log.info("Segment insights: table={}, segment={}, weeks={}", table, segment, weeks);

        return ResponseEntity.ok(segmentReportService.segmentInsights(table, segment, weeks));
    }

    /**
     * GET /api/v1/segments/trends?segments=a&segments=b&start=2024-01-01&end=2024-03-31&weeks=12
     *
     * Query Parameters:
     * - segments (optional): segments to include, all by default
     * - start (optional): only weeks starting on/after this date
     * - end (optional): only weeks ending on/before this date
     * - weeks (optional): most recent weeks to keep, and fallback window (1..52, default 12)
     */
    @GetMapping("/segments/trends")
    public ResponseEntity<SegmentTrendResponse> segmentTrends(
            @RequestParam(required = false) List<String> segments,
            @RequestParam(name = "table_name", required = false) String tableName,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(defaultValue = "12") @Min(1) @Max(52) int weeks) {

        TableName table = tableNameResolver.resolve(tableName);
        log.info("Segment trends: table={}, segments={}, start={}, end={}, weeks={}",
                table, segments, start, end, weeks);

        TrendQuery request = TrendQuery.builder()
                .segments(segments)
                .start(start)
                .end(end)
                .weeks(weeks)
                .build();

        return ResponseEntity.ok(segmentReportService.segmentTrends(table, request));
    }

    /**
     * GET /api/v1/users/search?q=xxx&limit=5
     */
    @GetMapping("/users/search")
    public ResponseEntity<UserSearchResponse> searchUsers(
            @RequestParam String q,
            @RequestParam(name = "table_name", required = false) String tableName,
            @RequestParam(defaultValue = "5") @Min(1) @Max(50) int limit) {

        TableName table = tableNameResolver.resolve(tableName);
        log.info("User search: table={}, limit={}", table, limit);

        return ResponseEntity.ok(userReportService.search(table, q, limit));
    }

    /**
     * GET /api/v1/users/{userId}/timeline?start=2024-01-01&end=2024-03-31
     */
    @GetMapping("/users/{userId}/timeline")
    public ResponseEntity<UserTimelineResponse> userTimeline(
            @PathVariable long userId,
            @RequestParam(name = "table_name", required = false) String tableName,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {

        TableName table = tableNameResolver.resolve(tableName);
        log.info("User timeline: table={}, userId={}, start={}, end={}", table, userId, start, end);

        return ResponseEntity.ok(userReportService.timeline(table, userId, start, end));
    }

    /**
     * GET /api/v1/export/users?segments=a&segments=b
     *
     * Rows are streamed to the client as they are read; an empty result is a 404.
     */
    @GetMapping("/export/users")
    public ResponseEntity<StreamingResponseBody> exportUsers(
            @RequestParam(name = "table_name", required = false) String tableName,
            @RequestParam(required = false) List<String> segments) {

        TableName table = tableNameResolver.resolve(tableName);
        log.info("Export users: table={}, segments={}", table, segments);

        UserExport export = userReportService.prepareExport(table, segments);

        StreamingResponseBody body = out -> {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            CsvExportSink sink = new CsvExportSink(writer);
            userReportService.streamExport(export, sink);
            sink.flush();
        };

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + export.fileName() + "\"")
                .contentType(TEXT_CSV)
                .body(body);
    }
}
