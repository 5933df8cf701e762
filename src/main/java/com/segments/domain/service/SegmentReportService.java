package com.segments.domain.service;

import com.segments.domain.exception.NotFoundException;
import com.segments.domain.model.Category;
import com.segments.domain.model.LogicalField;
import com.segments.domain.model.SegmentCounts;
import com.segments.domain.model.SegmentInsightMetrics;
import com.segments.domain.model.SegmentInsightResponse;
import com.segments.domain.model.SegmentStatsResponse;
import com.segments.domain.model.SegmentTrendPoint;
import com.segments.domain.model.SegmentTrendResponse;
import com.segments.domain.model.TableColumns;
import com.segments.domain.model.TableName;
import com.segments.domain.model.TimelinePoint;
import com.segments.domain.model.TrendQuery;
import com.segments.domain.model.WeekColumn;
import com.segments.domain.query.InsightColumns;
import com.segments.domain.query.QueryCompiler;
import com.segments.domain.query.WeekSelection;
import com.segments.domain.schema.CategoryMapper;
import com.segments.domain.schema.ColumnResolver;
import com.segments.domain.schema.ResolvedColumn;
import com.segments.domain.schema.SchemaCatalog;
import com.segments.infrastructure.cache.ReportCacheService;
import com.segments.infrastructure.store.ReportingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Segment-level reports: breakdown, insights and trends.
 *
 * Report Flow:
 * 1. Load the column / week catalog of the table (cached)
 * 2. Resolve logical fields to physical columns
 * 3. Compile and execute the aggregate query
 * 4. Reshape rows, coalescing nulls to zero
 *
 * The breakdown scans the whole table and is cached in Redis; the other reports
 * are filtered by segment and always read the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SegmentReportService {

    private final ReportingStore store;
    private final SchemaCatalog schemaCatalog;
    private final ColumnResolver columnResolver;
    private final CategoryMapper categoryMapper;
    private final QueryCompiler queryCompiler;
    private final ReportCacheService cacheService;
    private final ReportMetrics metrics;

    @Value("${app.cache.ttl.segment-stats:300}")
    private long segmentStatsTtl;

    /**
     * User counts per segment label, plus totals per category.
     */
    public SegmentStatsResponse segmentStats(TableName table) {
        return metrics.timed("segment_stats", () -> {
            String cacheKey = cacheService.key("report:segments", table);
            Optional<SegmentStatsResponse> cached = cacheService.get(cacheKey, SegmentStatsResponse.class);
            if (cached.isPresent()) {
                log.debug("Cache hit for segment stats of '{}'", table);
                return cached.get();
            }

            long startTime = System.currentTimeMillis();

            TableColumns columns = schemaCatalog.columns(table);
            ResolvedColumn segment = columnResolver.require(LogicalField.SEGMENT, columns);

            List<Map<String, Object>> rows = store.query(queryCompiler.segmentCounts(table, segment));
            long totalUsers = store.queryForLong(queryCompiler.totalCount(table));

            Map<String, Long> totals = zeroCounts();
            List<SegmentCounts> segments = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                String label = RowValues.label(row.get(QueryCompiler.SEGMENT));
                Map<String, Long> counts = zeroCounts();
                Optional<Category> category = categoryMapper.categoryOf(label);
                if (category.isPresent()) {
                    long count = RowValues.asLong(row.get(QueryCompiler.USER_COUNT));
                    counts.put(category.get().getKey(), count);
                    totals.merge(category.get().getKey(), count, Long::sum);
                }
                segments.add(new SegmentCounts(label, counts));
            }

            SegmentStatsResponse response = SegmentStatsResponse.builder()
                    .categories(Category.keys())
                    .segments(segments)
                    .totals(totals)
                    .totalUsers(totalUsers)
                    .build();

            cacheService.set(cacheKey, response, segmentStatsTtl);

            log.info("Segment stats for '{}': {} segments, {} users, {} ms",
                    table, segments.size(), totalUsers, System.currentTimeMillis() - startTime);
            return response;
        });
    }

    /**
     * Metrics and recent weekly activity of one segment.
     *
     * @param weeks how many of the most recent weeks to report activity for
     * @throws NotFoundException if the table has no week columns or the segment has no users
     */
    public SegmentInsightResponse segmentInsights(TableName table, String segmentValue, int weeks) {
        return metrics.timed("segment_insights", () -> {
            long startTime = System.currentTimeMillis();

            TableColumns columns = schemaCatalog.columns(table);
            ResolvedColumn segment = columnResolver.require(LogicalField.SEGMENT, columns);
            List<WeekColumn> recentWeeks = WeekSelection.mostRecent(schemaCatalog.requireWeeks(table), weeks);

            InsightColumns insightColumns = InsightColumns.builder()
                    .cashBalance(columnResolver.optional(LogicalField.CASH_BALANCE, columns))
                    .totalContests(columnResolver.optional(LogicalField.TOTAL_CONTESTS_JOINED, columns))
                    .iplContests(columnResolver.optional(LogicalField.IPL_CONTESTS, columns))
                    .highestIplScore(columnResolver.optional(LogicalField.HIGHEST_IPL_SCORE, columns))
                    .registeredDate(columnResolver.optional(LogicalField.REGISTERED_DATE, columns))
                    .build();

            Map<String, Object> metricsRow = RowValues.first(
                            store.query(queryCompiler.insightMetrics(table, segment, insightColumns, segmentValue)))
                    .orElse(Map.of());
            long userCount = RowValues.asLong(metricsRow.get(QueryCompiler.USER_COUNT));
            if (userCount == 0) {
                throw new NotFoundException("Segment not found or has no users.");
            }

            long activeUsers = store.queryForLong(
                    queryCompiler.activeUsers(table, segment, recentWeeks, segmentValue));

            Map<String, Object> weeklyRow = RowValues.first(
                            store.query(queryCompiler.segmentWeeklyTotals(table, segment, recentWeeks, segmentValue)))
                    .orElse(Map.of());

            List<TimelinePoint> recentActivity = new ArrayList<>(recentWeeks.size());
            for (int i = 0; i < recentWeeks.size(); i++) {
                long contests = RowValues.asLong(weeklyRow.get(QueryCompiler.weekAlias(i)));
                recentActivity.add(TimelinePoint.of(recentWeeks.get(i), contests));
            }

            SegmentInsightMetrics insightMetrics = SegmentInsightMetrics.builder()
                    .userCount(userCount)
                    .avgCashBalance(RowValues.asDouble(metricsRow.get("avg_cash_balance")))
                    .avgTotalContests(RowValues.asDouble(metricsRow.get("avg_total_contests")))
                    .avgIplContests(RowValues.asDouble(metricsRow.get("avg_ipl_contests")))
                    .avgHighestIplScore(RowValues.asDouble(metricsRow.get("avg_highest_ipl_score")))
                    .avgDaysSinceRegistration(RowValues.asDouble(metricsRow.get("avg_days_since_registration")))
                    .recentActiveShare((double) activeUsers / userCount)
                    .build();

            log.info("Segment insights for '{}' in '{}': {} users, {} weeks, {} ms",
                    segmentValue, table, userCount, recentWeeks.size(), System.currentTimeMillis() - startTime);

            return SegmentInsightResponse.builder()
                    .segment(segmentValue)
                    .metrics(insightMetrics)
                    .recentActivity(recentActivity)
                    .build();
        });
    }

    /**
     * Weekly totals per segment over the window picked by {@link WeekSelection#forRange}.
     *
     * @throws NotFoundException if the table has no week columns or no segment matched
     */
    public SegmentTrendResponse segmentTrends(TableName table, TrendQuery request) {
        return metrics.timed("segment_trends", () -> {
            long startTime = System.currentTimeMillis();

            TableColumns columns = schemaCatalog.columns(table);
            ResolvedColumn segment = columnResolver.require(LogicalField.SEGMENT, columns);
            List<WeekColumn> selected = WeekSelection.forRange(
                    schemaCatalog.requireWeeks(table), request.getStart(), request.getEnd(), request.getWeeks());

            List<Map<String, Object>> rows = store.query(queryCompiler.trendTotals(
                    table, segment, selected, request.hasSegmentFilter() ? request.getSegments() : null));
            if (rows.isEmpty()) {
                throw new NotFoundException("No segments matched the provided filters.");
            }

            List<String> segments = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                segments.add(RowValues.label(row.get(QueryCompiler.SEGMENT)));
            }

            List<SegmentTrendPoint> points = new ArrayList<>(selected.size());
            for (int i = 0; i < selected.size(); i++) {
                WeekColumn week = selected.get(i);
                Map<String, Long> totals = new LinkedHashMap<>();
                for (int r = 0; r < rows.size(); r++) {
                    totals.put(segments.get(r), RowValues.asLong(rows.get(r).get(QueryCompiler.weekAlias(i))));
                }
                points.add(new SegmentTrendPoint(week.getLabel(), week.getStartDate(), week.getEndDate(), totals));
            }

            log.info("Segment trends for '{}': {} segments x {} weeks, {} ms",
                    table, segments.size(), selected.size(), System.currentTimeMillis() - startTime);

            return new SegmentTrendResponse(segments, points);
        });
    }

    private static Map<String, Long> zeroCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Category category : Category.values()) {
            counts.put(category.getKey(), 0L);
        }
        return counts;
    }
}
