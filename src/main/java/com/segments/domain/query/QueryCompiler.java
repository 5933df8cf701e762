package com.segments.domain.query;

import com.segments.domain.model.TableName;
import com.segments.domain.model.WeekColumn;
import com.segments.domain.schema.ResolvedColumn;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the MySQL statements behind every report.
 *
 * Identifiers come from a validated {@link TableName}, resolved columns or week columns;
 * every value is a bound parameter. Week sums are aliased positionally
 * ({@code week_0}, {@code week_1}, ...) in the order of the week list passed in.
 */
@Component
public class QueryCompiler {

    public static final String SEGMENT = "segment";
    public static final String USER_COUNT = "user_count";
    public static final String ACTIVE_USERS = "active_users";
    public static final String USER_ID = "user_id";
    public static final String NAME = "name";

    /** Number of most recent weeks that decide whether a user counts as recently active. */
    public static final int ACTIVITY_WINDOW = 4;

    public static String weekAlias(int index) {
        return "week_" + index;
    }

    public CompiledQuery segmentCounts(TableName table, ResolvedColumn segment) {
        return new SqlBuilder()
                .append("SELECT ").column(segment).append(" AS " + SEGMENT + ", COUNT(*) AS " + USER_COUNT)
                .append(" FROM ").table(table)
                .append(" GROUP BY ").column(segment)
                .append(" ORDER BY ").column(segment)
                .build();
    }

    public CompiledQuery totalCount(TableName table) {
        return new SqlBuilder()
                .append("SELECT COUNT(*) AS total FROM ").table(table)
                .build();
    }

    /**
     * One aggregate row for a segment: user count, metric averages and mean days since
     * registration. An absent metric column yields a literal {@code 0} so the row shape
     * never depends on which columns the table has.
     */
    public CompiledQuery insightMetrics(TableName table, ResolvedColumn segment, InsightColumns columns,
                                        String segmentValue) {
        SqlBuilder sql = new SqlBuilder().append("SELECT COUNT(*) AS " + USER_COUNT);
        avgDecimal(sql, columns.getCashBalance(), "avg_cash_balance");
        avgDecimal(sql, columns.getTotalContests(), "avg_total_contests");
        avgDecimal(sql, columns.getIplContests(), "avg_ipl_contests");
        avgDecimal(sql, columns.getHighestIplScore(), "avg_highest_ipl_score");
        avgDaysSince(sql, columns.getRegisteredDate(), "avg_days_since_registration");
        return sql.append(" FROM ").table(table)
                .append(" WHERE ").column(segment).append(" = ").bind("segment", segmentValue)
                .build();
    }

    /**
     * Users of a segment whose activity over the last (up to) {@link #ACTIVITY_WINDOW}
     * of {@code recentWeeks} sums above zero. {@code recentWeeks} must not be empty.
     */
    public CompiledQuery activeUsers(TableName table, ResolvedColumn segment, List<WeekColumn> recentWeeks,
                                     String segmentValue) {
        List<WeekColumn> window = WeekSelection.mostRecent(recentWeeks, ACTIVITY_WINDOW);
        SqlBuilder sql = new SqlBuilder()
                .append("SELECT COUNT(*) AS " + ACTIVE_USERS + " FROM ").table(table)
                .append(" WHERE ").column(segment).append(" = ").bind("segment", segmentValue)
                .append(" AND (");
        for (int i = 0; i < window.size(); i++) {
            if (i > 0) {
                sql.append(" + ");
            }
            sql.append("COALESCE(CAST(").week(window.get(i)).append(" AS SIGNED), 0)");
        }
        return sql.append(") > 0").build();
    }

    /**
     * Single row: each week's column summed over one segment.
     */
    public CompiledQuery segmentWeeklyTotals(TableName table, ResolvedColumn segment, List<WeekColumn> weeks,
                                             String segmentValue) {
        SqlBuilder sql = new SqlBuilder().append("SELECT ");
        weekSums(sql, weeks);
        return sql.append(" FROM ").table(table)
                .append(" WHERE ").column(segment).append(" = ").bind("segment", segmentValue)
                .build();
    }

    /**
     * One row per segment with each week's column summed, optionally limited to {@code segments}.
     */
    public CompiledQuery trendTotals(TableName table, ResolvedColumn segment, List<WeekColumn> weeks,
                                     List<String> segments) {
        SqlBuilder sql = new SqlBuilder()
                .append("SELECT ").column(segment).append(" AS " + SEGMENT + ", ");
        weekSums(sql, weeks);
        sql.append(" FROM ").table(table);
        segmentFilter(sql, segment, segments);
        return sql.append(" GROUP BY ").column(segment)
                .append(" ORDER BY ").column(segment)
                .build();
    }

    /**
     * Identity columns plus every week column of one user.
     */
    public CompiledQuery userTimeline(TableName table, ResolvedColumn userId, ResolvedColumn name,
                                      ResolvedColumn segment, List<WeekColumn> weeks, long userIdValue) {
        SqlBuilder sql = new SqlBuilder()
                .append("SELECT ").column(userId).append(" AS " + USER_ID)
                .append(", ").column(name).append(" AS " + NAME)
                .append(", ").column(segment).append(" AS " + SEGMENT);
        for (int i = 0; i < weeks.size(); i++) {
            sql.append(", ").week(weeks.get(i)).append(" AS " + weekAlias(i));
        }
        return sql.append(" FROM ").table(table)
                .append(" WHERE ").column(userId).append(" = ").bind("user_id", userIdValue)
                .append(" LIMIT 1")
                .build();
    }

    /**
     * Case-insensitive substring search over name, email, phone and user id.
     * LIKE wildcards in {@code term} are matched literally.
     */
    public CompiledQuery search(TableName table, ResolvedColumn name, ResolvedColumn email, ResolvedColumn phone,
                                ResolvedColumn userId, String term, int limit) {
        String like = "%" + escapeLike(term) + "%";
        return new SqlBuilder()
                .append("SELECT * FROM ").table(table)
                .append(" WHERE LOWER(").column(name).append(") LIKE LOWER(").bind("name_like", like).append(")")
                .append(" OR LOWER(").column(email).append(") LIKE LOWER(").bind("email_like", like).append(")")
                .append(" OR LOWER(CAST(").column(phone).append(" AS CHAR)) LIKE LOWER(").bind("phone_like", like)
                .append(")")
                .append(" OR CAST(").column(userId).append(" AS CHAR) LIKE ").bind("user_id_like", like)
                .append(" ORDER BY ").column(name).append(" ASC")
                .append(" LIMIT ").bind("limit", limit)
                .build();
    }

    /**
     * Every column of every matching row, ordered by segment then name. Uncapped.
     */
    public CompiledQuery export(TableName table, ResolvedColumn segment, ResolvedColumn name, List<String> segments) {
        SqlBuilder sql = new SqlBuilder().append("SELECT * FROM ").table(table);
        segmentFilter(sql, segment, segments);
        return sql.append(" ORDER BY ").column(segment).append(", ").column(name).build();
    }

    public CompiledQuery exportCount(TableName table, ResolvedColumn segment, List<String> segments) {
        SqlBuilder sql = new SqlBuilder().append("SELECT COUNT(*) AS total FROM ").table(table);
        segmentFilter(sql, segment, segments);
        return sql.build();
    }

    public CompiledQuery preview(TableName table, int limit) {
        return new SqlBuilder()
                .append("SELECT * FROM ").table(table)
                .append(" LIMIT ").bind("limit", limit)
                .build();
    }

    private static void avgDecimal(SqlBuilder sql, ResolvedColumn column, String alias) {
        if (column.isPresent()) {
            sql.append(", AVG(COALESCE(CAST(").column(column).append(" AS DECIMAL(18,4)), 0)) AS " + alias);
        } else {
            sql.append(", 0 AS " + alias);
        }
    }

    private static void avgDaysSince(SqlBuilder sql, ResolvedColumn column, String alias) {
        if (column.isPresent()) {
            sql.append(", AVG(COALESCE(DATEDIFF(CURDATE(), DATE(").column(column).append(")), 0)) AS " + alias);
        } else {
            sql.append(", 0 AS " + alias);
        }
    }

    private static void weekSums(SqlBuilder sql, List<WeekColumn> weeks) {
        for (int i = 0; i < weeks.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append("COALESCE(SUM(CAST(").week(weeks.get(i)).append(" AS UNSIGNED)), 0) AS " + weekAlias(i));
        }
    }

    private static void segmentFilter(SqlBuilder sql, ResolvedColumn segment, List<String> segments) {
        if (segments != null && !segments.isEmpty()) {
            sql.append(" WHERE ").column(segment).append(" IN (").bindAll("segment", segments).append(")");
        }
    }

    static String escapeLike(String term) {
        return term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
