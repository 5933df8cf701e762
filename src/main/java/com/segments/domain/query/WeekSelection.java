package com.segments.domain.query;

import com.segments.domain.model.WeekColumn;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks windows out of a chronological week catalog.
 */
public final class WeekSelection {

    private WeekSelection() {
    }

    /**
     * The last {@code count} weeks (all of them if there are fewer).
     */
    public static List<WeekColumn> mostRecent(List<WeekColumn> weeks, int count) {
        if (count >= weeks.size()) {
            return weeks;
        }
        return weeks.subList(weeks.size() - Math.max(count, 0), weeks.size());
    }

    /**
     * Trend window: weeks inside [start, end], capped to the most recent {@code count};
     * when nothing falls inside the range, the most recent {@code count} of the whole catalog.
     */
    public static List<WeekColumn> forRange(List<WeekColumn> weeks, LocalDate start, LocalDate end, int count) {
        List<WeekColumn> filtered = weeks.stream()
                .filter(week -> week.within(start, end))
                .collect(Collectors.toList());
        if (filtered.isEmpty()) {
            return mostRecent(weeks, count);
        }
        return mostRecent(filtered, count);
    }
}
