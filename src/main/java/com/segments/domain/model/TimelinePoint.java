package com.segments.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelinePoint {

    private String label;
    private LocalDate startDate;
    private LocalDate endDate;
    private long contests;

    public static TimelinePoint of(WeekColumn week, long contests) {
        return new TimelinePoint(week.getLabel(), week.getStartDate(), week.getEndDate(), contests);
    }
}
