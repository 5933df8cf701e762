package com.segments.domain.schema;

import com.segments.domain.model.WeekColumn;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WeekColumnParserTest {

    @Test
    void testParse_SortsAscendingByStartDate() {
        // Given - introspection order is not chronological
        List<String> columns = List.of(
                "user_id",
                "2024-01-15 - 2024-01-21",
                "Segment",
                "2024-01-01 - 2024-01-07",
                "2024-01-08 - 2024-01-14");

        // When
        List<WeekColumn> weeks = WeekColumnParser.parse(columns);

        // Then
        assertEquals(3, weeks.size());
        assertEquals(LocalDate.of(2024, 1, 1), weeks.get(0).getStartDate());
        assertEquals(LocalDate.of(2024, 1, 8), weeks.get(1).getStartDate());
        assertEquals(LocalDate.of(2024, 1, 15), weeks.get(2).getStartDate());
        for (int i = 1; i < weeks.size(); i++) {
            assertTrue(weeks.get(i - 1).getStartDate().isBefore(weeks.get(i).getStartDate()));
        }
    }

    @Test
    void testParse_DatesRoundTripThroughFormat() {
        List<WeekColumn> weeks = WeekColumnParser.parse(List.of("2023-12-25 - 2023-12-31", "'2024-02-26 - 2024-03-03"));

        for (WeekColumn week : weeks) {
            String[] parts = week.getLabel().split(" - ");
            assertEquals(parts[0], WeekColumnParser.DATE_FORMAT.format(week.getStartDate()));
            assertEquals(parts[1], WeekColumnParser.DATE_FORMAT.format(week.getEndDate()));
        }
    }

    @Test
    void testParseColumn_LeadingQuoteIsStrippedFromLabelButKeptInRaw() {
        Optional<WeekColumn> week = WeekColumnParser.parseColumn("'2024-01-01 - 2024-01-07");

        assertTrue(week.isPresent());
        assertEquals("'2024-01-01 - 2024-01-07", week.get().getRaw());
        assertEquals("2024-01-01 - 2024-01-07", week.get().getLabel());
        assertEquals(LocalDate.of(2024, 1, 7), week.get().getEndDate());
    }

    @Test
    void testParseColumn_RejectsNonMatchingNames() {
        assertTrue(WeekColumnParser.parseColumn("Cash Balance").isEmpty());
        assertTrue(WeekColumnParser.parseColumn("2024-01-01").isEmpty());
        assertTrue(WeekColumnParser.parseColumn("2024-01-01 to 2024-01-07").isEmpty());
        assertTrue(WeekColumnParser.parseColumn("2024-01-01 - 2024-01-07 ").isEmpty());
        assertTrue(WeekColumnParser.parseColumn("2024-1-01 - 2024-01-07").isEmpty());
        assertTrue(WeekColumnParser.parseColumn(null).isEmpty());
    }

    @Test
    void testParseColumn_RejectsImpossibleCalendarDates() {
        // matches the pattern but February 30th does not exist
        assertTrue(WeekColumnParser.parseColumn("2024-02-30 - 2024-03-05").isEmpty());
        assertTrue(WeekColumnParser.parseColumn("2024-13-01 - 2024-13-07").isEmpty());
    }

    @Test
    void testParseColumn_AcceptsStartAfterEnd() {
        Optional<WeekColumn> week = WeekColumnParser.parseColumn("2024-01-07 - 2024-01-01");

        assertTrue(week.isPresent());
        assertTrue(week.get().getStartDate().isAfter(week.get().getEndDate()));
    }

    @Test
    void testParse_NoWeekColumns() {
        assertTrue(WeekColumnParser.parse(List.of("Segment", "Name", "Email")).isEmpty());
    }
}
