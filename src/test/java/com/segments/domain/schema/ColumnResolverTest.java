package com.segments.domain.schema;

import com.segments.domain.exception.SchemaException;
import com.segments.domain.model.LogicalField;
import com.segments.domain.model.TableColumns;
import com.segments.domain.model.TableName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ColumnResolverTest {

    private final ColumnResolver resolver = new ColumnResolver();

    private static TableColumns columns(String... names) {
        return TableColumns.of(TableName.of("user_cluster"), List.of(names));
    }

    @Test
    void testResolve_FallsBackToSnakeCaseSpelling() {
        ResolvedColumn segment = resolver.require(LogicalField.SEGMENT, columns("segment", "name"));

        assertTrue(segment.isPresent());
        assertEquals("segment", segment.getName());
    }

    @Test
    void testResolve_FirstCandidateWins() {
        ResolvedColumn cash = resolver.require(LogicalField.CASH_BALANCE, columns("cash_balance", "Cash Balance"));

        assertEquals("Cash Balance", cash.getName());
    }

    @Test
    void testResolve_RequiredFieldMissing() {
        SchemaException e = assertThrows(SchemaException.class,
                () -> resolver.require(LogicalField.SEGMENT, columns("name", "email")));

        assertEquals("Segment", e.getField());
        assertEquals("user_cluster", e.getTable());
        assertTrue(e.getMessage().contains("Segment"));
        assertTrue(e.getMessage().contains("user_cluster"));
    }

    @Test
    void testResolve_OptionalFieldMissingIsAbsent() {
        ResolvedColumn ipl = resolver.optional(LogicalField.IPL_CONTESTS, columns("segment"));

        assertFalse(ipl.isPresent());
        assertEquals(LogicalField.IPL_CONTESTS, ipl.getField());
        assertThrows(NoSuchElementException.class, ipl::getName);
    }

    @Test
    void testResolve_MatchIsCaseSensitive() {
        assertFalse(resolver.optional(LogicalField.USER_ID, columns("USER_ID")).isPresent());
    }
}
