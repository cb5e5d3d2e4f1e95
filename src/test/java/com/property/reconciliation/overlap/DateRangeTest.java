package com.property.reconciliation.overlap;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DateRange Tests")
class DateRangeTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Should reject a range that ends on its start day")
        void rejectsEmptyRange() {
            InvalidDateRangeException e = assertThrows(InvalidDateRangeException.class,
                    () -> DateRange.of("2024-06-01", "2024-06-01"));
            assertEquals(LocalDate.of(2024, 6, 1), e.getStart());
            assertTrue(e.getMessage().startsWith("End date must be after start date"));
        }

        @Test
        @DisplayName("Should reject a range that ends before it starts")
        void rejectsInvertedRange() {
            assertThrows(IllegalArgumentException.class, () -> DateRange.of("2024-06-10", "2024-06-01"));
        }

        @Test
        @DisplayName("tryOf should return empty for missing or inverted bounds")
        void tryOfEmpty() {
            LocalDate day = LocalDate.of(2024, 6, 1);
            assertTrue(DateRange.tryOf(null, day).isEmpty());
            assertTrue(DateRange.tryOf(day, null).isEmpty());
            assertTrue(DateRange.tryOf(day, day).isEmpty());
            assertTrue(DateRange.tryOf(day, day.plusDays(1)).isPresent());
        }

        @Test
        @DisplayName("Should report its length and shift keeping it")
        void lengthAndShift() {
            DateRange range = DateRange.of("2024-06-01", "2024-06-08");
            assertEquals(7, range.lengthInDays());
            DateRange shifted = range.shiftTo(LocalDate.of(2024, 7, 1));
            assertEquals(LocalDate.of(2024, 7, 8), shifted.end());
            assertEquals("[2024-06-01, 2024-06-08)", range.toString());
        }
    }

    @Nested
    @DisplayName("Overlap")
    class Overlap {

        @ParameterizedTest(name = "[{0}, {1}) vs [{2}, {3}) -> {4}")
        @CsvSource({
                "2024-06-01, 2024-06-10, 2024-06-05, 2024-06-08, true",
                "2024-06-01, 2024-06-10, 2024-06-10, 2024-06-15, false",
                "2024-06-10, 2024-06-15, 2024-06-01, 2024-06-10, false",
                "2024-06-01, 2024-06-10, 2024-06-09, 2024-06-12, true",
                "2024-06-05, 2024-06-08, 2024-06-01, 2024-06-10, true",
                "2024-06-01, 2024-06-05, 2024-06-20, 2024-06-25, false",
                "2024-06-01, 2024-06-10, 2024-06-01, 2024-06-10, true"
        })
        @DisplayName("Should detect overlaps on half-open ranges")
        void overlaps(String aStart, String aEnd, String bStart, String bEnd, boolean expected) {
            DateRange a = DateRange.of(aStart, aEnd);
            DateRange b = DateRange.of(bStart, bEnd);
            assertEquals(expected, a.overlaps(b));
        }

        @ParameterizedTest
        @CsvSource({
                "2024-06-01, 2024-06-10, 2024-06-03, 2024-06-06",
                "2024-03-01, 2024-03-31, 2024-02-27, 2024-03-02",
                "2024-12-28, 2025-01-04, 2025-01-01, 2025-01-10"
        })
        @DisplayName("Overlap should be symmetric")
        void symmetric(String aStart, String aEnd, String bStart, String bEnd) {
            DateRange a = DateRange.of(aStart, aEnd);
            DateRange b = DateRange.of(bStart, bEnd);
            assertEquals(a.overlaps(b), b.overlaps(a));
        }

        @Test
        @DisplayName("A range should always overlap itself")
        void reflexive() {
            DateRange range = DateRange.of("2024-02-28", "2024-03-01");
            assertTrue(range.overlaps(range));
        }

        @Test
        @DisplayName("Should tell enclosing ranges apart")
        void encloses() {
            DateRange outer = DateRange.of("2024-06-01", "2024-06-30");
            DateRange inner = DateRange.of("2024-06-10", "2024-06-12");
            assertTrue(outer.encloses(inner));
            assertFalse(inner.encloses(outer));
        }
    }
}
