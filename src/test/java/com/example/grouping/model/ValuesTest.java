package com.example.grouping.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class ValuesTest {

    // =========================================================================
    // DISPLAY
    // =========================================================================

    @Test
    @DisplayName("Should drop the trailing .0 of integral doubles")
    void shouldDisplayIntegralDoublesWithoutFraction() {
        assertThat(Values.display(10.0)).isEqualTo("10");
        assertThat(Values.display(2.5)).isEqualTo("2.5");
        assertThat(Values.display(new BigDecimal("1.500"))).isEqualTo("1.5");
        assertThat(Values.display(7)).isEqualTo("7");
    }

    @Test
    @DisplayName("Should treat null and the empty string as missing")
    void shouldDetectMissingValues() {
        assertThat(Values.isMissing(null)).isTrue();
        assertThat(Values.isMissing("")).isTrue();
        assertThat(Values.isMissing(" ")).isFalse();
        assertThat(Values.isMissing(0)).isFalse();
    }

    // =========================================================================
    // NUMBERS
    // =========================================================================

    @Test
    @DisplayName("Should coerce numbers and numeric strings")
    void shouldCoerceNumbers() {
        assertThat(Values.toDouble(3).getAsDouble()).isEqualTo(3.0);
        assertThat(Values.toDouble(" 12.5 ").getAsDouble()).isEqualTo(12.5);
        assertThat(Values.toDouble("abc")).isEmpty();
        assertThat(Values.toDouble("")).isEmpty();
        assertThat(Values.toDouble(true)).isEmpty();
        assertThat(Values.toDouble(Double.NaN)).isEmpty();
    }

    // =========================================================================
    // DATES
    // =========================================================================

    @Test
    @DisplayName("Should parse the accepted ISO date forms")
    void shouldParseDates() {
        assertThat(Values.toDate("2024-02-01")).contains(LocalDate.of(2024, 2, 1));
        assertThat(Values.toDate("2024-02-01T10:15:30")).contains(LocalDate.of(2024, 2, 1));
        assertThat(Values.toDate("2024-02-01T23:15:30+01:00")).contains(LocalDate.of(2024, 2, 1));
        assertThat(Values.toDate("2024-01")).contains(LocalDate.of(2024, 1, 1));
        assertThat(Values.toDate("2024")).contains(LocalDate.of(2024, 1, 1));
        assertThat(Values.toDate(LocalDateTime.of(2023, 12, 31, 23, 59))).contains(LocalDate.of(2023, 12, 31));
    }

    @Test
    @DisplayName("Should return empty for values that are not dates")
    void shouldRejectNonDates() {
        assertThat(Values.toDate("not a date")).isEmpty();
        assertThat(Values.toDate("2024-13-01")).isEmpty();
        assertThat(Values.toDate(20240201)).isEmpty();
    }
}
