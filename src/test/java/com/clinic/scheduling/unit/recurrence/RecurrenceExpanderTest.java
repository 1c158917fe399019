package com.clinic.scheduling.unit.recurrence;

import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.recurrence.Occurrence;
import com.clinic.scheduling.recurrence.RecurrenceExpander;
import com.clinic.scheduling.recurrence.RecurrencePattern;
import com.clinic.scheduling.recurrence.RecurrenceRange;
import com.clinic.scheduling.recurrence.WeekOfMonth;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Month;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecurrenceExpanderTest {

    private final RecurrenceExpander expander = new RecurrenceExpander(ZoneOffset.UTC);

    @Test
    void weekly_mondayAndWednesday_overTwoWeeks_yieldsFourOneDayOccurrences() {
        Instant start = Instant.parse("2025-01-06T00:00:00Z"); // Monday
        Instant end = Instant.parse("2025-01-07T00:00:00Z");
        var pattern = new RecurrencePattern.Weekly(1, Set.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY), null, null);

        List<Occurrence> occurrences = expander.expand(start, end, pattern,
            Instant.parse("2025-01-06T00:00:00Z"), Instant.parse("2025-01-20T00:00:00Z"));

        assertThat(occurrences).extracting(Occurrence::start).containsExactly(
            Instant.parse("2025-01-06T00:00:00Z"),
            Instant.parse("2025-01-08T00:00:00Z"),
            Instant.parse("2025-01-13T00:00:00Z"),
            Instant.parse("2025-01-15T00:00:00Z"));
        assertThat(occurrences).allSatisfy(o ->
            assertThat(o.end()).isEqualTo(o.start().plusSeconds(86_400)));
    }

    @Test
    void weekly_everySecondWeek_skipsOddWeeks() {
        Instant start = Instant.parse("2025-01-06T09:00:00Z");
        Instant end = Instant.parse("2025-01-06T17:00:00Z");
        var pattern = new RecurrencePattern.Weekly(2, Set.of(DayOfWeek.MONDAY), null, null);

        List<Occurrence> occurrences = expander.expand(start, end, pattern,
            Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-02-01T00:00:00Z"));

        assertThat(occurrences).extracting(Occurrence::start).containsExactly(
            Instant.parse("2025-01-06T09:00:00Z"),
            Instant.parse("2025-01-20T09:00:00Z"));
    }

    @Test
    void daily_numberedRange_countsFromFirstOccurrenceNotFromWindow() {
        Instant start = Instant.parse("2025-03-01T08:00:00Z");
        Instant end = Instant.parse("2025-03-01T12:00:00Z");
        var pattern = new RecurrencePattern.Daily(1, new RecurrenceRange.Numbered(5));

        List<Occurrence> occurrences = expander.expand(start, end, pattern,
            Instant.parse("2025-03-04T00:00:00Z"), Instant.parse("2025-03-31T00:00:00Z"));

        // Occurrences 4 and 5 of five fall inside the window.
        assertThat(occurrences).extracting(Occurrence::start).containsExactly(
            Instant.parse("2025-03-04T08:00:00Z"),
            Instant.parse("2025-03-05T08:00:00Z"));
    }

    @Test
    void daily_endDate_isInclusive() {
        Instant start = Instant.parse("2025-03-01T08:00:00Z");
        Instant end = Instant.parse("2025-03-01T09:00:00Z");
        var pattern = new RecurrencePattern.Daily(1, new RecurrenceRange.EndDate(LocalDate.of(2025, 3, 3)));

        List<Occurrence> occurrences = expander.expand(start, end, pattern,
            Instant.parse("2025-03-01T00:00:00Z"), Instant.parse("2025-03-10T00:00:00Z"));

        assertThat(occurrences).hasSize(3);
        assertThat(occurrences.get(2).start()).isEqualTo(Instant.parse("2025-03-03T08:00:00Z"));
    }

    @Test
    void monthlyByDate_day31_skipsShortMonths() {
        Instant start = Instant.parse("2025-01-31T10:00:00Z");
        Instant end = Instant.parse("2025-01-31T11:00:00Z");
        var pattern = new RecurrencePattern.MonthlyByDate(1, 31, null);

        List<Occurrence> occurrences = expander.expand(start, end, pattern,
            Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-06-01T00:00:00Z"));

        assertThat(occurrences).extracting(Occurrence::start).containsExactly(
            Instant.parse("2025-01-31T10:00:00Z"),
            Instant.parse("2025-03-31T10:00:00Z"),
            Instant.parse("2025-05-31T10:00:00Z"));
    }

    @Test
    void monthlyByWeekday_lastFriday() {
        Instant start = Instant.parse("2025-01-31T14:00:00Z"); // last Friday of January
        Instant end = Instant.parse("2025-01-31T15:00:00Z");
        var pattern = new RecurrencePattern.MonthlyByWeekday(1, WeekOfMonth.LAST, DayOfWeek.FRIDAY, null);

        List<Occurrence> occurrences = expander.expand(start, end, pattern,
            Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-04-01T00:00:00Z"));

        assertThat(occurrences).extracting(Occurrence::start).containsExactly(
            Instant.parse("2025-01-31T14:00:00Z"),
            Instant.parse("2025-02-28T14:00:00Z"),
            Instant.parse("2025-03-28T14:00:00Z"));
    }

    @Test
    void yearly_february29_onlyRecursInLeapYears() {
        Instant start = Instant.parse("2024-02-29T09:00:00Z");
        Instant end = Instant.parse("2024-02-29T10:00:00Z");
        var pattern = new RecurrencePattern.Yearly(1, Month.FEBRUARY, null);

        List<Occurrence> occurrences = expander.expand(start, end, pattern,
            Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2029-01-01T00:00:00Z"));

        assertThat(occurrences).extracting(Occurrence::start).containsExactly(
            Instant.parse("2024-02-29T09:00:00Z"),
            Instant.parse("2028-02-29T09:00:00Z"));
    }

    @Test
    void occurrencesAreClippedToWindow() {
        Instant start = Instant.parse("2025-01-06T08:00:00Z");
        Instant end = Instant.parse("2025-01-06T18:00:00Z");

        List<Occurrence> occurrences = expander.expand(start, end, null,
            Instant.parse("2025-01-06T10:00:00Z"), Instant.parse("2025-01-06T12:00:00Z"));

        assertThat(occurrences).containsExactly(new Occurrence(
            Instant.parse("2025-01-06T10:00:00Z"), Instant.parse("2025-01-06T12:00:00Z")));
    }

    @Test
    void timeOfDayFollowsConfiguredZoneAcrossDaylightSaving() {
        var berlin = new RecurrenceExpander(ZoneId.of("Europe/Berlin"));
        Instant start = Instant.parse("2025-03-28T08:00:00Z"); // 09:00 CET
        Instant end = Instant.parse("2025-03-28T09:00:00Z");
        var pattern = new RecurrencePattern.Daily(1, null);

        List<Occurrence> occurrences = berlin.expand(start, end, pattern,
            Instant.parse("2025-03-31T00:00:00Z"), Instant.parse("2025-04-01T00:00:00Z"));

        // 09:00 CEST after the switch
        assertThat(occurrences).extracting(Occurrence::start)
            .containsExactly(Instant.parse("2025-03-31T07:00:00Z"));
    }

    @Test
    void mayReach_endDateBeforeWindow_isFalse() {
        Instant start = Instant.parse("2025-01-01T08:00:00Z");
        Instant end = Instant.parse("2025-01-01T09:00:00Z");
        var pattern = new RecurrencePattern.Daily(1, new RecurrenceRange.EndDate(LocalDate.of(2025, 1, 10)));

        assertThat(expander.mayReach(start, end, pattern,
            Instant.parse("2025-02-01T00:00:00Z"), Instant.parse("2025-02-02T00:00:00Z"))).isFalse();
        assertThat(expander.mayReach(start, end, pattern,
            Instant.parse("2025-01-10T00:00:00Z"), Instant.parse("2025-01-11T00:00:00Z"))).isTrue();
    }

    @Test
    void mayReach_numberedRange_followsItsLastOccurrence() {
        Instant start = Instant.parse("2025-01-06T08:00:00Z"); // a Monday
        Instant end = Instant.parse("2025-01-06T12:00:00Z");
        var pattern = new RecurrencePattern.Weekly(1, Set.of(DayOfWeek.MONDAY, DayOfWeek.FRIDAY), null,
            new RecurrenceRange.Numbered(4));

        // Mon 6, Fri 10, Mon 13, Fri 17
        assertThat(expander.mayReach(start, end, pattern,
            Instant.parse("2025-01-17T11:00:00Z"), Instant.parse("2025-01-18T00:00:00Z"))).isTrue();
        assertThat(expander.mayReach(start, end, pattern,
            Instant.parse("2025-01-17T12:00:00Z"), Instant.parse("2025-01-18T00:00:00Z"))).isFalse();
        assertThat(expander.mayReach(start, end, pattern,
            Instant.parse("2025-01-20T00:00:00Z"), Instant.parse("2025-01-21T00:00:00Z"))).isFalse();
    }

    @Test
    void validate_weeklyWithoutDays_isRejected() {
        var pattern = new RecurrencePattern.Weekly(1, Set.of(), null, null);

        assertThatThrownBy(() -> pattern.validate(LocalDate.of(2025, 1, 6)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("day of week");
    }

    @Test
    void validate_zeroInterval_isRejected() {
        var pattern = new RecurrencePattern.Daily(0, null);

        assertThatThrownBy(() -> pattern.validate(LocalDate.of(2025, 1, 6)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("interval");
    }

    @Test
    void validate_endDateBeforeFirstOccurrence_isRejected() {
        var pattern = new RecurrencePattern.Daily(1, new RecurrenceRange.EndDate(LocalDate.of(2025, 1, 1)));

        assertThatThrownBy(() -> pattern.validate(LocalDate.of(2025, 1, 6)))
            .isInstanceOf(ValidationException.class);
    }
}
