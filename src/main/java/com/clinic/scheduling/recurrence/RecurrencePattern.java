package com.clinic.scheduling.recurrence;

import com.clinic.scheduling.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Calendar-style recurrence rule attached to an availability record.
 *
 * <p>Each variant carries only the fields that make sense for it, so a weekly rule can
 * never hold a day-of-month and a monthly rule can never hold a weekday set. The JSON
 * form is tagged by {@code type}:
 * <pre>
 *   {"type": "weekly", "interval": 1, "daysOfWeek": ["monday", "wednesday"],
 *    "range": {"type": "numbered", "numberOfOccurrences": 10}}
 * </pre>
 *
 * <p>A rule is expanded period by period: period {@code k} is the {@code k * interval}-th
 * day, week, month or year after the one containing the first occurrence.
 * {@link #datesInPeriod} returns the candidate dates of that period in ascending order;
 * the {@link RecurrenceExpander} drops dates before the first occurrence and applies the
 * {@link RecurrenceRange}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = RecurrencePattern.Daily.class, name = "daily"),
    @JsonSubTypes.Type(value = RecurrencePattern.Weekly.class, name = "weekly"),
    @JsonSubTypes.Type(value = RecurrencePattern.MonthlyByDate.class, name = "monthly_by_date"),
    @JsonSubTypes.Type(value = RecurrencePattern.MonthlyByWeekday.class, name = "monthly_by_weekday"),
    @JsonSubTypes.Type(value = RecurrencePattern.Yearly.class, name = "yearly")
})
public sealed interface RecurrencePattern
        permits RecurrencePattern.Daily, RecurrencePattern.Weekly, RecurrencePattern.MonthlyByDate,
                RecurrencePattern.MonthlyByWeekday, RecurrencePattern.Yearly {

    int interval();

    RecurrenceRange range();

    @JsonIgnore
    RecurrenceType recurrenceType();

    /** First calendar day of period {@code k}; used to stop expansion past the query window. */
    LocalDate periodStart(LocalDate anchor, long k);

    List<LocalDate> datesInPeriod(LocalDate anchor, long k);

    /** Rejects rules that cannot produce a well-defined sequence. */
    default void validate(LocalDate anchor) {
        if (interval() < 1) {
            throw new ValidationException("Recurrence interval must be at least 1");
        }
        range().validate(anchor);
    }

    record Daily(int interval, RecurrenceRange range) implements RecurrencePattern {

        public Daily {
            range = range == null ? new RecurrenceRange.NoEnd() : range;
        }

        @Override
        public RecurrenceType recurrenceType() {
            return RecurrenceType.DAILY;
        }

        @Override
        public LocalDate periodStart(LocalDate anchor, long k) {
            return anchor.plusDays(k * interval);
        }

        @Override
        public List<LocalDate> datesInPeriod(LocalDate anchor, long k) {
            return List.of(periodStart(anchor, k));
        }
    }

    /**
     * Weekly rule on a set of weekdays. Weeks start on {@code firstDayOfWeek}
     * (Monday when omitted); the interval counts whole weeks from the anchor's week.
     */
    record Weekly(int interval, Set<DayOfWeek> daysOfWeek, DayOfWeek firstDayOfWeek,
                  RecurrenceRange range) implements RecurrencePattern {

        public Weekly {
            daysOfWeek = daysOfWeek == null ? Set.of() : Set.copyOf(daysOfWeek);
            firstDayOfWeek = firstDayOfWeek == null ? DayOfWeek.MONDAY : firstDayOfWeek;
            range = range == null ? new RecurrenceRange.NoEnd() : range;
        }

        @Override
        public RecurrenceType recurrenceType() {
            return RecurrenceType.WEEKLY;
        }

        @Override
        public LocalDate periodStart(LocalDate anchor, long k) {
            return anchor.with(TemporalAdjusters.previousOrSame(firstDayOfWeek)).plusWeeks(k * interval);
        }

        @Override
        public List<LocalDate> datesInPeriod(LocalDate anchor, long k) {
            LocalDate weekStart = periodStart(anchor, k);
            return daysOfWeek.stream()
                .map(day -> weekStart.plusDays(Math.floorMod(day.getValue() - firstDayOfWeek.getValue(), 7)))
                .sorted(Comparator.naturalOrder())
                .toList();
        }

        @Override
        public void validate(LocalDate anchor) {
            RecurrencePattern.super.validate(anchor);
            if (daysOfWeek.isEmpty()) {
                throw new ValidationException("Weekly recurrence requires at least one day of week");
            }
        }
    }

    /** "Day 15 of every N months". Months without that day are skipped. */
    record MonthlyByDate(int interval, int dayOfMonth, RecurrenceRange range) implements RecurrencePattern {

        public MonthlyByDate {
            range = range == null ? new RecurrenceRange.NoEnd() : range;
        }

        @Override
        public RecurrenceType recurrenceType() {
            return RecurrenceType.MONTHLY;
        }

        @Override
        public LocalDate periodStart(LocalDate anchor, long k) {
            return YearMonth.from(anchor).plusMonths(k * interval).atDay(1);
        }

        @Override
        public List<LocalDate> datesInPeriod(LocalDate anchor, long k) {
            YearMonth month = YearMonth.from(anchor).plusMonths(k * interval);
            if (dayOfMonth > month.lengthOfMonth()) {
                return List.of();
            }
            return List.of(month.atDay(dayOfMonth));
        }

        @Override
        public void validate(LocalDate anchor) {
            RecurrencePattern.super.validate(anchor);
            if (dayOfMonth < 1 || dayOfMonth > 31) {
                throw new ValidationException("Monthly recurrence day of month must be between 1 and 31");
            }
        }
    }

    /** "The second Tuesday of every N months". */
    record MonthlyByWeekday(int interval, WeekOfMonth weekOfMonth, DayOfWeek dayOfWeek,
                            RecurrenceRange range) implements RecurrencePattern {

        public MonthlyByWeekday {
            range = range == null ? new RecurrenceRange.NoEnd() : range;
        }

        @Override
        public RecurrenceType recurrenceType() {
            return RecurrenceType.MONTHLY;
        }

        @Override
        public LocalDate periodStart(LocalDate anchor, long k) {
            return YearMonth.from(anchor).plusMonths(k * interval).atDay(1);
        }

        @Override
        public List<LocalDate> datesInPeriod(LocalDate anchor, long k) {
            LocalDate first = periodStart(anchor, k);
            LocalDate date = weekOfMonth == WeekOfMonth.LAST
                ? first.with(TemporalAdjusters.lastInMonth(dayOfWeek))
                : first.with(TemporalAdjusters.dayOfWeekInMonth(weekOfMonth.ordinalInMonth(), dayOfWeek));
            return List.of(date);
        }

        @Override
        public void validate(LocalDate anchor) {
            RecurrencePattern.super.validate(anchor);
            if (weekOfMonth == null || dayOfWeek == null) {
                throw new ValidationException("Monthly weekday recurrence requires weekOfMonth and dayOfWeek");
            }
        }
    }

    /**
     * Yearly rule on the anchor's day of month, in {@code month} (the anchor's month when
     * omitted). A February 29 anchor only recurs in leap years.
     */
    record Yearly(int interval, Month month, RecurrenceRange range) implements RecurrencePattern {

        public Yearly {
            range = range == null ? new RecurrenceRange.NoEnd() : range;
        }

        @Override
        public RecurrenceType recurrenceType() {
            return RecurrenceType.YEARLY;
        }

        @Override
        public LocalDate periodStart(LocalDate anchor, long k) {
            return LocalDate.of(Math.toIntExact(anchor.getYear() + k * interval), 1, 1);
        }

        @Override
        public List<LocalDate> datesInPeriod(LocalDate anchor, long k) {
            Month target = month == null ? anchor.getMonth() : month;
            YearMonth yearMonth = YearMonth.of(periodStart(anchor, k).getYear(), target);
            if (anchor.getDayOfMonth() > yearMonth.lengthOfMonth()) {
                return List.of();
            }
            return List.of(yearMonth.atDay(anchor.getDayOfMonth()));
        }
    }
}
