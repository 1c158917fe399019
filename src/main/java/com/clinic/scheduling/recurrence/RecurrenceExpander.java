package com.clinic.scheduling.recurrence;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands a recurring {@code [start, end)} window into concrete occurrences that fall in
 * a query window.
 *
 * <p>Occurrence dates are computed in a fixed time zone: every occurrence starts at the
 * first occurrence's local time-of-day and lasts as long as the first occurrence. The
 * range policy is evaluated from the first occurrence, so a numbered range of 10 yields
 * the same 10 dates regardless of which query window is asked for. Results are clipped
 * to the query window.
 *
 * <p>Stateless and thread-safe.
 */
public class RecurrenceExpander {

    /** Upper bound on periods walked for one record, guarding against rules that never match. */
    static final long MAX_PERIODS = 50_000;

    private final ZoneId zone;

    public RecurrenceExpander(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * @param firstStart  start of the first occurrence
     * @param firstEnd    end of the first occurrence (exclusive)
     * @param pattern     recurrence rule, or {@code null} for a one-off window
     * @param windowStart query window start (inclusive)
     * @param windowEnd   query window end (exclusive)
     */
    public List<Occurrence> expand(Instant firstStart, Instant firstEnd, RecurrencePattern pattern,
                                   Instant windowStart, Instant windowEnd) {
        List<Occurrence> result = new ArrayList<>();
        if (!windowStart.isBefore(windowEnd)) {
            return result;
        }
        if (pattern == null) {
            addClipped(result, firstStart, firstEnd, windowStart, windowEnd);
            return result;
        }

        Duration length = Duration.between(firstStart, firstEnd);
        ZonedDateTime anchorTime = firstStart.atZone(zone);
        LocalDate anchor = anchorTime.toLocalDate();
        LocalTime timeOfDay = anchorTime.toLocalTime();
        LocalDate lastRelevantDate = windowEnd.atZone(zone).toLocalDate();

        int emitted = 0;
        for (long k = 0; k < MAX_PERIODS; k++) {
            if (pattern.periodStart(anchor, k).isAfter(lastRelevantDate)) {
                break;
            }
            for (LocalDate date : pattern.datesInPeriod(anchor, k)) {
                if (date.isBefore(anchor)) {
                    continue;
                }
                if (pattern.range().isExhausted(date, emitted)) {
                    return result;
                }
                emitted++;
                Instant start = ZonedDateTime.of(date, timeOfDay, zone).toInstant();
                if (!start.isBefore(windowEnd)) {
                    return result;
                }
                addClipped(result, start, start.plus(length), windowStart, windowEnd);
            }
        }
        return result;
    }

    /**
     * Whether a record can contribute any occurrence overlapping the window. End-date
     * ranges are decided from the end date; numbered ranges walk their bounded sequence to
     * the last occurrence.
     */
    public boolean mayReach(Instant firstStart, Instant firstEnd, RecurrencePattern pattern,
                            Instant windowStart, Instant windowEnd) {
        if (!firstStart.isBefore(windowEnd)) {
            return false;
        }
        if (pattern == null) {
            return firstEnd.isAfter(windowStart);
        }
        if (pattern.range() instanceof RecurrenceRange.EndDate endDate) {
            Instant lastPossibleEnd = endDate.endDate().plusDays(1).atStartOfDay(zone).toInstant()
                .plus(Duration.between(firstStart, firstEnd));
            return lastPossibleEnd.isAfter(windowStart);
        }
        if (pattern.range() instanceof RecurrenceRange.Numbered numbered) {
            Instant lastStart = lastOccurrenceStart(firstStart, pattern, numbered.numberOfOccurrences());
            return lastStart == null || lastStart.plus(Duration.between(firstStart, firstEnd)).isAfter(windowStart);
        }
        return true;
    }

    /** Start of the last occurrence of a numbered sequence, {@code null} if not found within the walk bound. */
    private Instant lastOccurrenceStart(Instant firstStart, RecurrencePattern pattern, int occurrences) {
        ZonedDateTime anchorTime = firstStart.atZone(zone);
        LocalDate anchor = anchorTime.toLocalDate();
        LocalDate last = null;
        int emitted = 0;
        for (long k = 0; k < MAX_PERIODS && emitted < occurrences; k++) {
            for (LocalDate date : pattern.datesInPeriod(anchor, k)) {
                if (date.isBefore(anchor)) {
                    continue;
                }
                last = date;
                if (++emitted == occurrences) {
                    break;
                }
            }
        }
        return emitted < occurrences || last == null
            ? null
            : ZonedDateTime.of(last, anchorTime.toLocalTime(), zone).toInstant();
    }

    private static void addClipped(List<Occurrence> result, Instant start, Instant end,
                                   Instant windowStart, Instant windowEnd) {
        if (start.isBefore(windowEnd) && end.isAfter(windowStart)) {
            Instant clippedStart = start.isBefore(windowStart) ? windowStart : start;
            Instant clippedEnd = end.isAfter(windowEnd) ? windowEnd : end;
            result.add(new Occurrence(clippedStart, clippedEnd));
        }
    }
}
