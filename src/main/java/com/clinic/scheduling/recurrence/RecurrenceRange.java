package com.clinic.scheduling.recurrence;

import com.clinic.scheduling.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.LocalDate;

/**
 * How far a recurrence runs. Occurrences are always counted from the first occurrence
 * of the availability record, never from the start of a query window.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = RecurrenceRange.NoEnd.class, name = "no_end"),
    @JsonSubTypes.Type(value = RecurrenceRange.EndDate.class, name = "end_date"),
    @JsonSubTypes.Type(value = RecurrenceRange.Numbered.class, name = "numbered")
})
public sealed interface RecurrenceRange
        permits RecurrenceRange.NoEnd, RecurrenceRange.EndDate, RecurrenceRange.Numbered {

    /**
     * @param date        candidate occurrence date (in the recurrence time zone)
     * @param occurrences number of occurrences already emitted before {@code date}
     * @return {@code true} when {@code date} and everything after it is past the range
     */
    boolean isExhausted(LocalDate date, int occurrences);

    void validate(LocalDate firstOccurrence);

    record NoEnd() implements RecurrenceRange {

        @JsonCreator
        public NoEnd {}

        @Override
        public boolean isExhausted(LocalDate date, int occurrences) {
            return false;
        }

        @Override
        public void validate(LocalDate firstOccurrence) {}
    }

    /** Inclusive last date on which an occurrence may start. */
    record EndDate(LocalDate endDate) implements RecurrenceRange {

        @Override
        public boolean isExhausted(LocalDate date, int occurrences) {
            return date.isAfter(endDate);
        }

        @Override
        public void validate(LocalDate firstOccurrence) {
            if (endDate == null) {
                throw new ValidationException("End-date recurrence range requires an end date");
            }
            if (endDate.isBefore(firstOccurrence)) {
                throw new ValidationException("Recurrence end date " + endDate
                    + " is before the first occurrence " + firstOccurrence);
            }
        }
    }

    record Numbered(int numberOfOccurrences) implements RecurrenceRange {

        @Override
        public boolean isExhausted(LocalDate date, int occurrences) {
            return occurrences >= numberOfOccurrences;
        }

        @Override
        public void validate(LocalDate firstOccurrence) {
            if (numberOfOccurrences < 1) {
                throw new ValidationException("Numbered recurrence range requires a positive occurrence count");
            }
        }
    }
}
