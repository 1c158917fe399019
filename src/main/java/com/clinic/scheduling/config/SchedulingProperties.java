package com.clinic.scheduling.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * Engine tunables bound from {@code scheduling.*}.
 *
 * @param slotIntervalMinutes   granularity of candidate start times
 * @param maxSlots              cap on candidates returned by one generation call
 * @param alternativesDays      how far ahead alternatives are searched after a booking conflict
 * @param alternativesCount     how many alternatives are returned after a booking conflict
 * @param validationHorizonDays how far ahead alternatives are searched when a slot fails validation
 * @param timeZone              zone in which recurrence dates and times of day are evaluated
 */
@ConfigurationProperties("scheduling")
public record SchedulingProperties(
    Integer slotIntervalMinutes,
    Integer maxSlots,
    Integer alternativesDays,
    Integer alternativesCount,
    Integer validationHorizonDays,
    ZoneId timeZone
) {

    public SchedulingProperties {
        slotIntervalMinutes = slotIntervalMinutes == null ? 15 : slotIntervalMinutes;
        maxSlots = maxSlots == null ? 100 : maxSlots;
        alternativesDays = alternativesDays == null ? 14 : alternativesDays;
        alternativesCount = alternativesCount == null ? 5 : alternativesCount;
        validationHorizonDays = validationHorizonDays == null ? 7 : validationHorizonDays;
        timeZone = timeZone == null ? ZoneId.of("UTC") : timeZone;
    }

    public static SchedulingProperties defaults() {
        return new SchedulingProperties(null, null, null, null, null, null);
    }
}
