package io.github.jakubt4.sunline.model;

import io.github.jakubt4.sunline.astro.CivilDate;

/**
 * Parameters of a date-range search for sunrises or sunsets along a heading.
 *
 * @param heading     target azimuth [deg]
 * @param beginDate   first local date searched, inclusive
 * @param endDate     last local date searched, inclusive
 * @param latitude    observer latitude [deg]
 * @param longitude   observer longitude [deg]
 * @param kind        sunrise or sunset
 * @param tolerance   largest accepted heading difference [deg], exclusive
 * @param sampleCount samples taken over each 12 hour search window
 */
public record ObservationWindowQuery(double heading,
                                     CivilDate beginDate,
                                     CivilDate endDate,
                                     double latitude,
                                     double longitude,
                                     TwilightKind kind,
                                     double tolerance,
                                     int sampleCount) {

    public ObservationWindowQuery {
        if (beginDate == null || endDate == null || kind == null) {
            throw new IllegalArgumentException("Begin date, end date and event kind are required");
        }
        if (beginDate.atMidnight().compareTo(endDate.atMidnight()) > 0) {
            throw new IllegalArgumentException(
                    "Begin date " + beginDate.formatDate() + " is after end date " + endDate.formatDate());
        }
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("Tolerance must be positive, got " + tolerance);
        }
    }
}
