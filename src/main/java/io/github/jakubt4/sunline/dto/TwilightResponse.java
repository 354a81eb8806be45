package io.github.jakubt4.sunline.dto;

import io.github.jakubt4.sunline.model.TwilightKind;

/**
 * Sunrise or sunset found for one day.
 *
 * @param date           searched local date
 * @param event          sunrise or sunset
 * @param julianDate     instant of the crossing
 * @param utcTimestamp   instant of the crossing, UTC
 * @param localTimestamp instant of the crossing in the longitude-based time zone
 * @param timeZone       label of that time zone, e.g. {@code UTC-8}
 * @param altitude       upper-limb altitude at the crossing [deg]
 * @param azimuth        azimuth at the crossing [deg]
 */
public record TwilightResponse(String date, TwilightKind event, double julianDate, String utcTimestamp,
                               String localTimestamp, String timeZone, double altitude, double azimuth) {
}
