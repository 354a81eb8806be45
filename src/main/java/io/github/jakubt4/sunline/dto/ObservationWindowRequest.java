package io.github.jakubt4.sunline.dto;

import io.github.jakubt4.sunline.model.TwilightKind;

/**
 * Inbound date-range search. {@code event}, {@code tolerance} and {@code samples} fall back to
 * the configured defaults (sunset, {@code sunline.search.*}) when omitted.
 *
 * @param heading   target azimuth [deg]
 * @param beginDate first local date, {@code YYYY-MM-DD}
 * @param endDate   last local date, {@code YYYY-MM-DD}, inclusive
 * @param latitude  observer latitude [deg]
 * @param longitude observer longitude [deg]
 * @param event     sunrise or sunset
 * @param tolerance heading tolerance [deg]
 * @param samples   samples per 12 hour window
 */
public record ObservationWindowRequest(Double heading, String beginDate, String endDate, Double latitude,
                                       Double longitude, TwilightKind event, Double tolerance, Integer samples) {
}
