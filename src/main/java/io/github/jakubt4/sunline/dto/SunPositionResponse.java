package io.github.jakubt4.sunline.dto;

/**
 * Apparent position of the Sun for one place and instant.
 *
 * @param timestamp  queried instant, UTC, {@code YYYY-MM-DD HH:MM:SS.S}
 * @param julianDate queried instant as a Julian date
 * @param latitude   observer latitude [deg]
 * @param longitude  observer longitude [deg]
 * @param altitude   altitude of the Sun's center [deg]
 * @param azimuth    azimuth clockwise from north [deg]
 */
public record SunPositionResponse(String timestamp, double julianDate, double latitude, double longitude,
                                  double altitude, double azimuth) {
}
