package io.github.jakubt4.sunline.model;

/**
 * Moment the upper limb of the Sun touches the horizon.
 *
 * @param kind        sunrise or sunset
 * @param julianDate  instant of the crossing [JD, UTC]
 * @param altitude    interpolated upper-limb altitude at the crossing [deg], close to zero
 * @param azimuth     heading of the Sun at the crossing [deg], in [0, 360)
 */
public record TwilightEvent(TwilightKind kind, double julianDate, double altitude, double azimuth) {
}
