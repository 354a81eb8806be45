package io.github.jakubt4.sunline.astro;

/**
 * Apparent position of the Sun's center for an observer on the Earth's surface.
 *
 * @param altitude      angle above the horizon [deg], in [-90, 90]
 * @param azimuth       heading clockwise from geographic north [deg], in [0, 360)
 * @param angularRadius apparent radius of the solar disk [deg]
 */
public record SolarPosition(double altitude, double azimuth, double angularRadius) {

    /** Altitude of the top edge of the solar disk [deg]. */
    public double upperLimbAltitude() {
        return altitude + angularRadius;
    }
}
