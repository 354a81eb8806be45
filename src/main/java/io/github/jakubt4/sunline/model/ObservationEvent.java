package io.github.jakubt4.sunline.model;

import java.util.Locale;

/**
 * A sunrise or sunset whose heading matched the requested target.
 *
 * @param localTimestamp local time of the crossing, {@code YYYY-MM-DD HH:MM:SS.S}
 * @param timeZone       label of the offset used for {@code localTimestamp}
 * @param altitude       upper-limb altitude at the crossing [deg]
 * @param azimuth        heading of the Sun at the crossing [deg]
 */
public record ObservationEvent(String localTimestamp, String timeZone, double altitude, double azimuth) {

    /** One-line rendering, e.g. {@code 2025-05-03 18:28:46.8 UTC-8; Alt. = 0.000, Azi. = 289.3}. */
    public String toDisplayString() {
        return String.format(Locale.ROOT, "%s %s; Alt. = %.4g, Azi. = %.4g", localTimestamp, timeZone, altitude, azimuth);
    }
}
