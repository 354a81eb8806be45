package io.github.jakubt4.sunline.astro;

import org.hipparchus.util.FastMath;

/**
 * Two-harmonic approximation of the equation of time, the difference between apparent
 * (sundial) and mean (clock) solar time.
 */
public final class EquationOfTime {

    private EquationOfTime() {} // Disallow instantiation

    /**
     * @param year      calendar year (AD)
     * @param dayOfYear days since January 1 of {@code year}
     * @return apparent minus mean solar time [min]
     */
    public static double equationOfTime(final int year, final int dayOfYear) {
        final var d = 6.24004077 + 0.01720197 * (365.25 * (year - 2000) + dayOfYear);
        return -7.659 * FastMath.sin(d) + 9.863 * FastMath.sin(2 * d + 3.5932);
    }

    /**
     * Longitude of the subsolar point at a UTC instant, from the apparent solar time at
     * Greenwich.
     *
     * @return longitude [deg], east positive
     */
    public static double subsolarLongitude(final CivilDate utc) {
        final var eot = equationOfTime(utc.year(), utc.dayOfYear());
        return -15 * (utc.hourOfDay() - 12 + eot / 60);
    }
}
