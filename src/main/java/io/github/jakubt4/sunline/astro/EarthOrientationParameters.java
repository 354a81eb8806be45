package io.github.jakubt4.sunline.astro;

import org.hipparchus.util.FastMath;

/**
 * Orientation and rotation phase of the Earth, fixed for the life of a model.
 *
 * @param axialTilt                  tilt of the rotation axis from the orbital-plane normal [deg]
 * @param equinoxJd                  reference March equinox [JD]
 * @param subsolarLongitudeAtEquinox longitude of the subsolar point at {@code equinoxJd} [deg]
 * @param siderealDay                sidereal rotation period [s]
 */
public record EarthOrientationParameters(double axialTilt,
                                         double equinoxJd,
                                         double subsolarLongitudeAtEquinox,
                                         double siderealDay) {

    // https://hpiers.obspm.fr/eop-pc/models/constants.html
    public static final double EARTH_AXIAL_TILT = 23.4392811;
    public static final double EARTH_SIDEREAL_DAY = 86164.0905;

    /** March 2020 equinox, UTC. */
    public static final CivilDate REFERENCE_EQUINOX = new CivilDate(2020, 3, 20, 3, 49, 0.0);

    /** Solar noon at longitude 0 following {@link #REFERENCE_EQUINOX}, UTC. */
    public static final CivilDate REFERENCE_SOLAR_NOON = new CivilDate(2020, 3, 20, 12, 7, 0.0);

    public EarthOrientationParameters {
        if (!(siderealDay > 0)) {
            throw new IllegalArgumentException("Sidereal day must be positive, got " + siderealDay);
        }
    }

    /**
     * Subsolar longitude from the solar noon at longitude 0: the Earth turns one synodic day
     * between consecutive solar noons, so the elapsed fraction of a day is the longitude.
     */
    public static EarthOrientationParameters fromSolarNoon(final double axialTilt, final CivilDate equinox,
                                                           final CivilDate solarNoon, final double siderealDay) {
        final var equinoxJd = CalendarClock.toJulianDate(equinox);
        final var solarNoonJd = CalendarClock.toJulianDate(solarNoon);
        return new EarthOrientationParameters(axialTilt, equinoxJd, (solarNoonJd - equinoxJd) * 360, siderealDay);
    }

    public static EarthOrientationParameters fromEquationOfTime(final double axialTilt, final CivilDate equinox,
                                                                final double siderealDay) {
        final var equinoxJd = CalendarClock.toJulianDate(equinox);
        return new EarthOrientationParameters(axialTilt, equinoxJd, EquationOfTime.subsolarLongitude(equinox),
                siderealDay);
    }

    /** Earth's reference parameters with the subsolar longitude derived as requested. */
    public static EarthOrientationParameters earth(final SubsolarReference reference) {
        return switch (reference) {
            case SOLAR_NOON -> fromSolarNoon(EARTH_AXIAL_TILT, REFERENCE_EQUINOX, REFERENCE_SOLAR_NOON,
                    EARTH_SIDEREAL_DAY);
            case EQUATION_OF_TIME -> fromEquationOfTime(EARTH_AXIAL_TILT, REFERENCE_EQUINOX, EARTH_SIDEREAL_DAY);
        };
    }

    /** Sidereal rotation rate [rad/s]. */
    public double rotationRate() {
        return 2 * FastMath.PI / siderealDay;
    }
}
