package io.github.jakubt4.sunline.astro;

/**
 * Keplerian elements of an orbit around the Sun.
 *
 * @param eccentricity          orbital eccentricity
 * @param semiMajorAxis         semi-major axis [m]
 * @param argumentOfPeriapsis   argument of periapsis [deg]
 * @param epoch                 reference epoch [JD]
 * @param meanAnomalyAtEpoch    mean anomaly at {@code epoch} [deg]
 * @param orbitalPeriod         sidereal orbital period [d]
 */
public record OrbitalElements(double eccentricity,
                              double semiMajorAxis,
                              double argumentOfPeriapsis,
                              double epoch,
                              double meanAnomalyAtEpoch,
                              double orbitalPeriod) {

    /** Earth, epoch J2000 (2000-01-01 12:00 TT). */
    public static final OrbitalElements EARTH_J2000 = new OrbitalElements(
            0.0167086,
            1.49598023e11,
            114.20783,
            2451545.0,
            358.617,
            365.256363004);

    public OrbitalElements {
        if (!(eccentricity >= 0 && eccentricity < 1)) {
            throw new IllegalArgumentException("Eccentricity must be in [0, 1), got " + eccentricity);
        }
        if (!(semiMajorAxis > 0) || !(orbitalPeriod > 0)) {
            throw new IllegalArgumentException("Semi-major axis and period must be positive");
        }
    }
}
