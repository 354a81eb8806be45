package io.github.jakubt4.sunline.astro;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

/**
 * Altitude and azimuth of the Sun for an observer at a given place and time.
 */
public final class SolarPositionResolver {

    public static final double EARTH_RADIUS = 6.371e6; // [m], spherical
    public static final double SUN_RADIUS = 6.957e8;   // [m]

    private static final double DEGENERATE = 1e-12;

    private final AstronomicalModel model;

    public SolarPositionResolver(final AstronomicalModel model) {
        this.model = model;
    }

    public AstronomicalModel model() {
        return model;
    }

    /**
     * @param jd  instant [JD, UTC]
     * @param lat latitude [deg], north positive
     * @param lon longitude [deg], east positive
     * @throws IllegalArgumentException if the coordinates are out of range
     */
    public SolarPosition sunLocation(final double jd, final double lat, final double lon) {
        requireValidLocation(lat, lon);
        final var orientation = model.earthOrientation();
        final var zenith = orientation.zenith(jd, lat, lon);
        final var geocentric = model.orbitalModel().sunVector(jd);

        // observer sits on the surface, not at the center
        final var sun = geocentric.subtract(EARTH_RADIUS, zenith).normalize();
        final var cosZenithAngle = FastMath.max(-1.0, FastMath.min(1.0, Vector3D.dotProduct(sun, zenith)));
        final var altitude = 90 - FastMath.toDegrees(FastMath.acos(cosZenithAngle));

        final var horizontal = sun.subtract(cosZenithAngle, zenith);
        final var eastUnnormalized = Vector3D.crossProduct(orientation.rotationAxis(), zenith);

        // azimuth is undefined at the poles and with the Sun at the zenith or nadir
        var azimuth = 0.0;
        if (horizontal.getNorm() > DEGENERATE && eastUnnormalized.getNorm() > DEGENERATE) {
            final var east = eastUnnormalized.normalize();
            final var north = Vector3D.crossProduct(zenith, east).normalize();
            azimuth = FastMath.toDegrees(Rotations.rotationAngleBetween(horizontal.normalize(), north, zenith)) % 360;
        }
        final var angularRadius = FastMath.toDegrees(FastMath.asin(SUN_RADIUS / geocentric.getNorm()));

        return new SolarPosition(altitude, azimuth, angularRadius);
    }

    /**
     * @throws IllegalArgumentException unless latitude is in [-90, 90] and longitude in [-180, 180]
     */
    public static void requireValidLocation(final double lat, final double lon) {
        if (!(lat >= -90 && lat <= 90)) {
            throw new IllegalArgumentException("Latitude out of range: " + lat);
        }
        if (!(lon >= -180 && lon <= 180)) {
            throw new IllegalArgumentException("Longitude out of range: " + lon);
        }
    }
}
