package io.github.jakubt4.sunline.astro;

import org.hipparchus.geometry.euclidean.threed.Rotation;
import org.hipparchus.geometry.euclidean.threed.RotationConvention;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

/**
 * Orientation of the rotating Earth in the orbital-plane frame.
 *
 * <p>Two frames are involved:
 * <ul>
 *   <li><b>orbital frame</b>: x toward the fixed reference direction, z normal to the
 *       orbital plane;</li>
 *   <li><b>Earth frame</b>: x toward the subsolar zenith at the reference equinox, z along
 *       the rotation axis, y = z × x. It does not rotate; the Earth's daily rotation is
 *       applied as a longitude phase.</li>
 * </ul>
 * Precession is ignored, so both the axis and the Earth frame are constant.
 */
public final class EarthOrientation {

    private final EarthOrientationParameters parameters;
    private final Vector3D equinoxSunDirection;
    private final Vector3D rotationAxis;
    private final Vector3D earthFrameY;

    public EarthOrientation(final OrbitalModel orbitalModel, final EarthOrientationParameters parameters) {
        this.parameters = parameters;
        this.equinoxSunDirection = orbitalModel.sunVector(parameters.equinoxJd()).normalize();
        this.rotationAxis = tiltedAxis(equinoxSunDirection, FastMath.toRadians(parameters.axialTilt()));
        this.earthFrameY = Vector3D.crossProduct(rotationAxis, equinoxSunDirection);
    }

    /**
     * Tilts the orbital-plane normal away from the Sun direction of a March equinox. The
     * Sun direction is first aligned with x (rotation about z), the normal is then rotated
     * clockwise about x by the tilt, and the alignment is undone.
     *
     * @param sunAtEquinox unit vector toward the Sun at the March equinox, in the orbital plane
     * @param tilt         axial tilt [rad]
     * @return unit rotation axis in the orbital frame
     */
    static Vector3D tiltedAxis(final Vector3D sunAtEquinox, final double tilt) {
        final var theta = Rotations.rotationAngleBetween(sunAtEquinox, Vector3D.PLUS_I, Vector3D.PLUS_K);
        final var align = new Rotation(Vector3D.PLUS_K, theta, RotationConvention.VECTOR_OPERATOR);
        final var tiltAboutSun = new Rotation(Vector3D.PLUS_I, -tilt, RotationConvention.VECTOR_OPERATOR);

        final var aligned = align.applyTo(Vector3D.PLUS_K);
        return align.revert().applyTo(tiltAboutSun.applyTo(aligned)).normalize();
    }

    public EarthOrientationParameters parameters() {
        return parameters;
    }

    /** Unit vector of Earth's rotation axis (north), orbital frame. */
    public Vector3D rotationAxis() {
        return rotationAxis;
    }

    /** Unit vector toward the Sun at the reference equinox, orbital frame. */
    public Vector3D equinoxSunDirection() {
        return equinoxSunDirection;
    }

    /** Angle the Earth has turned since the reference equinox [rad]. */
    public double rotationSinceEquinox(final double jd) {
        return (jd - parameters.equinoxJd()) * CalendarClock.SECONDS_PER_DAY * parameters.rotationRate();
    }

    /**
     * Unit vector pointing straight up at a location on a spherical Earth.
     *
     * <p>Starting from the equinox subsolar zenith, the latitude offset is a rotation toward
     * the axis (clockwise about Earth-frame y, since colatitude decreases), and the
     * longitude offset plus the rotation since the equinox is a counterclockwise rotation
     * about the axis.
     *
     * @param jd  instant [JD]
     * @param lat latitude [deg], north positive
     * @param lon longitude [deg], east positive
     * @return unit zenith vector, orbital frame
     */
    public Vector3D zenith(final double jd, final double lat, final double lon) {
        final var latRad = FastMath.toRadians(lat);
        final var phase = FastMath.toRadians(lon - parameters.subsolarLongitudeAtEquinox()) + rotationSinceEquinox(jd);
        final var cosLat = FastMath.cos(latRad);
        return toOrbitalFrame(new Vector3D(cosLat * FastMath.cos(phase), cosLat * FastMath.sin(phase),
                FastMath.sin(latRad)));
    }

    /** Maps Earth-frame coordinates to the orbital frame. */
    public Vector3D toOrbitalFrame(final Vector3D earthFrame) {
        return new Vector3D(earthFrame.getX(), equinoxSunDirection,
                earthFrame.getY(), earthFrameY,
                earthFrame.getZ(), rotationAxis);
    }
}
