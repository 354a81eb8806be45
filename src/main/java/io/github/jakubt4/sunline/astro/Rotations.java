package io.github.jakubt4.sunline.astro;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

/**
 * Small vector-geometry helpers shared by the orientation and position models.
 */
public final class Rotations {

    private static final double PARALLEL_TOLERANCE = 1e-8;

    private Rotations() {} // Disallow instantiation

    /**
     * Counterclockwise angle (right-hand rule about {@code axis}) that rotates {@code a} onto
     * {@code b}.
     *
     * @param axis rotation axis; must be parallel or antiparallel to {@code a × b} unless
     *             {@code a} and {@code b} are collinear
     * @return angle in [0, 2π) [rad]
     * @throws IllegalArgumentException if {@code axis} is not normal to the plane of {@code a}
     *                                  and {@code b}
     */
    public static double rotationAngleBetween(final Vector3D a, final Vector3D b, final Vector3D axis) {
        final var unitAxis = axis.normalize();
        final var normal = Vector3D.crossProduct(a, b);
        if (normal.getNorm() > PARALLEL_TOLERANCE * a.getNorm() * b.getNorm()) {
            final var alignment = FastMath.abs(Vector3D.dotProduct(unitAxis, normal.normalize()));
            if (FastMath.abs(alignment - 1) > PARALLEL_TOLERANCE) {
                throw new IllegalArgumentException("Rotation axis " + axis + " is not normal to " + a + " and " + b);
            }
        }

        // axis . (a x b) is the determinant of [axis, a, b]
        final var det = Vector3D.dotProduct(unitAxis, normal);
        final var dot = Vector3D.dotProduct(a, b);
        final var angle = MathUtils.normalizeAngle(FastMath.atan2(det, dot), FastMath.PI);
        // tiny negative angles wrap to exactly 2π
        return angle < MathUtils.TWO_PI ? angle : 0.0;
    }
}
