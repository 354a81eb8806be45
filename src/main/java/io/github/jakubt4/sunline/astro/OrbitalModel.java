package io.github.jakubt4.sunline.astro;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

/**
 * Two-body model of Earth's orbit: solves Kepler's equation for a Julian date and returns
 * the Sun's position relative to Earth in the orbital-plane frame (x toward a fixed
 * reference direction, z normal to the orbital plane).
 */
public final class OrbitalModel {

    public static final double DEFAULT_TOLERANCE = 0.002;
    public static final int DEFAULT_MAX_ITERATIONS = 50;

    private final OrbitalElements elements;

    public OrbitalModel(final OrbitalElements elements) {
        this.elements = elements;
    }

    public OrbitalElements elements() {
        return elements;
    }

    /**
     * Solves {@code M = E - e sin E} by Newton iteration, all angles in degrees.
     *
     * @param eccentricity    orbital eccentricity
     * @param meanAnomalyDeg  mean anomaly [deg]
     * @param tolerance       largest accepted fractional change of {@code E} per step
     * @param maxIterations   iteration cap
     * @return eccentric anomaly [deg]
     * @throws NonConvergenceException if the cap is reached first
     */
    public static double solveKepler(final double eccentricity, final double meanAnomalyDeg,
                                     final double tolerance, final int maxIterations) {
        final var eDeg = FastMath.toDegrees(eccentricity);
        var anomaly = meanAnomalyDeg + eDeg * FastMath.sin(FastMath.toRadians(meanAnomalyDeg));
        var delta = 1.0;
        var iterations = 0;

        while (FastMath.abs(delta) > tolerance * FastMath.abs(anomaly)) {
            if (iterations++ == maxIterations) {
                throw new NonConvergenceException(String.format(
                        "Kepler solver did not converge in %d iterations (e=%s, M=%s deg)",
                        maxIterations, eccentricity, meanAnomalyDeg));
            }
            final var residual = meanAnomalyDeg - (anomaly - eDeg * FastMath.sin(FastMath.toRadians(anomaly)));
            delta = residual / (1 - eccentricity * FastMath.cos(FastMath.toRadians(anomaly)));
            anomaly += delta;
        }
        return anomaly;
    }

    public static double solveKepler(final double eccentricity, final double meanAnomalyDeg, final double tolerance) {
        return solveKepler(eccentricity, meanAnomalyDeg, tolerance, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * @return mean anomaly at {@code jd}, in [0, 360) degrees
     */
    public double meanAnomaly(final double jd) {
        final var sinceEpoch = jd - elements.epoch();
        final var anomaly = elements.meanAnomalyAtEpoch() + 360 / elements.orbitalPeriod() * sinceEpoch;
        return anomaly - 360 * FastMath.floor(anomaly / 360);
    }

    /**
     * Vector from Earth's center to the Sun [m]; {@code z} is always zero.
     */
    public Vector3D sunVector(final double jd) {
        final var e = elements.eccentricity();
        final var eccentricAnomaly = FastMath.toRadians(solveKepler(e, meanAnomaly(jd), DEFAULT_TOLERANCE));
        final var trueAnomaly = MathUtils.normalizeAngle(
                2 * FastMath.atan2(FastMath.sqrt(1 + e) * FastMath.sin(eccentricAnomaly / 2),
                                   FastMath.sqrt(1 - e) * FastMath.cos(eccentricAnomaly / 2)),
                FastMath.PI);

        final var radius = elements.semiMajorAxis() * (1 - e * FastMath.cos(eccentricAnomaly));
        return new Vector3D(-radius * FastMath.cos(trueAnomaly), -radius * FastMath.sin(trueAnomaly), 0);
    }
}
