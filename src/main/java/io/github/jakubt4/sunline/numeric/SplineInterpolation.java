package io.github.jakubt4.sunline.numeric;

import org.hipparchus.analysis.UnivariateFunction;
import org.hipparchus.analysis.interpolation.SplineInterpolator;

/**
 * Natural cubic spline through sampled points.
 */
public final class SplineInterpolation {

    private static final SplineInterpolator INTERPOLATOR = new SplineInterpolator();

    private SplineInterpolation() {} // Disallow instantiation

    /**
     * @param x strictly increasing abscissae, at least three
     * @param y ordinates, same length as {@code x}
     * @return interpolant defined on {@code [x[0], x[n-1]]}
     * @throws IllegalArgumentException if fewer than three points are given, the lengths
     *                                  differ, or {@code x} is not strictly increasing
     */
    public static UnivariateFunction cubic(final double[] x, final double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Sample lengths differ: " + x.length + " vs " + y.length);
        }
        if (x.length < 3) {
            throw new IllegalArgumentException("A cubic spline needs at least 3 points, got " + x.length);
        }
        for (var i = 1; i < x.length; i++) {
            if (!(x[i] > x[i - 1])) {
                throw new IllegalArgumentException("Abscissae must be strictly increasing at index " + i);
            }
        }
        return INTERPOLATOR.interpolate(x, y);
    }
}
