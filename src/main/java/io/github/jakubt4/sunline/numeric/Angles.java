package io.github.jakubt4.sunline.numeric;

/**
 * Helpers for angles in degrees on a 360-degree circle.
 */
public final class Angles {

    private Angles() {} // Disallow instantiation

    /**
     * Removes 360-degree jumps between consecutive samples so that a continuous angle can be
     * interpolated. The first sample is kept as is.
     */
    public static double[] unwrapDegrees(final double[] degrees) {
        final var unwrapped = degrees.clone();
        for (var i = 1; i < unwrapped.length; i++) {
            final var step = unwrapped[i] - unwrapped[i - 1];
            unwrapped[i] -= 360 * Math.rint(step / 360);
        }
        return unwrapped;
    }

    /** Reduces an angle into [0, 360). */
    public static double normalizeDegrees(final double degrees) {
        final var reduced = degrees - 360 * Math.floor(degrees / 360);
        return reduced < 360 ? reduced : 0.0;
    }

    /** Smallest absolute difference between two headings, in [0, 180]. */
    public static double headingDifference(final double a, final double b) {
        final var diff = normalizeDegrees(a - b);
        return Math.min(diff, 360 - diff);
    }
}
