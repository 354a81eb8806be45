package io.github.jakubt4.sunline.astro;

/**
 * Raised when the Kepler solver exhausts its iteration cap. Never expected for Earth's
 * eccentricity; seeing it means the orbital elements are wrong.
 */
public class NonConvergenceException extends RuntimeException {

    public NonConvergenceException(final String message) {
        super(message);
    }
}
