package io.github.jakubt4.sunline.astro;

/**
 * How the subsolar longitude at the reference equinox is derived.
 */
public enum SubsolarReference {

    /** From the observed solar noon at longitude 0 following the equinox. */
    SOLAR_NOON,

    /** From the equation of time evaluated at the equinox instant. */
    EQUATION_OF_TIME
}
