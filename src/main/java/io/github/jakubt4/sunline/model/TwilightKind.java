package io.github.jakubt4.sunline.model;

/**
 * Which horizon crossing to search for.
 */
public enum TwilightKind {
    SUNRISE,
    SUNSET;

    public boolean isRise() {
        return this == SUNRISE;
    }

    public static TwilightKind of(final boolean rise) {
        return rise ? SUNRISE : SUNSET;
    }
}
