package io.github.jakubt4.sunline.service;

import io.github.jakubt4.sunline.astro.CivilDate;
import io.github.jakubt4.sunline.model.TwilightKind;
import lombok.Getter;

import java.util.Locale;

/**
 * The Sun's upper limb does not cross the horizon within the searched window, as happens
 * during polar day and polar night.
 */
@Getter
public class NoCrossingException extends Exception {

    private final CivilDate date;
    private final TwilightKind kind;

    public NoCrossingException(final CivilDate date, final TwilightKind kind, final double latitude,
                               final double longitude) {
        super(String.format(Locale.ROOT, "No %s on %s at (%.4f, %.4f)",
                kind.name().toLowerCase(Locale.ROOT), date.formatDate(), latitude, longitude));
        this.date = date;
        this.kind = kind;
    }
}
