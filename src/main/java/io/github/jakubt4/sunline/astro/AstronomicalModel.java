package io.github.jakubt4.sunline.astro;

/**
 * Immutable Sun-Earth model shared by every position query.
 *
 * <p>Building it is the only ordered step: the orientation parameters (equinox instant,
 * then subsolar longitude) must exist before the Earth orientation can locate the equinox
 * Sun direction and the rotation axis.
 */
public final class AstronomicalModel {

    private final OrbitalModel orbitalModel;
    private final EarthOrientation earthOrientation;

    private AstronomicalModel(final OrbitalModel orbitalModel, final EarthOrientation earthOrientation) {
        this.orbitalModel = orbitalModel;
        this.earthOrientation = earthOrientation;
    }

    public static AstronomicalModel create(final OrbitalElements elements,
                                           final EarthOrientationParameters orientation) {
        final var orbitalModel = new OrbitalModel(elements);
        return new AstronomicalModel(orbitalModel, new EarthOrientation(orbitalModel, orientation));
    }

    /** Earth with J2000 elements and the March 2020 equinox reference. */
    public static AstronomicalModel earth(final SubsolarReference reference) {
        return create(OrbitalElements.EARTH_J2000, EarthOrientationParameters.earth(reference));
    }

    public static AstronomicalModel earth() {
        return earth(SubsolarReference.SOLAR_NOON);
    }

    public OrbitalModel orbitalModel() {
        return orbitalModel;
    }

    public EarthOrientation earthOrientation() {
        return earthOrientation;
    }

    public OrbitalElements orbitalElements() {
        return orbitalModel.elements();
    }

    public EarthOrientationParameters orientationParameters() {
        return earthOrientation.parameters();
    }
}
