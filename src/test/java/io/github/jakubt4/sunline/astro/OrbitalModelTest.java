package io.github.jakubt4.sunline.astro;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OrbitalModelTest {

    private final OrbitalModel orbitalModel = new OrbitalModel(OrbitalElements.EARTH_J2000);

    @Test
    void keplerSolutionSatisfiesKeplersEquation() {
        final var e = 0.5;
        final var anomaly = OrbitalModel.solveKepler(e, 30, 1e-12);

        assertThat(anomaly).isCloseTo(52.827, within(1e-3));
        final var meanAnomaly = anomaly - FastMath.toDegrees(e) * FastMath.sin(FastMath.toRadians(anomaly));
        assertThat(meanAnomaly).isCloseTo(30.0, within(1e-9));
    }

    @Test
    void keplerSolutionIsExactAtApsides() {
        final var e = OrbitalElements.EARTH_J2000.eccentricity();
        assertThat(OrbitalModel.solveKepler(e, 0, OrbitalModel.DEFAULT_TOLERANCE)).isEqualTo(0.0);
        assertThat(OrbitalModel.solveKepler(e, 180, OrbitalModel.DEFAULT_TOLERANCE)).isCloseTo(180.0, within(1e-9));
        assertThat(OrbitalModel.solveKepler(0, 123.4, OrbitalModel.DEFAULT_TOLERANCE)).isEqualTo(123.4);
    }

    @Test
    void keplerSolverGivesUpAfterIterationCap() {
        assertThatThrownBy(() -> OrbitalModel.solveKepler(0.5, 30, 1e-15, 1))
                .isInstanceOf(NonConvergenceException.class)
                .hasMessageContaining("1 iterations");
    }

    @Test
    void meanAnomalyIsReducedIntoOneTurn() {
        assertThat(orbitalModel.meanAnomaly(2451545.0)).isCloseTo(358.617, within(1e-9));
        assertThat(orbitalModel.meanAnomaly(2451545.0 + 10 * 365.256363004)).isCloseTo(358.617, within(1e-6));
        assertThat(orbitalModel.meanAnomaly(2460000.5)).isBetween(0.0, 360.0);
    }

    @Test
    void sunDistanceSpansPerihelionToAphelion() {
        final var perihelion = orbitalModel.sunVector(2451547.0);
        final var aphelion = orbitalModel.sunVector(2451729.0);

        assertThat(perihelion.getZ()).isEqualTo(0.0);
        assertThat(perihelion.getNorm()).isCloseTo(1.471e11, within(1e8));
        assertThat(aphelion.getNorm()).isCloseTo(1.521e11, within(1e8));
    }

    @Test
    void equinoxesAndSolsticesAreOpposite() {
        final var marchEquinox = sunDirection(new CivilDate(2020, 3, 20, 3, 49, 0.0));
        final var juneSolstice = sunDirection(new CivilDate(2020, 6, 20, 21, 43, 0.0));
        final var septemberEquinox = sunDirection(new CivilDate(2020, 9, 22, 13, 31, 0.0));
        final var decemberSolstice = sunDirection(new CivilDate(2020, 12, 21, 10, 2, 0.0));

        assertThat(Vector3D.dotProduct(marchEquinox, septemberEquinox)).isCloseTo(-1.0, within(1e-5));
        assertThat(Vector3D.dotProduct(juneSolstice, decemberSolstice)).isCloseTo(-1.0, within(1e-5));
        assertThat(Vector3D.dotProduct(marchEquinox, juneSolstice)).isCloseTo(0.0, within(0.02));
    }

    @Test
    void sunDirectionRepeatsEverySiderealYear() {
        final var september2020 = sunDirection(new CivilDate(2020, 9, 22, 13, 31, 0.0));
        final var december2020 = sunDirection(new CivilDate(2020, 12, 21, 10, 2, 0.0));
        final var september2024 = sunDirection(new CivilDate(2024, 9, 22, 12, 43, 0.0));
        final var december2024 = sunDirection(new CivilDate(2024, 12, 21, 9, 21, 0.0));

        assertThat(Vector3D.dotProduct(september2020, september2024)).isCloseTo(1.0, within(1e-5));
        assertThat(Vector3D.dotProduct(december2020, december2024)).isCloseTo(1.0, within(1e-5));
    }

    private Vector3D sunDirection(final CivilDate date) {
        return orbitalModel.sunVector(CalendarClock.toJulianDate(date)).normalize();
    }
}
