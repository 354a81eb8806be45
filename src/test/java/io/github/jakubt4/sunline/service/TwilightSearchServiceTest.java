package io.github.jakubt4.sunline.service;

import io.github.jakubt4.sunline.astro.AstronomicalModel;
import io.github.jakubt4.sunline.astro.CalendarClock;
import io.github.jakubt4.sunline.astro.CivilDate;
import io.github.jakubt4.sunline.astro.SolarPositionResolver;
import io.github.jakubt4.sunline.model.TwilightKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TwilightSearchServiceTest {

    private static final double SAN_DIEGO_LAT = 32.8595;
    private static final double SAN_DIEGO_LON = -117.2124;
    private static final double MINUTE = 1.0 / 1440;

    private final SolarPositionResolver resolver = new SolarPositionResolver(AstronomicalModel.earth());
    private final TwilightSearchService service = new TwilightSearchService(resolver);

    @Test
    void findsWinterSunsetInSanDiego() throws NoCrossingException {
        final var sunset = service.findCrossing(CivilDate.of(2020, 1, 1), SAN_DIEGO_LAT, SAN_DIEGO_LON,
                TwilightKind.SUNSET, 100);

        // published sunset 16:53 PST; the model does not account for refraction
        assertThat(sunset.kind()).isEqualTo(TwilightKind.SUNSET);
        assertThat(sunset.julianDate()).isCloseTo(utc(2020, 1, 2, 0, 53), within(5 * MINUTE));
        assertThat(sunset.julianDate()).isCloseTo(utc(2020, 1, 2, 0, 50), within(MINUTE));
        assertThat(sunset.azimuth()).isCloseTo(242.5, within(0.1));
        assertThat(sunset.altitude()).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void findsSummerSunsetInSanDiego() throws NoCrossingException {
        final var sunset = service.findCrossing(CivilDate.of(2024, 8, 9), SAN_DIEGO_LAT, SAN_DIEGO_LON,
                TwilightKind.SUNSET, 100);

        // published sunset 19:39 PDT, i.e. 18:39 at UTC-8
        assertThat(sunset.julianDate()).isCloseTo(utc(2024, 8, 10, 2, 39), within(5 * MINUTE));
        assertThat(sunset.azimuth()).isCloseTo(288.7, within(0.1));
    }

    @Test
    void findsSunriseBeforeLocalNoon() throws NoCrossingException {
        final var date = CivilDate.of(2020, 1, 1);
        final var sunrise = service.findCrossing(date, SAN_DIEGO_LAT, SAN_DIEGO_LON, TwilightKind.SUNRISE, 100);

        assertThat(sunrise.kind()).isEqualTo(TwilightKind.SUNRISE);
        assertThat(sunrise.julianDate()).isCloseTo(utc(2020, 1, 1, 14, 54), within(MINUTE));
        assertThat(sunrise.azimuth()).isCloseTo(117.54, within(0.1));
    }

    @Test
    void coarseSamplingAgreesWithFineSampling() throws NoCrossingException {
        final var date = CivilDate.of(2020, 3, 20);
        final var coarse = service.findCrossing(date, SAN_DIEGO_LAT, SAN_DIEGO_LON, TwilightKind.SUNSET, 30);
        final var fine = service.findCrossing(date, SAN_DIEGO_LAT, SAN_DIEGO_LON, TwilightKind.SUNSET, 100);

        assertThat(coarse.julianDate()).isCloseTo(fine.julianDate(), within(1.0 / 86400));
        assertThat(coarse.azimuth()).isCloseTo(fine.azimuth(), within(0.01));
    }

    @Test
    void reportsPolarNightAsNoCrossing() {
        final var date = CivilDate.of(2020, 12, 21);

        assertThatThrownBy(() -> service.findCrossing(date, 70, 0, TwilightKind.SUNSET, 100))
                .isInstanceOf(NoCrossingException.class)
                .hasMessage("No sunset on 2020-12-21 at (70.0000, 0.0000)")
                .satisfies(e -> {
                    final var noCrossing = (NoCrossingException) e;
                    assertThat(noCrossing.getDate()).isEqualTo(date);
                    assertThat(noCrossing.getKind()).isEqualTo(TwilightKind.SUNSET);
                });
        assertThatThrownBy(() -> service.findCrossing(date, 70, 0, TwilightKind.SUNRISE, 30))
                .isInstanceOf(NoCrossingException.class);
    }

    @Test
    void reportsSouthernPolarNightAsNoCrossing() {
        assertThatThrownBy(() -> service.findCrossing(CivilDate.of(2020, 6, 21), -70, 0, TwilightKind.SUNRISE, 100))
                .isInstanceOf(NoCrossingException.class);
    }

    @Test
    void findsSunsetOnceArcticSunReturns() throws NoCrossingException {
        final var sunset = service.findCrossing(CivilDate.of(2021, 1, 20), 70, 20, TwilightKind.SUNSET, 100);

        assertThat(sunset.azimuth()).isBetween(180.0, 270.0);
    }

    @Test
    void rejectsInvalidArguments() {
        final var date = CivilDate.of(2020, 1, 1);

        assertThatThrownBy(() -> service.findCrossing(date, 91, 0, TwilightKind.SUNSET, 100))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Latitude");
        assertThatThrownBy(() -> service.findCrossing(date, 0, -181, TwilightKind.SUNSET, 100))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Longitude");
        assertThatThrownBy(() -> service.findCrossing(date, 0, 0, TwilightKind.SUNSET, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("samples");
    }

    private static double utc(final int year, final int month, final int day, final int hour, final int minute) {
        return CalendarClock.toJulianDate(new CivilDate(year, month, day, hour, minute, 0.0));
    }
}
