package io.github.jakubt4.sunline.service;

import io.github.jakubt4.sunline.astro.CalendarClock;
import io.github.jakubt4.sunline.astro.CivilDate;
import io.github.jakubt4.sunline.astro.SolarPositionResolver;
import io.github.jakubt4.sunline.model.TwilightEvent;
import io.github.jakubt4.sunline.model.TwilightKind;
import io.github.jakubt4.sunline.numeric.Angles;
import io.github.jakubt4.sunline.numeric.BracketedRootFinder;
import io.github.jakubt4.sunline.numeric.SplineInterpolation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Locates sunrise or sunset on a single day.
 *
 * <p>The Sun's upper-limb altitude and azimuth are sampled over the twelve hours before
 * (sunrise) or after (sunset) local noon, cubic splines are fitted through both sequences,
 * and the altitude spline's root gives the crossing. Local noon is estimated from the
 * longitude alone, one hour per 15 degrees.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TwilightSearchService {

    public static final int MIN_SAMPLES = 4;

    private static final double WINDOW_DAYS = 0.5;

    private final SolarPositionResolver solarPositionResolver;
    private final BracketedRootFinder rootFinder = new BracketedRootFinder();

    /**
     * @param date        local calendar date; the time of day is ignored
     * @param latitude    observer latitude [deg]
     * @param longitude   observer longitude [deg]
     * @param kind        sunrise or sunset
     * @param sampleCount samples taken over the 12 hour window, at least {@value #MIN_SAMPLES}
     * @throws NoCrossingException      if the upper limb stays above or below the horizon
     *                                  throughout the window
     * @throws IllegalArgumentException on out-of-range coordinates or too few samples
     */
    public TwilightEvent findCrossing(final CivilDate date, final double latitude, final double longitude,
                                      final TwilightKind kind, final int sampleCount) throws NoCrossingException {
        SolarPositionResolver.requireValidLocation(latitude, longitude);
        if (sampleCount < MIN_SAMPLES) {
            throw new IllegalArgumentException("At least " + MIN_SAMPLES + " samples required, got " + sampleCount);
        }

        final var utcOffsetHours = Math.round(longitude / 15);
        final var localNoon = CalendarClock.toJulianDate(date.atMidnight()) + (12 - utcOffsetHours) / 24.0;
        final var windowStart = kind.isRise() ? localNoon - WINDOW_DAYS : localNoon;

        final var offsets = new double[sampleCount];
        final var altitudes = new double[sampleCount];
        final var azimuths = new double[sampleCount];
        for (var i = 0; i < sampleCount; i++) {
            offsets[i] = WINDOW_DAYS * i / (sampleCount - 1);
            final var position = solarPositionResolver.sunLocation(windowStart + offsets[i], latitude, longitude);
            altitudes[i] = position.upperLimbAltitude();
            azimuths[i] = position.azimuth();
        }

        final var altitude = SplineInterpolation.cubic(offsets, altitudes);
        final var root = rootFinder.findRoot(altitude, offsets[0], offsets[sampleCount - 1])
                .orElseThrow(() -> new NoCrossingException(date, kind, latitude, longitude));

        // unwrapped so that a pass through north does not bend the spline
        final var azimuth = SplineInterpolation.cubic(offsets, Angles.unwrapDegrees(azimuths));
        final var event = new TwilightEvent(kind, windowStart + root, altitude.value(root),
                Angles.normalizeDegrees(azimuth.value(root)));

        log.debug("{} on {} at ({}, {}) -> JD {}, azimuth {}",
                kind, date.formatDate(), latitude, longitude, event.julianDate(), event.azimuth());
        return event;
    }
}
