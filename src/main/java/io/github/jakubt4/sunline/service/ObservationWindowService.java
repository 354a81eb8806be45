package io.github.jakubt4.sunline.service;

import io.github.jakubt4.sunline.astro.CalendarClock;
import io.github.jakubt4.sunline.astro.CivilDate;
import io.github.jakubt4.sunline.model.ObservationEvent;
import io.github.jakubt4.sunline.model.ObservationWindowQuery;
import io.github.jakubt4.sunline.numeric.Angles;
import io.github.jakubt4.sunline.timezone.TimeZoneResolver;
import io.github.jakubt4.sunline.timezone.UtcOffset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Scans a range of dates for sunrises or sunsets along a target heading, e.g. the days on
 * which the Sun sets behind a landmark.
 *
 * <p>Each day is searched independently on the shared worker pool; results are collected
 * back in date order. Days without a crossing are skipped.
 */
@Slf4j
@Service
public class ObservationWindowService {

    private final TwilightSearchService twilightSearchService;
    private final TimeZoneResolver timeZoneResolver;
    private final ExecutorService searchExecutor;

    public ObservationWindowService(final TwilightSearchService twilightSearchService,
                                    final TimeZoneResolver timeZoneResolver,
                                    @Qualifier("twilightSearchExecutor") final ExecutorService searchExecutor) {
        this.twilightSearchService = twilightSearchService;
        this.timeZoneResolver = timeZoneResolver;
        this.searchExecutor = searchExecutor;
    }

    /**
     * @return matching events in date order, timestamps in the longitude-based local time
     * @throws IllegalArgumentException on out-of-range coordinates or sample count
     */
    public List<ObservationEvent> findWindow(final ObservationWindowQuery query) {
        final var offset = timeZoneResolver.resolve(query.longitude());
        final var dates = datesBetween(query.beginDate(), query.endDate());
        log.info("Searching {} days {}..{} for {} at heading {} +/- {} deg",
                dates.size(), query.beginDate().formatDate(), query.endDate().formatDate(),
                query.kind(), query.heading(), query.tolerance());

        final var futures = new ArrayList<Future<Optional<ObservationEvent>>>(dates.size());
        for (final var date : dates) {
            futures.add(searchExecutor.submit(() -> searchDay(date, query, offset)));
        }

        final var window = new ArrayList<ObservationEvent>();
        try {
            for (final var future : futures) {
                future.get().ifPresent(window::add);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Observation window search interrupted", e);
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new IllegalStateException("Observation window search failed", e.getCause());
        } finally {
            futures.forEach(future -> future.cancel(true));
        }

        log.info("Found {} matching {} events", window.size(), query.kind());
        return window;
    }

    private Optional<ObservationEvent> searchDay(final CivilDate date, final ObservationWindowQuery query,
                                                 final UtcOffset offset) {
        try {
            final var event = twilightSearchService.findCrossing(date, query.latitude(), query.longitude(),
                    query.kind(), query.sampleCount());
            if (Angles.headingDifference(query.heading(), event.azimuth()) >= query.tolerance()) {
                return Optional.empty();
            }
            final var localTimestamp = CalendarClock.formatTimestamp(event.julianDate() + offset.hours() / 24.0);
            return Optional.of(new ObservationEvent(localTimestamp, offset.label(), event.altitude(), event.azimuth()));
        } catch (final NoCrossingException e) {
            log.debug("Skipping {}: {}", date.formatDate(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Calendar dates from {@code begin} to {@code end} inclusive, stepping by day of year and
     * rolling over to January 1 after the last day of each year.
     */
    static List<CivilDate> datesBetween(final CivilDate begin, final CivilDate end) {
        final var dates = new ArrayList<CivilDate>();
        var year = begin.year();
        var dayOfYear = begin.dayOfYear();
        final var endDayOfYear = end.dayOfYear();

        while (year < end.year() || (year == end.year() && dayOfYear <= endDayOfYear)) {
            final var monthDay = CalendarClock.inverse(year, dayOfYear);
            dates.add(CivilDate.of(year, monthDay[0], monthDay[1]));
            dayOfYear++;
            if (dayOfYear == CalendarClock.yearLength(year)) {
                dayOfYear = 0;
                year++;
            }
        }
        return dates;
    }
}
