package io.github.jakubt4.sunline.controller;

import io.github.jakubt4.sunline.astro.CalendarClock;
import io.github.jakubt4.sunline.astro.CivilDate;
import io.github.jakubt4.sunline.astro.SolarPositionResolver;
import io.github.jakubt4.sunline.config.SunlineProperties;
import io.github.jakubt4.sunline.dto.ErrorResponse;
import io.github.jakubt4.sunline.dto.ObservationWindowRequest;
import io.github.jakubt4.sunline.dto.ObservationWindowResponse;
import io.github.jakubt4.sunline.dto.SunPositionResponse;
import io.github.jakubt4.sunline.dto.TwilightResponse;
import io.github.jakubt4.sunline.model.ObservationWindowQuery;
import io.github.jakubt4.sunline.model.TwilightKind;
import io.github.jakubt4.sunline.service.NoCrossingException;
import io.github.jakubt4.sunline.service.ObservationWindowService;
import io.github.jakubt4.sunline.service.TwilightSearchService;
import io.github.jakubt4.sunline.timezone.TimeZoneResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for solar position, single-day twilight and date-range heading searches.
 *
 * <p>All inputs are UTC except twilight and window dates, which are local calendar dates.
 * Failures are rendered by {@link ApiExceptionHandler}.
 */
@Slf4j
@RestController
@RequestMapping("/api/sun")
@RequiredArgsConstructor
public class SolarController {

    private final SolarPositionResolver solarPositionResolver;
    private final TwilightSearchService twilightSearchService;
    private final ObservationWindowService observationWindowService;
    private final TimeZoneResolver timeZoneResolver;
    private final SunlineProperties properties;

    /**
     * Altitude and azimuth of the Sun.
     *
     * @param timestamp UTC instant, {@code YYYY-MM-DD HH:MM:SS.S}
     */
    @GetMapping("/position")
    public SunPositionResponse position(@RequestParam("timestamp") final String timestamp,
                                        @RequestParam("latitude") final double latitude,
                                        @RequestParam("longitude") final double longitude) {
        SolarPositionResolver.requireValidLocation(latitude, longitude);
        final var jd = CalendarClock.toJulianDate(CivilDate.parseTimestamp(timestamp));
        final var position = solarPositionResolver.sunLocation(jd, latitude, longitude);
        return new SunPositionResponse(CalendarClock.formatTimestamp(jd), jd, latitude, longitude,
                position.altitude(), position.azimuth());
    }

    /**
     * Sunrise or sunset on one local date.
     *
     * @return {@code 200 OK} with the crossing, {@code 404 Not Found} when the Sun does not
     *         cross the horizon that day, {@code 400 Bad Request} on invalid input
     */
    @GetMapping("/twilight")
    public TwilightResponse twilight(@RequestParam("date") final String date,
                                     @RequestParam("latitude") final double latitude,
                                     @RequestParam("longitude") final double longitude,
                                     @RequestParam(name = "event", defaultValue = "SUNSET") final TwilightKind event,
                                     @RequestParam(name = "samples", required = false) final Integer samples)
            throws NoCrossingException {
        final var day = CivilDate.parseDate(date);
        final var sampleCount = samples != null ? samples : properties.search().sampleCount();
        final var crossing = twilightSearchService.findCrossing(day, latitude, longitude, event, sampleCount);
        final var offset = timeZoneResolver.resolve(longitude);

        return new TwilightResponse(day.formatDate(), event, crossing.julianDate(),
                CalendarClock.formatTimestamp(crossing.julianDate()),
                CalendarClock.formatTimestamp(crossing.julianDate() + offset.hours() / 24.0),
                offset.label(), crossing.altitude(), crossing.azimuth());
    }

    /**
     * Every sunrise or sunset in a date range whose azimuth is within tolerance of a heading.
     *
     * @return {@code 200 OK} with the events in date order, {@code 400 Bad Request} when a
     *         required field is missing or invalid
     */
    @PostMapping("/window")
    public ResponseEntity<?> window(@RequestBody final ObservationWindowRequest request) {
        if (request.heading() == null || request.latitude() == null || request.longitude() == null) {
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse(ErrorResponse.REJECTED, "heading, latitude and longitude are required"));
        }
        if (request.beginDate() == null || request.endDate() == null) {
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse(ErrorResponse.REJECTED, "beginDate and endDate are required"));
        }

        final var defaults = properties.search();
        final var event = request.event() != null ? request.event() : TwilightKind.SUNSET;
        final var query = new ObservationWindowQuery(
                request.heading(),
                CivilDate.parseDate(request.beginDate()),
                CivilDate.parseDate(request.endDate()),
                request.latitude(),
                request.longitude(),
                event,
                request.tolerance() != null ? request.tolerance() : defaults.tolerance(),
                request.samples() != null ? request.samples() : defaults.sampleCount());

        final var events = observationWindowService.findWindow(query);
        log.info("Window search {}..{} heading {} returned {} events",
                request.beginDate(), request.endDate(), request.heading(), events.size());
        return ResponseEntity.ok(ObservationWindowResponse.of(request.heading(), event, events));
    }
}
