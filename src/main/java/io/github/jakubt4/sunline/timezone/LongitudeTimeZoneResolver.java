package io.github.jakubt4.sunline.timezone;

import org.springframework.stereotype.Component;

/**
 * Nautical time zones: one hour per 15 degrees of longitude, rounded to the nearest hour.
 * Political time zones and daylight saving time are not considered.
 */
@Component
public class LongitudeTimeZoneResolver implements TimeZoneResolver {

    @Override
    public UtcOffset resolve(final double longitude) {
        if (!(longitude >= -180 && longitude <= 180)) {
            throw new IllegalArgumentException("Longitude out of range: " + longitude);
        }
        final var hours = (int) Math.round(longitude / 15);
        return new UtcOffset(hours, label(hours));
    }

    static String label(final int hours) {
        if (hours == 0) {
            return "UTC";
        }
        return hours > 0 ? "UTC+" + hours : "UTC" + hours;
    }
}
