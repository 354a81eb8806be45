package io.github.jakubt4.sunline.astro;

import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A UTC civil date and time in the proleptic Gregorian calendar, on or after 1582-10-15.
 *
 * @param year   calendar year (AD)
 * @param month  month of year, 1-12
 * @param day    day of month, bounded by the month length of {@code year}
 * @param hour   hour of day, 0-23
 * @param minute minute of hour, 0-59
 * @param second second of minute, fractional, in [0, 60)
 * @throws InvalidDateException if any field is out of range or the date precedes 1582-10-15
 */
public record CivilDate(int year, int month, int day, int hour, int minute, double second)
        implements Comparable<CivilDate> {

    private static final Comparator<CivilDate> CHRONOLOGICAL = Comparator.comparingInt(CivilDate::year)
            .thenComparingInt(CivilDate::month)
            .thenComparingInt(CivilDate::day)
            .thenComparingInt(CivilDate::hour)
            .thenComparingInt(CivilDate::minute)
            .thenComparingDouble(CivilDate::second);

    private static final Pattern DATE = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern TIMESTAMP =
            Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2}) (\\d{2}):(\\d{2}):(\\d{2}(?:\\.\\d+)?)");

    public CivilDate {
        if (month < 1 || month > 12) {
            throw new InvalidDateException("Month out of range: " + month);
        }
        if (day < 1 || day > CalendarClock.monthLength(year, month)) {
            throw new InvalidDateException(
                    String.format(Locale.ROOT, "Day out of range for %04d-%02d: %d", year, month, day));
        }
        if (year < 1582 || (year == 1582 && (month < 10 || (month == 10 && day < 15)))) {
            throw new InvalidDateException(String.format(Locale.ROOT,
                    "%04d-%02d-%02d precedes the Gregorian calendar (1582-10-15)", year, month, day));
        }
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59 || !(second >= 0 && second < 60)) {
            throw new InvalidDateException(String.format(Locale.ROOT,
                    "Time of day out of range: %d:%d:%s", hour, minute, second));
        }
    }

    /** Midnight UTC of the given day. */
    public static CivilDate of(final int year, final int month, final int day) {
        return new CivilDate(year, month, day, 0, 0, 0.0);
    }

    /**
     * Parses a {@code YYYY-MM-DD} date string.
     *
     * @throws InvalidDateException if the string is malformed or names an invalid date
     */
    public static CivilDate parseDate(final String text) {
        final var matcher = text == null ? null : DATE.matcher(text.trim());
        if (matcher == null || !matcher.matches()) {
            throw new InvalidDateException("Expected YYYY-MM-DD, got: " + text);
        }
        return of(Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)));
    }

    /**
     * Parses a {@code YYYY-MM-DD HH:MM:SS.S} timestamp string; the fractional part of the
     * seconds is optional.
     *
     * @throws InvalidDateException if the string is malformed or names an invalid instant
     */
    public static CivilDate parseTimestamp(final String text) {
        final var matcher = text == null ? null : TIMESTAMP.matcher(text.trim());
        if (matcher == null || !matcher.matches()) {
            throw new InvalidDateException("Expected YYYY-MM-DD HH:MM:SS.S, got: " + text);
        }
        return new CivilDate(Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)),
                Integer.parseInt(matcher.group(4)),
                Integer.parseInt(matcher.group(5)),
                Double.parseDouble(matcher.group(6)));
    }

    /** The same day at midnight UTC. */
    public CivilDate atMidnight() {
        return of(year, month, day);
    }

    public int dayOfYear() {
        return CalendarClock.daysSinceYearStart(year, month, day);
    }

    /** Hours elapsed since midnight, fractional. */
    public double hourOfDay() {
        return hour + minute / 60.0 + second / 3600.0;
    }

    public String formatDate() {
        return String.format(Locale.ROOT, "%04d-%02d-%02d", year, month, day);
    }

    @Override
    public int compareTo(final CivilDate other) {
        return CHRONOLOGICAL.compare(this, other);
    }

    /** {@code YYYY-MM-DD HH:MM:SS.S}, seconds truncated to tenths. */
    @Override
    public String toString() {
        // epsilon absorbs representation error in parsed tenths
        final var tenths = Math.min(599, (int) Math.floor(second * 10 + 1e-6));
        return String.format(Locale.ROOT, "%s %02d:%02d:%02d.%d", formatDate(), hour, minute, tenths / 10, tenths % 10);
    }
}
