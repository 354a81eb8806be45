package io.github.jakubt4.sunline.astro;

import java.util.Locale;

/**
 * Conversions between proleptic Gregorian civil time and the continuous Julian date scale.
 *
 * <p>The scale is anchored at the first day of the Gregorian calendar:
 * 1582-10-15 12:00:00 UTC is JD 2299161.0, so its midnight is JD 2299160.5. Dates are
 * counted forward from there by whole years, leap days and the offset within the year,
 * which keeps every step exact integer arithmetic until the time of day is added.
 */
public final class CalendarClock {

    /** JD of 1582-10-15 12:00:00 UTC. */
    public static final double GREGORIAN_EPOCH_JD = 2299161.0;

    /** JD of 1582-10-15 00:00:00 UTC, the earliest instant accepted. */
    public static final double GREGORIAN_MIDNIGHT_JD = 2299160.5;

    public static final double SECONDS_PER_DAY = 86400.0;

    private static final int GREGORIAN_YEAR_ZERO = 1582;
    private static final double AVERAGE_GREGORIAN_YEAR = 365 + 1.0 / 4 - 3.0 / 400;
    private static final long TENTHS_PER_DAY = 864_000L;
    private static final int[] MONTH_LENGTHS = {31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};

    // 1582 began ten days later in the Julian calendar than in the Gregorian one
    private static final int EPOCH_DAY_OF_YEAR = 287;

    private CalendarClock() {} // Disallow instantiation

    public static boolean isLeapYear(final int year) {
        return year % 4 == 0 && (year % 100 != 0 || year % 400 == 0);
    }

    public static int yearLength(final int year) {
        return isLeapYear(year) ? 366 : 365;
    }

    /**
     * @throws InvalidDateException if {@code month} is not in 1-12
     */
    public static int monthLength(final int year, final int month) {
        if (month < 1 || month > 12) {
            throw new InvalidDateException("Month out of range: " + month);
        }
        return month == 2 && isLeapYear(year) ? 29 : MONTH_LENGTHS[month - 1];
    }

    /**
     * Number of days since January 1 of {@code year}: 0 for January 1, 364 or 365 for
     * December 31.
     *
     * @throws InvalidDateException if the month or day does not exist in that year
     */
    public static int daysSinceYearStart(final int year, final int month, final int day) {
        if (day < 1 || day > monthLength(year, month)) {
            throw new InvalidDateException(
                    String.format(Locale.ROOT, "Day out of range for %04d-%02d: %d", year, month, day));
        }
        var days = day - 1;
        for (var m = 1; m < month; m++) {
            days += monthLength(year, m);
        }
        return days;
    }

    /**
     * Inverse of {@link #daysSinceYearStart}.
     *
     * @return {@code {month, day}}
     * @throws InvalidDateException if {@code dayOfYear} is negative or past the end of the year
     */
    public static int[] inverse(final int year, final int dayOfYear) {
        if (dayOfYear < 0 || dayOfYear >= yearLength(year)) {
            throw new InvalidDateException(
                    String.format(Locale.ROOT, "Day of year out of range for %04d: %d", year, dayOfYear));
        }
        var remaining = dayOfYear;
        var month = 1;
        while (remaining >= monthLength(year, month)) {
            remaining -= monthLength(year, month);
            month++;
        }
        return new int[] {month, remaining + 1};
    }

    /**
     * Number of Gregorian leap years in the half-open range {@code [y1, y2)}: Julian leap
     * years (every fourth) minus centuries that are not divisible by 400.
     *
     * @throws IllegalArgumentException if {@code y1 > y2}
     */
    public static int leapDayCount(final int y1, final int y2) {
        if (y1 > y2) {
            throw new IllegalArgumentException("Expected y1 <= y2, got " + y1 + " > " + y2);
        }
        final var julianLeapYears = multiplesIn(y1, y2, 4);
        final var skippedCenturies = multiplesIn(y1, y2, 100) - multiplesIn(y1, y2, 400);
        return julianLeapYears - skippedCenturies;
    }

    // Multiples of k in [y1, y2)
    private static int multiplesIn(final int y1, final int y2, final int k) {
        return Math.floorDiv(y2 - 1, k) - Math.floorDiv(y1 - 1, k);
    }

    /**
     * Julian date of a civil instant. The instant's validity is guaranteed by {@link CivilDate}.
     */
    public static double toJulianDate(final CivilDate date) {
        final var year = date.year();
        final var fullYears = year - GREGORIAN_YEAR_ZERO;
        final var days = fullYears * 365L
                + leapDayCount(GREGORIAN_YEAR_ZERO, year)
                + daysSinceYearStart(year, date.month(), date.day())
                - EPOCH_DAY_OF_YEAR;
        final var secondsFromNoon = (date.hour() - 12) * 3600.0 + date.minute() * 60.0 + date.second();
        return GREGORIAN_EPOCH_JD + days + secondsFromNoon / SECONDS_PER_DAY;
    }

    /**
     * Civil instant of a Julian date, seconds kept fractional.
     *
     * @throws InvalidDateException if {@code jd} precedes 1582-10-15 00:00:00 UTC
     */
    public static CivilDate fromJulianDate(final double jd) {
        requireGregorian(jd);
        final var elapsed = jd - GREGORIAN_MIDNIGHT_JD;
        final var fractionOfDay = elapsed - Math.floor(elapsed);
        final var wholeDays = Math.round(elapsed - fractionOfDay);
        final var secondsOfDay = fractionOfDay * SECONDS_PER_DAY;

        final var hour = (int) (secondsOfDay / 3600);
        final var minute = (int) ((secondsOfDay - hour * 3600) / 60);
        final var second = secondsOfDay - hour * 3600 - minute * 60;
        return dayFromEpoch(wholeDays, hour, minute, Math.min(second, Math.nextDown(60.0)));
    }

    /**
     * Formats a Julian date as {@code YYYY-MM-DD HH:MM:SS.S}, rounded to the tenth of a second.
     *
     * @throws InvalidDateException if {@code jd} precedes 1582-10-15 00:00:00 UTC
     */
    public static String formatTimestamp(final double jd) {
        requireGregorian(jd);
        final var tenths = Math.round((jd - GREGORIAN_MIDNIGHT_JD) * TENTHS_PER_DAY);
        final var tenthsOfDay = (int) (tenths % TENTHS_PER_DAY);
        final var date = dayFromEpoch(tenths / TENTHS_PER_DAY, 0, 0, 0.0);

        final var hour = tenthsOfDay / 36_000;
        final var minute = tenthsOfDay % 36_000 / 600;
        final var tenthsOfMinute = tenthsOfDay % 600;
        return String.format(Locale.ROOT, "%s %02d:%02d:%02d.%d",
                date.formatDate(), hour, minute, tenthsOfMinute / 10, tenthsOfMinute % 10);
    }

    private static CivilDate dayFromEpoch(final long daysSinceEpoch, final int hour, final int minute,
                                          final double second) {
        final var daysSinceYearZero = daysSinceEpoch + EPOCH_DAY_OF_YEAR;

        // The average year length drifts from the true count by a fraction of a day, so the
        // estimate lands at most one year away near a year boundary.
        final var estimatedYears = (int) Math.floor(daysSinceYearZero / AVERAGE_GREGORIAN_YEAR);
        var year = GREGORIAN_YEAR_ZERO + estimatedYears;
        var dayOfYear = daysSinceYearZero - (estimatedYears * 365L + leapDayCount(GREGORIAN_YEAR_ZERO, year));

        if (dayOfYear >= yearLength(year)) {
            dayOfYear -= yearLength(year);
            year++;
        } else if (dayOfYear < 0) {
            year--;
            dayOfYear += yearLength(year);
        }

        final var monthDay = inverse(year, (int) dayOfYear);
        return new CivilDate(year, monthDay[0], monthDay[1], hour, minute, second);
    }

    private static void requireGregorian(final double jd) {
        if (!(jd >= GREGORIAN_MIDNIGHT_JD)) {
            throw new InvalidDateException(
                    "Julian date " + jd + " precedes the Gregorian calendar (JD " + GREGORIAN_MIDNIGHT_JD + ")");
        }
    }
}
