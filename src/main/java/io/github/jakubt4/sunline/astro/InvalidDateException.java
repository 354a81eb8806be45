package io.github.jakubt4.sunline.astro;

/**
 * Raised when a civil date or Julian date falls outside the proleptic Gregorian range
 * supported by {@link CalendarClock}, or when a month/day does not exist in the given year.
 */
public class InvalidDateException extends RuntimeException {

    public InvalidDateException(final String message) {
        super(message);
    }
}
