package io.github.jakubt4.sunline.timezone;

/**
 * Supplies the UTC offset used to present results in local time. The astronomical model
 * itself works in UTC throughout.
 */
public interface TimeZoneResolver {

    UtcOffset resolve(double longitude);
}
