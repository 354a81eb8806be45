package io.github.jakubt4.sunline.timezone;

/**
 * @param hours offset from UTC [h]
 * @param label display label, e.g. {@code UTC-8}
 */
public record UtcOffset(int hours, String label) {
}
