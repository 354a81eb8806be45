package io.github.jakubt4.sunline.dto;

/**
 * Body returned for failed requests.
 *
 * @param status  {@code "REJECTED"} for invalid input, {@code "NO_CROSSING"} when the Sun does
 *                not rise or set on the requested day
 * @param message human-readable detail
 */
public record ErrorResponse(String status, String message) {

    public static final String REJECTED = "REJECTED";
    public static final String NO_CROSSING = "NO_CROSSING";
}
