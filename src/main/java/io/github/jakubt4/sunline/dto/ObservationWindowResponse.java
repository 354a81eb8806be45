package io.github.jakubt4.sunline.dto;

import io.github.jakubt4.sunline.model.ObservationEvent;
import io.github.jakubt4.sunline.model.TwilightKind;

import java.util.List;

/**
 * Events matching a date-range search, in date order.
 */
public record ObservationWindowResponse(double heading, TwilightKind event, int count, List<ObservationEvent> events) {

    public static ObservationWindowResponse of(final double heading, final TwilightKind event,
                                               final List<ObservationEvent> events) {
        return new ObservationWindowResponse(heading, event, events.size(), events);
    }
}
