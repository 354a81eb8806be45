package io.github.jakubt4.sunline.cli;

import io.github.jakubt4.sunline.astro.CivilDate;
import io.github.jakubt4.sunline.config.SunlineProperties;
import io.github.jakubt4.sunline.model.ObservationEvent;
import io.github.jakubt4.sunline.model.ObservationWindowQuery;
import io.github.jakubt4.sunline.model.TwilightKind;
import io.github.jakubt4.sunline.service.ObservationWindowService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Prints the observation window for a heading, date range and location given as
 * command-line options, one event per line:
 *
 * <pre>
 *   --sunline.cli.enabled=true --heading=289 --begin=2025-01-01 --end=2025-12-31
 *   --latitude=32.8595 --longitude=-117.2124 [--event=SUNRISE] [--tolerance=0.5] [--samples=30]
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "sunline.cli", name = "enabled", havingValue = "true")
public class ObservationWindowRunner implements ApplicationRunner {

    private final ObservationWindowService observationWindowService;
    private final SunlineProperties properties;

    @Override
    public void run(final ApplicationArguments args) {
        final var query = parse(args);
        final var window = observationWindowService.findWindow(query);
        log.info("Observation window for heading {}: {} events", query.heading(), window.size());
        print(window, System.out);
    }

    ObservationWindowQuery parse(final ApplicationArguments args) {
        final var defaults = properties.search();
        final var event = optional(args, "event");
        final var tolerance = optional(args, "tolerance");
        final var samples = optional(args, "samples");

        return new ObservationWindowQuery(
                Double.parseDouble(required(args, "heading")),
                CivilDate.parseDate(required(args, "begin")),
                CivilDate.parseDate(required(args, "end")),
                Double.parseDouble(required(args, "latitude")),
                Double.parseDouble(required(args, "longitude")),
                event == null ? TwilightKind.SUNSET : TwilightKind.valueOf(event.toUpperCase(Locale.ROOT)),
                tolerance == null ? defaults.tolerance() : Double.parseDouble(tolerance),
                samples == null ? defaults.sampleCount() : Integer.parseInt(samples));
    }

    static void print(final List<ObservationEvent> window, final PrintStream out) {
        window.forEach(event -> out.println(event.toDisplayString()));
    }

    private static String required(final ApplicationArguments args, final String name) {
        final var value = optional(args, name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required option --" + name);
        }
        return value;
    }

    private static String optional(final ApplicationArguments args, final String name) {
        final var values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
