package io.github.jakubt4.sunline.config;

import io.github.jakubt4.sunline.astro.SubsolarReference;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Application settings under the {@code sunline} prefix.
 *
 * @param model  reference quantities of the Earth orientation model
 * @param search defaults and worker pool for the twilight searches
 * @param cli    command-line runner switch
 */
@ConfigurationProperties(prefix = "sunline")
public record SunlineProperties(@DefaultValue Model model,
                                @DefaultValue Search search,
                                @DefaultValue Cli cli) {

    /**
     * @param equinox           reference March equinox, UTC timestamp
     * @param solarNoon         solar noon at longitude 0 following {@code equinox}, UTC timestamp
     * @param subsolarReference how the subsolar longitude at the equinox is derived
     * @param axialTilt         axial tilt [deg]
     */
    public record Model(@DefaultValue("2020-03-20 03:49:00.0") String equinox,
                        @DefaultValue("2020-03-20 12:07:00.0") String solarNoon,
                        @DefaultValue("SOLAR_NOON") SubsolarReference subsolarReference,
                        @DefaultValue("23.4392811") double axialTilt) {
    }

    /**
     * @param sampleCount default number of samples per 12 hour window
     * @param tolerance   default heading tolerance [deg]
     * @param parallelism worker threads for date-range scans
     */
    public record Search(@DefaultValue("100") int sampleCount,
                         @DefaultValue("0.5") double tolerance,
                         @DefaultValue("4") int parallelism) {
    }

    public record Cli(@DefaultValue("false") boolean enabled) {
    }
}
