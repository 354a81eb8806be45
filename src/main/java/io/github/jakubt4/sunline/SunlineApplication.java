package io.github.jakubt4.sunline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Sunline: apparent solar position and sunrise/sunset heading search.
 *
 * <p>Models the Earth's orbit (Kepler's equation) and rotation (tilted axis, sidereal rate)
 * to compute the Sun's altitude and azimuth for any place and time, then searches day by day
 * for the sunrises or sunsets that line up with a chosen compass heading.
 *
 * @see io.github.jakubt4.sunline.astro.SolarPositionResolver
 * @see io.github.jakubt4.sunline.service.ObservationWindowService
 */
@SpringBootApplication
public class SunlineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SunlineApplication.class, args);
    }
}
