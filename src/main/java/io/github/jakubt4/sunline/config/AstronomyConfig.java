package io.github.jakubt4.sunline.config;

import io.github.jakubt4.sunline.astro.AstronomicalModel;
import io.github.jakubt4.sunline.astro.CivilDate;
import io.github.jakubt4.sunline.astro.EarthOrientationParameters;
import io.github.jakubt4.sunline.astro.OrbitalElements;
import io.github.jakubt4.sunline.astro.SolarPositionResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the immutable {@link AstronomicalModel} once at startup and the worker pool used by
 * date-range scans.
 *
 * <p>The equinox instant is resolved first, the subsolar longitude from it, and only then the
 * orbital and orientation models; every bean that answers position queries depends on the
 * model bean, so no query can run against a half-built model.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SunlineProperties.class)
public class AstronomyConfig {

    @Bean
    AstronomicalModel astronomicalModel(final SunlineProperties properties) {
        final var settings = properties.model();
        final var equinox = CivilDate.parseTimestamp(settings.equinox());

        final var orientation = switch (settings.subsolarReference()) {
            case SOLAR_NOON -> EarthOrientationParameters.fromSolarNoon(settings.axialTilt(), equinox,
                    CivilDate.parseTimestamp(settings.solarNoon()), EarthOrientationParameters.EARTH_SIDEREAL_DAY);
            case EQUATION_OF_TIME -> EarthOrientationParameters.fromEquationOfTime(settings.axialTilt(), equinox,
                    EarthOrientationParameters.EARTH_SIDEREAL_DAY);
        };
        final var model = AstronomicalModel.create(OrbitalElements.EARTH_J2000, orientation);

        log.info("Astronomical model initialized: equinox JD {}, subsolar longitude {} deg ({}), axis {}",
                orientation.equinoxJd(),
                String.format("%.4f", orientation.subsolarLongitudeAtEquinox()),
                settings.subsolarReference(),
                model.earthOrientation().rotationAxis());
        return model;
    }

    @Bean
    SolarPositionResolver solarPositionResolver(final AstronomicalModel astronomicalModel) {
        return new SolarPositionResolver(astronomicalModel);
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService twilightSearchExecutor(final SunlineProperties properties) {
        final var parallelism = properties.search().parallelism();
        if (parallelism < 1) {
            throw new IllegalStateException("sunline.search.parallelism must be at least 1, got " + parallelism);
        }
        final var counter = new AtomicInteger();
        log.info("Twilight search pool initialized: {} workers", parallelism);
        return Executors.newFixedThreadPool(parallelism, task -> {
            final var thread = new Thread(task, "twilight-search-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
