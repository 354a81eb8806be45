package io.github.jakubt4.sunline.cli;

import io.github.jakubt4.sunline.astro.CivilDate;
import io.github.jakubt4.sunline.astro.InvalidDateException;
import io.github.jakubt4.sunline.astro.SubsolarReference;
import io.github.jakubt4.sunline.config.SunlineProperties;
import io.github.jakubt4.sunline.model.ObservationEvent;
import io.github.jakubt4.sunline.model.ObservationWindowQuery;
import io.github.jakubt4.sunline.model.TwilightKind;
import io.github.jakubt4.sunline.service.ObservationWindowService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ObservationWindowRunnerTest {

    private final ObservationWindowService observationWindowService = mock(ObservationWindowService.class);
    private final SunlineProperties properties = new SunlineProperties(
            new SunlineProperties.Model("2020-03-20 03:49:00.0", "2020-03-20 12:07:00.0", SubsolarReference.SOLAR_NOON, 23.4392811),
            new SunlineProperties.Search(100, 0.5, 4),
            new SunlineProperties.Cli(true));
    private final ObservationWindowRunner runner = new ObservationWindowRunner(observationWindowService, properties);

    @Test
    void parsesRequiredOptionsAndFallsBackToDefaults() {
        final var query = runner.parse(new DefaultApplicationArguments(
                "--heading=289", "--begin=2025-01-01", "--end=2025-12-31",
                "--latitude=32.8595", "--longitude=-117.2124"));

        assertThat(query.heading()).isEqualTo(289.0);
        assertThat(query.beginDate()).isEqualTo(CivilDate.of(2025, 1, 1));
        assertThat(query.endDate()).isEqualTo(CivilDate.of(2025, 12, 31));
        assertThat(query.latitude()).isEqualTo(32.8595);
        assertThat(query.longitude()).isEqualTo(-117.2124);
        assertThat(query.kind()).isEqualTo(TwilightKind.SUNSET);
        assertThat(query.tolerance()).isEqualTo(0.5);
        assertThat(query.sampleCount()).isEqualTo(100);
    }

    @Test
    void parsesOptionalOverrides() {
        final var query = runner.parse(new DefaultApplicationArguments(
                "--heading=90", "--begin=2025-03-01", "--end=2025-03-31", "--latitude=0", "--longitude=0",
                "--event=sunrise", "--tolerance=1.5", "--samples=30"));

        assertThat(query.kind()).isEqualTo(TwilightKind.SUNRISE);
        assertThat(query.tolerance()).isEqualTo(1.5);
        assertThat(query.sampleCount()).isEqualTo(30);
    }

    @Test
    void rejectsMissingOption() {
        assertThatThrownBy(() -> runner.parse(new DefaultApplicationArguments(
                "--heading=90", "--begin=2025-03-01", "--latitude=0", "--longitude=0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing required option --end");
    }

    @Test
    void rejectsMalformedDate() {
        assertThatThrownBy(() -> runner.parse(new DefaultApplicationArguments(
                "--heading=90", "--begin=2025-02-30", "--end=2025-03-01", "--latitude=0", "--longitude=0")))
                .isInstanceOf(InvalidDateException.class);
    }

    @Test
    void runSearchesWithParsedQuery() throws Exception {
        when(observationWindowService.findWindow(any())).thenReturn(List.of());

        runner.run(new DefaultApplicationArguments(
                "--heading=289", "--begin=2025-05-01", "--end=2025-05-03",
                "--latitude=32.8595", "--longitude=-117.2124", "--samples=30"));

        final var captor = ArgumentCaptor.forClass(ObservationWindowQuery.class);
        verify(observationWindowService).findWindow(captor.capture());
        assertThat(captor.getValue().sampleCount()).isEqualTo(30);
    }

    @Test
    void printsOneLinePerEvent() {
        final var buffer = new ByteArrayOutputStream();
        final var out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        ObservationWindowRunner.print(List.of(
                new ObservationEvent("2025-05-01 18:27:19.1", "UTC-8", 0.0, 288.597),
                new ObservationEvent("2025-05-02 18:28:02.9", "UTC-8", 0.0, 288.956)), out);

        assertThat(buffer.toString(StandardCharsets.UTF_8).lines()).containsExactly(
                "2025-05-01 18:27:19.1 UTC-8; Alt. = 0.000, Azi. = 288.6",
                "2025-05-02 18:28:02.9 UTC-8; Alt. = 0.000, Azi. = 289.0");
    }
}
