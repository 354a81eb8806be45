package io.github.jakubt4.sunline.numeric;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BracketedRootFinderTest {

    private final BracketedRootFinder rootFinder = new BracketedRootFinder();

    @Test
    void findsRootInsideBracket() {
        final var root = rootFinder.findRoot(Math::cos, 0, 3);

        assertThat(root).isPresent();
        assertThat(root.getAsDouble()).isCloseTo(Math.PI / 2, within(1e-9));
    }

    @Test
    void findsRootOfDecreasingFunction() {
        final var root = rootFinder.findRoot(x -> 2 - x * x, 0, 2);

        assertThat(root.getAsDouble()).isCloseTo(Math.sqrt(2), within(1e-9));
    }

    @Test
    void returnsEndpointWhenItIsTheRoot() {
        assertThat(rootFinder.findRoot(x -> x - 1, 1, 2)).hasValue(1.0);
        assertThat(rootFinder.findRoot(x -> x - 2, 1, 2)).hasValue(2.0);
    }

    @Test
    void returnsEmptyWithoutSignChange() {
        assertThat(rootFinder.findRoot(x -> x * x + 1, -1, 1)).isEmpty();
        assertThat(rootFinder.findRoot(x -> -5.0, 0, 10)).isEmpty();
    }

    @Test
    void rejectsEmptyBracket() {
        assertThatThrownBy(() -> rootFinder.findRoot(Math::sin, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> rootFinder.findRoot(Math::sin, 2, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sharedFinderSolvesConcurrentCallsIndependently() throws Exception {
        final var executor = Executors.newFixedThreadPool(8);
        try {
            final var futures = new ArrayList<Future<Double>>();
            for (var i = 0; i < 4000; i++) {
                final var root = (i + 0.5) / 4000;
                futures.add(executor.submit(() -> rootFinder.findRoot(x -> x - root, 0, 1).getAsDouble() - root));
            }
            for (final var future : futures) {
                assertThat(future.get()).isCloseTo(0.0, within(1e-8));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new BracketedRootFinder(0, 100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BracketedRootFinder(1e-9, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
