package io.github.jakubt4.sunline.numeric;

import org.hipparchus.analysis.UnivariateFunction;
import org.hipparchus.analysis.solvers.BrentSolver;

import java.util.OptionalDouble;

/**
 * Brent root finder over a bracket. A bracket without a sign change yields no root rather
 * than an exception, since callers treat that as an expected outcome.
 *
 * <p>Thread-safe. Hipparchus solvers hold per-solve state, so each call uses its own solver.
 */
public final class BracketedRootFinder {

    public static final double DEFAULT_ABSOLUTE_ACCURACY = 1e-9;
    public static final int DEFAULT_MAX_EVALUATIONS = 200;

    private final double absoluteAccuracy;
    private final int maxEvaluations;

    public BracketedRootFinder(final double absoluteAccuracy, final int maxEvaluations) {
        if (!(absoluteAccuracy > 0) || maxEvaluations < 1) {
            throw new IllegalArgumentException("Accuracy and evaluation budget must be positive");
        }
        this.absoluteAccuracy = absoluteAccuracy;
        this.maxEvaluations = maxEvaluations;
    }

    public BracketedRootFinder() {
        this(DEFAULT_ABSOLUTE_ACCURACY, DEFAULT_MAX_EVALUATIONS);
    }

    /**
     * @return a root of {@code f} in {@code [lower, upper]}, or empty if {@code f} has the
     *         same strict sign at both ends
     * @throws org.hipparchus.exception.MathIllegalStateException if the evaluation budget is
     *         exhausted
     */
    public OptionalDouble findRoot(final UnivariateFunction f, final double lower, final double upper) {
        if (!(lower < upper)) {
            throw new IllegalArgumentException("Empty bracket [" + lower + ", " + upper + "]");
        }
        final var atLower = f.value(lower);
        final var atUpper = f.value(upper);
        if (atLower == 0) {
            return OptionalDouble.of(lower);
        }
        if (atUpper == 0) {
            return OptionalDouble.of(upper);
        }
        if (Math.signum(atLower) == Math.signum(atUpper)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(new BrentSolver(absoluteAccuracy).solve(maxEvaluations, f, lower, upper));
    }
}
