package udem.communities.model;

import java.util.function.DoubleUnaryOperator;

/**
 * Derivative-free minimization of a scalar function over a closed interval.
 * Implementations throw {@link udem.communities.errors.OptimizationException} when they give up.
 */
@FunctionalInterface
public interface ScalarMinimizer {

    double minimize(DoubleUnaryOperator objective, double lowerBound, double upperBound);
}
