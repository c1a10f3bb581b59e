package udem.communities.model;

import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import udem.communities.errors.OptimizationException;

import java.util.function.DoubleUnaryOperator;

/**
 * Brent's method from Commons Math.
 */
public class BrentScalarMinimizer implements ScalarMinimizer {
    private static final Logger log = LoggerFactory.getLogger(BrentScalarMinimizer.class);

    private final double relativeTolerance;
    private final double absoluteTolerance;
    private final int maxEvaluations;

    public BrentScalarMinimizer() {
        this(1e-10, 1e-14, 500);
    }

    public BrentScalarMinimizer(double relativeTolerance, double absoluteTolerance, int maxEvaluations) {
        this.relativeTolerance = relativeTolerance;
        this.absoluteTolerance = absoluteTolerance;
        this.maxEvaluations = maxEvaluations;
    }

    @Override
    public double minimize(DoubleUnaryOperator objective, double lowerBound, double upperBound) {
        if (!(lowerBound < upperBound)) {
            throw new IllegalArgumentException("empty interval [" + lowerBound + ", " + upperBound + "]");
        }
        var optimizer = new BrentOptimizer(relativeTolerance, absoluteTolerance);
        try {
            UnivariatePointValuePair p = optimizer.optimize(
                    new MaxEval(maxEvaluations),
                    new UnivariateObjectiveFunction(objective::applyAsDouble),
                    GoalType.MINIMIZE,
                    new SearchInterval(lowerBound, upperBound));
            log.debug("brent: {} evaluations, f({}) = {}", optimizer.getEvaluations(), p.getPoint(), p.getValue());
            return p.getPoint();
        } catch (TooManyEvaluationsException e) {
            throw new OptimizationException("no minimum within " + maxEvaluations + " evaluations", Double.NaN, e);
        }
    }
}
