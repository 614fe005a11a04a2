package my.blacklitterman.app.service;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BracketFinder;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;

import java.util.function.DoubleUnaryOperator;

/**
 * Derivative-free alternative: brackets a minimum downhill from the initial guess, then
 * runs Brent's method inside the bracket.
 */
public class BrentScalarMinimizer implements ScalarMinimizer {
	private static final double RELATIVE_TOLERANCE = 1e-10;
	private static final double ABSOLUTE_TOLERANCE = 1e-14;
	private static final double GROW_LIMIT = 100.0d;

	private final int maxEvaluations;

	public BrentScalarMinimizer(int maxEvaluations) {
		if (maxEvaluations < 1) {
			throw new IllegalArgumentException("Evaluation budget must be positive");
		}
		this.maxEvaluations = maxEvaluations;
	}

	@Override
	public double minimize(DoubleUnaryOperator objective, double initialGuess) {
		UnivariateFunction function = objective::applyAsDouble;
		double step = Math.max(1e-3, Math.abs(initialGuess) * 0.1d);
		BracketFinder bracket = new BracketFinder(GROW_LIMIT, maxEvaluations);
		bracket.search(function, GoalType.MINIMIZE, initialGuess, initialGuess + step);

		BrentOptimizer optimizer = new BrentOptimizer(RELATIVE_TOLERANCE, ABSOLUTE_TOLERANCE);
		UnivariatePointValuePair optimum = optimizer.optimize(
				new MaxEval(maxEvaluations),
				new UnivariateObjectiveFunction(function),
				GoalType.MINIMIZE,
				new SearchInterval(bracket.getLo(), bracket.getHi(), bracket.getMid()));
		return optimum.getPoint();
	}
}
