package my.blacklitterman.app.service;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.differentiation.DerivativeStructure;
import org.apache.commons.math3.analysis.differentiation.FiniteDifferencesDifferentiator;
import org.apache.commons.math3.analysis.differentiation.UnivariateDifferentiableFunction;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunctionGradient;
import org.apache.commons.math3.optim.nonlinear.scalar.gradient.NonLinearConjugateGradientOptimizer;

import java.util.function.DoubleUnaryOperator;

/**
 * Derivative-based local search: non-linear conjugate gradient with an exact line search,
 * the gradient taken by finite differences. In one dimension every iteration restarts on
 * the steepest-descent direction.
 */
public class GradientScalarMinimizer implements ScalarMinimizer {
	private static final double VALUE_RELATIVE_TOLERANCE = 1e-12;
	private static final double VALUE_ABSOLUTE_TOLERANCE = 1e-16;
	private static final int DIFFERENTIATION_POINTS = 5;
	private static final double DIFFERENTIATION_STEP = 1e-6;

	private final int maxIterations;
	private final int maxEvaluations;

	public GradientScalarMinimizer(int maxIterations, int maxEvaluations) {
		if (maxIterations < 1 || maxEvaluations < 1) {
			throw new IllegalArgumentException("Iteration and evaluation budgets must be positive");
		}
		this.maxIterations = maxIterations;
		this.maxEvaluations = maxEvaluations;
	}

	@Override
	public double minimize(DoubleUnaryOperator objective, double initialGuess) {
		UnivariateFunction function = objective::applyAsDouble;
		UnivariateDifferentiableFunction differentiable =
				new FiniteDifferencesDifferentiator(DIFFERENTIATION_POINTS, DIFFERENTIATION_STEP).differentiate(function);

		NonLinearConjugateGradientOptimizer optimizer = new NonLinearConjugateGradientOptimizer(
				NonLinearConjugateGradientOptimizer.Formula.FLETCHER_REEVES,
				new SimpleValueChecker(VALUE_RELATIVE_TOLERANCE, VALUE_ABSOLUTE_TOLERANCE));
		PointValuePair optimum = optimizer.optimize(
				new MaxEval(maxEvaluations),
				new MaxIter(maxIterations),
				new ObjectiveFunction(point -> function.value(point[0])),
				new ObjectiveFunctionGradient(point -> new double[]{
						differentiable.value(new DerivativeStructure(1, 1, 0, point[0])).getPartialDerivative(1)
				}),
				GoalType.MINIMIZE,
				new InitialGuess(new double[]{initialGuess}));
		return optimum.getPoint()[0];
	}
}
