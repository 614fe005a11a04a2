package my.blacklitterman.app.service;

import java.util.function.DoubleUnaryOperator;

/**
 * Local one-dimensional minimisation strategy used by the confidence calibration.
 * Implementations are stateless between calls and safe to share across threads.
 */
@FunctionalInterface
public interface ScalarMinimizer {
	/**
	 * Returns the argument of a local minimum of {@code objective} reached from
	 * {@code initialGuess}.
	 *
	 * @throws org.apache.commons.math3.exception.MathIllegalStateException when the search
	 *         exhausts its iteration or evaluation budget
	 */
	double minimize(DoubleUnaryOperator objective, double initialGuess);
}
