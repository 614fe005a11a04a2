package my.blacklitterman.app.service;

import my.blacklitterman.app.domain.LabeledMatrix;
import my.blacklitterman.app.domain.LabeledVector;
import my.blacklitterman.app.domain.View;
import my.blacklitterman.app.service.exception.CalibrationNonConvergenceException;
import org.apache.commons.math3.exception.MathIllegalStateException;

import java.util.List;

/**
 * Converts a view's confidence into the variance used on the Omega diagonal.
 * <p>
 * The view is isolated: only its own row of the view matrix and its own out-performance
 * are used. The calibrated variance is the one for which the solver's weights match
 * {@code market + confidence * (fullConfidence - market)}, where {@code fullConfidence}
 * are the weights with a zero variance. The search runs over the view's standard
 * deviation, so the variance it yields is never negative.
 */
public class ConfidenceCalibrator {
	public static final double DEFAULT_INITIAL_VARIANCE = 0.1d;

	private final WeightSolver weightSolver;
	private final ScalarMinimizer minimizer;
	private final double initialVariance;

	public ConfidenceCalibrator(WeightSolver weightSolver, ScalarMinimizer minimizer) {
		this(weightSolver, minimizer, DEFAULT_INITIAL_VARIANCE);
	}

	public ConfidenceCalibrator(WeightSolver weightSolver, ScalarMinimizer minimizer, double initialVariance) {
		if (weightSolver == null || minimizer == null) {
			throw new IllegalArgumentException("Weight solver and minimizer are required");
		}
		if (!(initialVariance > 0.0d) || !Double.isFinite(initialVariance)) {
			throw new IllegalArgumentException("Initial variance must be a positive number");
		}
		this.weightSolver = weightSolver;
		this.minimizer = minimizer;
		this.initialVariance = initialVariance;
	}

	/**
	 * Variance for {@code view}; {@code +Infinity} when the confidence is zero.
	 */
	public double calibrate(View view,
							List<String> assetUniverse,
							LabeledVector marketWeights,
							LabeledMatrix marketCovariance,
							double tau,
							double riskAversion) {
		if (view.confidence() == 0.0d) {
			return Double.POSITIVE_INFINITY;
		}
		LabeledMatrix viewMatrix = view.getViewDataFrame(assetUniverse);
		LabeledVector outPerformance = new LabeledVector(List.of(view.id()), new double[]{view.outPerformance()});
		LabeledVector target = targetWeights(view, marketWeights, marketCovariance, viewMatrix, outPerformance, tau, riskAversion);

		double deviation;
		try {
			deviation = minimizer.minimize(sigma -> {
				LabeledMatrix viewCovariance = singleVariance(view.id(), sigma * sigma);
				LabeledVector weights = weightSolver.solve(marketWeights, marketCovariance, viewMatrix, viewCovariance,
						outPerformance, tau, riskAversion);
				return weights.subtract(target).sumOfSquares();
			}, Math.sqrt(initialVariance));
		} catch (MathIllegalStateException ex) {
			throw new CalibrationNonConvergenceException(view.id(), ex.getMessage(), null, ex);
		}
		double variance = deviation * deviation;
		if (!Double.isFinite(variance)) {
			throw new CalibrationNonConvergenceException(view.id(), "search returned a non-finite variance", variance, null);
		}
		return variance;
	}

	LabeledVector targetWeights(View view,
								LabeledVector marketWeights,
								LabeledMatrix marketCovariance,
								LabeledMatrix viewMatrix,
								LabeledVector outPerformance,
								double tau,
								double riskAversion) {
		LabeledVector fullConfidence = weightSolver.solve(marketWeights, marketCovariance, viewMatrix,
				singleVariance(view.id(), 0.0d), outPerformance, tau, riskAversion);
		LabeledVector maxDifference = fullConfidence.subtract(marketWeights);
		return marketWeights.add(maxDifference.scale(view.confidence()));
	}

	private static LabeledMatrix singleVariance(String viewId, double variance) {
		return LabeledMatrix.diagonal(List.of(viewId), new double[]{variance});
	}
}
