package my.blacklitterman.app.service;

import my.blacklitterman.app.domain.LabeledMatrix;
import my.blacklitterman.app.domain.LabeledVector;
import my.blacklitterman.app.service.exception.DimensionMismatchException;
import my.blacklitterman.app.service.exception.SingularPrecisionMatrixException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

import java.util.ArrayList;
import java.util.List;

/**
 * Closed-form Black-Litterman posterior weights:
 * <pre>
 * M          = Omega / tau + P Sigma P'
 * adjustment = Q / delta - P Sigma w
 * posterior  = w + P' M^-1 adjustment
 * </pre>
 * Inputs are aligned by label, never by position. A view whose Omega diagonal entry is
 * {@code +Infinity} carries no information and is left out of the blend, which is the
 * limit of the formula as that variance grows without bound.
 */
public class BlackLittermanWeightSolver implements WeightSolver {
	/** LU pivots below this fraction of the norm of M count as zero. */
	static final double RELATIVE_SINGULARITY_THRESHOLD = 1e-11;

	@Override
	public LabeledVector solve(LabeledVector marketWeights,
							   LabeledMatrix marketCovariance,
							   LabeledMatrix viewMatrix,
							   LabeledMatrix viewCovariance,
							   LabeledVector viewOutPerformance,
							   double tau,
							   double riskAversion) {
		if (!(tau > 0.0d) || !Double.isFinite(tau)) {
			throw new IllegalArgumentException("tau must be a positive number");
		}
		if (!(riskAversion > 0.0d) || !Double.isFinite(riskAversion)) {
			throw new IllegalArgumentException("riskAversion must be a positive number");
		}
		List<String> assets = marketWeights.labels();
		if (assets.isEmpty()) {
			throw new IllegalArgumentException("Market weights are empty");
		}
		requireFinite("Market weights", marketWeights.toArray());
		LabeledMatrix sigma = marketCovariance.alignTo(assets, assets);
		for (double[] row : sigma.toArray()) {
			requireFinite("Market covariance", row);
		}
		if (!sameLabels(viewMatrix.columnLabels(), assets)) {
			throw new DimensionMismatchException("View matrix columns do not match the market assets",
					assets, viewMatrix.columnLabels());
		}
		List<String> viewIds = viewMatrix.rowLabels();
		LabeledMatrix omega = viewCovariance.alignTo(viewIds, viewIds);
		LabeledVector q = viewOutPerformance.alignTo(viewIds);

		List<String> informative = informativeViews(omega);
		if (informative.isEmpty()) {
			return new LabeledVector(marketWeights.name(), assets, marketWeights.toArray());
		}

		RealMatrix p = viewMatrix.select(informative, assets).toRealMatrix();
		RealMatrix omegaMatrix = omega.select(informative, informative).toRealMatrix();
		RealVector qVector = selectEntries(q, informative);
		RealMatrix sigmaMatrix = sigma.toRealMatrix();
		RealVector w = marketWeights.toRealVector();

		RealMatrix pSigma = p.multiply(sigmaMatrix);
		RealMatrix precision = omegaMatrix.scalarMultiply(1.0d / tau).add(pSigma.multiply(p.transpose()));
		RealVector adjustment = qVector.mapDivide(riskAversion).subtract(pSigma.operate(w));

		DecompositionSolver decomposition = new LUDecomposition(precision, singularityThreshold(precision)).getSolver();
		if (!decomposition.isNonSingular()) {
			throw new SingularPrecisionMatrixException(informative, null);
		}
		RealVector blended;
		try {
			blended = decomposition.solve(adjustment);
		} catch (SingularMatrixException ex) {
			throw new SingularPrecisionMatrixException(informative, ex);
		}
		RealVector posterior = w.add(p.transpose().operate(blended));
		return LabeledVector.of(assets, posterior).withName(marketWeights.name());
	}

	static double singularityThreshold(RealMatrix precision) {
		return Math.max(precision.getNorm() * RELATIVE_SINGULARITY_THRESHOLD, Double.MIN_NORMAL);
	}

	private List<String> informativeViews(LabeledMatrix omega) {
		List<String> ids = omega.rowLabels();
		List<String> informative = new ArrayList<>(ids.size());
		for (int i = 0; i < ids.size(); i++) {
			for (int j = 0; j < ids.size(); j++) {
				double value = omega.get(i, j);
				if (Double.isNaN(value) || value == Double.NEGATIVE_INFINITY || (i != j && Double.isInfinite(value))) {
					throw new IllegalArgumentException("View covariance entry (" + ids.get(i) + ", " + ids.get(j)
							+ ") is not a valid variance: " + value);
				}
			}
			if (omega.get(i, i) != Double.POSITIVE_INFINITY) {
				informative.add(ids.get(i));
			}
		}
		return informative;
	}

	private static RealVector selectEntries(LabeledVector vector, List<String> labels) {
		double[] values = new double[labels.size()];
		for (int i = 0; i < labels.size(); i++) {
			values[i] = vector.get(labels.get(i));
		}
		return new ArrayRealVector(values, false);
	}

	private static boolean sameLabels(List<String> left, List<String> right) {
		return left.size() == right.size() && left.containsAll(right);
	}

	private static void requireFinite(String what, double[] values) {
		for (double value : values) {
			if (!Double.isFinite(value)) {
				throw new IllegalArgumentException(what + " contain non-finite entries");
			}
		}
	}
}
