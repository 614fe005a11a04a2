package my.blacklitterman.app.service;

import my.blacklitterman.app.domain.LabeledMatrix;
import my.blacklitterman.app.domain.LabeledVector;

/**
 * Blends equilibrium weights with views. Implementations must be pure and reentrant:
 * calibration workers call them concurrently.
 */
@FunctionalInterface
public interface WeightSolver {
	LabeledVector solve(LabeledVector marketWeights,
						LabeledMatrix marketCovariance,
						LabeledMatrix viewMatrix,
						LabeledMatrix viewCovariance,
						LabeledVector viewOutPerformance,
						double tau,
						double riskAversion);
}
