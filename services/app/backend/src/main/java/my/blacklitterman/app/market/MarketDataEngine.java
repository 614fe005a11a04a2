package my.blacklitterman.app.market;

import my.blacklitterman.app.domain.LabeledMatrix;
import my.blacklitterman.app.domain.LabeledVector;

import java.time.LocalDate;

/**
 * Market data for a fixed analysis window. Implementations own retrieval, caching and
 * retries; callers treat every method as a potentially slow external call.
 */
public interface MarketDataEngine {
	/**
	 * Market-capitalisation implied equilibrium weights as of {@code endDate}, labeled by asset id.
	 */
	LabeledVector getMarketWeights(LocalDate endDate);

	/**
	 * Annualised asset covariance over {@code [startDate, endDate]}, rows and columns labeled by asset id.
	 */
	LabeledMatrix getAnnualisedCovMatrix(LocalDate startDate, LocalDate endDate);

	LabeledVector getImpliedReturns(LocalDate startDate, LocalDate endDate, double riskAversion);
}
