package my.blacklitterman.app.service;

import my.blacklitterman.app.domain.LabeledMatrix;
import my.blacklitterman.app.domain.LabeledVector;
import my.blacklitterman.app.domain.View;
import my.blacklitterman.app.domain.ViewCollection;
import my.blacklitterman.app.market.MarketDataEngine;
import my.blacklitterman.app.market.MarketDataReader;
import my.blacklitterman.app.settings.CalculationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Session-scoped Black-Litterman calculation. Holds the settings and the market data for
 * the configured window; every weight request fetches market data and recalibrates the
 * view variances from scratch.
 */
public class BlackLittermanEngine {
	public static final String MARKET_WEIGHTS = "market";
	public static final String BLACK_LITTERMAN_WEIGHTS = "black_litterman";

	private static final Logger logger = LoggerFactory.getLogger(BlackLittermanEngine.class);

	private final MarketDataEngine marketDataEngine;
	private final CalculationSettings settings;
	private final WeightSolver weightSolver;
	private final ConfidenceCalibrator calibrator;
	private final int parallelism;

	public BlackLittermanEngine(MarketDataReader dataReader, CalculationSettings settings) {
		this(dataReader, settings, new BlackLittermanWeightSolver(), null, 1);
	}

	public BlackLittermanEngine(MarketDataReader dataReader,
								CalculationSettings settings,
								WeightSolver weightSolver,
								ConfidenceCalibrator calibrator,
								int parallelism) {
		Objects.requireNonNull(dataReader, "dataReader");
		this.settings = Objects.requireNonNull(settings, "settings");
		this.weightSolver = Objects.requireNonNull(weightSolver, "weightSolver");
		this.calibrator = calibrator != null
				? calibrator
				: new ConfidenceCalibrator(weightSolver, new GradientScalarMinimizer(100, 10_000));
		this.parallelism = Math.max(1, parallelism);
		this.marketDataEngine = Objects.requireNonNull(
				dataReader.getMarketDataEngine(settings.startDate(), settings.calculationDate()),
				"marketDataEngine");
	}

	public LabeledVector getMarketWeights() {
		return getMarketWeights(null);
	}

	public LabeledVector getMarketWeights(LocalDate endDate) {
		LocalDate resolved = endDate == null ? settings.calculationDate() : endDate;
		return marketDataEngine.getMarketWeights(resolved).withName(MARKET_WEIGHTS);
	}

	public LabeledVector getMarketReturns(LocalDate startDate, LocalDate endDate) {
		return marketDataEngine.getImpliedReturns(startDate, endDate, settings.riskAversion());
	}

	public List<String> getAssetUniverse() {
		return settings.assetIds();
	}

	public DateRange getDates() {
		return new DateRange(settings.startDate(), settings.calculationDate());
	}

	public CalculationSettings getSettings() {
		return settings;
	}

	public LabeledVector getBlackLittermanWeights(ViewCollection views, LocalDate startDate, LocalDate endDate) {
		Objects.requireNonNull(views, "views");
		LabeledVector marketWeights = marketDataEngine.getMarketWeights(endDate);
		LabeledMatrix marketCovariance = marketDataEngine.getAnnualisedCovMatrix(startDate, endDate);

		List<String> universe = getAssetUniverse();
		LabeledMatrix viewMatrix = views.getViewMatrix(universe);
		LabeledVector outPerformance = views.getViewOutPerformances();
		LabeledMatrix viewCovariance = getViewCovariancesFromConfidences(marketWeights, marketCovariance, views);

		LabeledVector weights = weightSolver.solve(marketWeights, marketCovariance, viewMatrix, viewCovariance,
				outPerformance, settings.tau(), settings.riskAversion());
		logger.debug("Blended {} views into Black-Litterman weights ({} to {}).", views.size(), startDate, endDate);
		return weights.withName(BLACK_LITTERMAN_WEIGHTS);
	}

	/**
	 * Diagonal Omega, one calibrated variance per view, rows and columns in collection order.
	 */
	public LabeledMatrix getViewCovariancesFromConfidences(LabeledVector marketWeights,
														   LabeledMatrix marketCovariance,
														   ViewCollection views) {
		List<View> all = views.getAllViews();
		List<String> universe = getAssetUniverse();
		double[] variances = new double[all.size()];
		if (all.size() <= 1 || parallelism <= 1) {
			for (int i = 0; i < all.size(); i++) {
				variances[i] = calibrate(all.get(i), universe, marketWeights, marketCovariance);
			}
			return LabeledMatrix.diagonal(views.getViewIds(), variances);
		}

		ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, all.size()));
		List<Future<Double>> futures = new ArrayList<>();
		try {
			for (View view : all) {
				futures.add(executor.submit(() -> calibrate(view, universe, marketWeights, marketCovariance)));
			}
			for (int i = 0; i < futures.size(); i++) {
				try {
					variances[i] = futures.get(i).get();
				} catch (ExecutionException ex) {
					Throwable cause = ex.getCause();
					if (cause instanceof RuntimeException runtime) {
						throw runtime;
					}
					if (cause instanceof Error error) {
						throw error;
					}
					throw new IllegalStateException(cause);
				} catch (InterruptedException ex) {
					Thread.currentThread().interrupt();
					throw new CancellationException("Canceled");
				}
			}
		} finally {
			executor.shutdownNow();
		}
		return LabeledMatrix.diagonal(views.getViewIds(), variances);
	}

	private double calibrate(View view, List<String> universe, LabeledVector marketWeights, LabeledMatrix marketCovariance) {
		double variance = calibrator.calibrate(view, universe, marketWeights, marketCovariance,
				settings.tau(), settings.riskAversion());
		logger.debug("Calibrated view {} (confidence={}) to variance {}.", view.id(), view.confidence(), variance);
		return variance;
	}

	public record DateRange(LocalDate startDate, LocalDate calculationDate) {
	}
}
