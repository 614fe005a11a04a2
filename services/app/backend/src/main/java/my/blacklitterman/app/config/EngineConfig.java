package my.blacklitterman.app.config;

import my.blacklitterman.app.service.BlackLittermanWeightSolver;
import my.blacklitterman.app.service.BrentScalarMinimizer;
import my.blacklitterman.app.service.ConfidenceCalibrator;
import my.blacklitterman.app.service.GradientScalarMinimizer;
import my.blacklitterman.app.service.ScalarMinimizer;
import my.blacklitterman.app.service.WeightSolver;
import my.blacklitterman.app.settings.CalculationSettings;
import my.blacklitterman.app.settings.CalculationSettingsParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(AppProperties.class)
public class EngineConfig {
	private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

	static final int DEFAULT_MAX_ITERATIONS = 100;
	static final int DEFAULT_MAX_EVALUATIONS = 10_000;

	@Bean
	public CalculationSettings calculationSettings(AppProperties properties) {
		CalculationSettings settings = new CalculationSettingsParser().parse(toConfigMapping(properties));
		logger.info("Calculation settings loaded (tau={}, riskAversion={}, window={}..{}, assets={}).",
				settings.tau(), settings.riskAversion(), settings.startDate(), settings.calculationDate(),
				settings.assetUniverse().size());
		return settings;
	}

	@Bean
	public WeightSolver weightSolver() {
		return new BlackLittermanWeightSolver();
	}

	@Bean
	public ScalarMinimizer scalarMinimizer(AppProperties properties) {
		AppProperties.Calibration calibration = properties.calibration();
		int maxIterations = calibration == null || calibration.maxIterations() == null
				? DEFAULT_MAX_ITERATIONS
				: calibration.maxIterations();
		int maxEvaluations = calibration == null || calibration.maxEvaluations() == null
				? DEFAULT_MAX_EVALUATIONS
				: calibration.maxEvaluations();
		String kind = calibration == null || calibration.minimizer() == null || calibration.minimizer().isBlank()
				? "gradient"
				: calibration.minimizer().trim().toLowerCase(Locale.ROOT);
		if (kind.equals("brent")) {
			logger.info("Confidence calibration uses Brent search (maxEvaluations={}).", maxEvaluations);
			return new BrentScalarMinimizer(maxEvaluations);
		}
		if (!kind.equals("gradient")) {
			throw new IllegalStateException("Unknown app.calibration.minimizer: " + kind);
		}
		logger.info("Confidence calibration uses gradient search (maxIterations={}, maxEvaluations={}).",
				maxIterations, maxEvaluations);
		return new GradientScalarMinimizer(maxIterations, maxEvaluations);
	}

	@Bean
	public ConfidenceCalibrator confidenceCalibrator(WeightSolver weightSolver,
													 ScalarMinimizer scalarMinimizer,
													 AppProperties properties) {
		AppProperties.Calibration calibration = properties.calibration();
		double initialVariance = calibration == null || calibration.initialVariance() == null
				? ConfidenceCalibrator.DEFAULT_INITIAL_VARIANCE
				: calibration.initialVariance();
		return new ConfidenceCalibrator(weightSolver, scalarMinimizer, initialVariance);
	}

	static Map<String, Object> toConfigMapping(AppProperties properties) {
		Map<String, Object> parameters = new LinkedHashMap<>();
		Map<String, Object> marketData = new LinkedHashMap<>();
		if (properties.parameters() != null) {
			parameters.put("tau", properties.parameters().tau());
			parameters.put("risk_aversion", properties.parameters().riskAversion());
		}
		if (properties.marketData() != null) {
			marketData.put("first_date", properties.marketData().firstDate());
			marketData.put("last_date", properties.marketData().lastDate());
			marketData.put("asset_universe", properties.marketData().assetUniverse());
		}
		Map<String, Object> config = new LinkedHashMap<>();
		config.put("parameters", parameters);
		config.put("market_data", marketData);
		return config;
	}
}
