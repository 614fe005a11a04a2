package my.blacklitterman.app.service;

import my.blacklitterman.app.config.AppProperties;
import my.blacklitterman.app.market.MarketDataReader;
import my.blacklitterman.app.settings.CalculationSettings;
import my.blacklitterman.app.settings.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class BlackLittermanEngineFactory {
	private static final Logger logger = LoggerFactory.getLogger(BlackLittermanEngineFactory.class);

	private final CalculationSettings settings;
	private final WeightSolver weightSolver;
	private final ConfidenceCalibrator calibrator;
	private final ObjectProvider<MarketDataReader> dataReaders;
	private final int parallelism;

	public BlackLittermanEngineFactory(CalculationSettings settings,
									   WeightSolver weightSolver,
									   ConfidenceCalibrator calibrator,
									   ObjectProvider<MarketDataReader> dataReaders,
									   AppProperties properties) {
		this.settings = settings;
		this.weightSolver = weightSolver;
		this.calibrator = calibrator;
		this.dataReaders = dataReaders;
		AppProperties.Calibration calibration = properties.calibration();
		this.parallelism = calibration == null || calibration.parallelism() == null ? 1 : calibration.parallelism();
	}

	public BlackLittermanEngine create(MarketDataReader dataReader) {
		if (dataReader == null) {
			throw new ConfigurationException(List.of("A market data reader is required"));
		}
		logger.debug("Creating Black-Litterman engine (parallelism={}).", parallelism);
		return new BlackLittermanEngine(dataReader, settings, weightSolver, calibrator, parallelism);
	}

	public BlackLittermanEngine createDefault() {
		MarketDataReader dataReader = dataReaders.getIfAvailable();
		if (dataReader == null) {
			throw new ConfigurationException(List.of("No MarketDataReader bean is configured"));
		}
		return create(dataReader);
	}
}
