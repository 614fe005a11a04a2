package my.blacklitterman.app.settings;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalculationSettingsParserTest {
	private final CalculationSettingsParser parser = new CalculationSettingsParser();

	@Test
	void parsesCompleteConfiguration() {
		CalculationSettings settings = CalculationSettings.parseFromConfig(config(0.05, 2.5, "2015-01-01", "2019-12-31"));

		assertThat(settings.tau()).isEqualTo(0.05d);
		assertThat(settings.riskAversion()).isEqualTo(2.5d);
		assertThat(settings.startDate()).isEqualTo(LocalDate.of(2015, 1, 1));
		assertThat(settings.calculationDate()).isEqualTo(LocalDate.of(2019, 12, 31));
		assertThat(settings.assetIds()).containsExactly("GOVT_BONDS", "WORLD_EQUITY", "EM_EQUITY");
		assertThat(settings.assetUniverse()).containsEntry("WORLD_EQUITY", "World Equity");
	}

	@Test
	void ignoresUnknownKeys() {
		Map<String, Object> config = config(0.05, 2.5, "2015-01-01", "2019-12-31");
		config.put("ui", Map.of("theme", "dark"));

		CalculationSettings settings = parser.parse(config);

		assertThat(settings.tau()).isEqualTo(0.05d);
	}

	@Test
	void acceptsIntegerParameters() {
		Map<String, Object> config = config(0.05, 2.5, "2015-01-01", "2019-12-31");
		config.put("parameters", Map.of("tau", 1, "risk_aversion", 3));

		CalculationSettings settings = parser.parse(config);

		assertThat(settings.tau()).isEqualTo(1.0d);
		assertThat(settings.riskAversion()).isEqualTo(3.0d);
	}

	@Test
	void rejectsMissingSections() {
		assertThatThrownBy(() -> parser.parse(Map.of()))
				.isInstanceOfSatisfying(ConfigurationException.class, ex -> {
					assertThat(ex.getErrors()).anyMatch(e -> e.contains("parameters"));
					assertThat(ex.getErrors()).anyMatch(e -> e.contains("market_data"));
				});
	}

	@Test
	void rejectsNullConfiguration() {
		assertThatThrownBy(() -> parser.parse(null))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("empty");
	}

	@Test
	@SuppressWarnings("unchecked")
	void collectsEveryInvalidValue() {
		Map<String, Object> config = config(-0.05, 0.0, "2019-02-30", "2019-12-31");
		((Map<String, Object>) config.get("market_data")).put("asset_universe", Map.of());

		assertThatThrownBy(() -> parser.parse(config))
				.isInstanceOfSatisfying(ConfigurationException.class, ex -> {
					assertThat(ex.getErrors()).anyMatch(e -> e.contains("parameters.tau"));
					assertThat(ex.getErrors()).anyMatch(e -> e.contains("parameters.risk_aversion"));
					assertThat(ex.getErrors()).anyMatch(e -> e.contains("market_data.first_date"));
					assertThat(ex.getErrors()).anyMatch(e -> e.contains("market_data.asset_universe"));
				});
	}

	@Test
	void rejectsMissingTau() {
		Map<String, Object> config = config(0.05, 2.5, "2015-01-01", "2019-12-31");
		config.put("parameters", Map.of("risk_aversion", 2.5));

		assertThatThrownBy(() -> parser.parse(config))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("parameters.tau is required");
	}

	@Test
	void rejectsWindowEndingBeforeItStarts() {
		Map<String, Object> config = config(0.05, 2.5, "2020-01-01", "2019-12-31");

		assertThatThrownBy(() -> parser.parse(config))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("must not be after");
	}

	@Test
	void rejectsMalformedNumbers() {
		Map<String, Object> config = config(0.05, 2.5, "2015-01-01", "2019-12-31");
		config.put("parameters", Map.of("tau", "not-a-number", "risk_aversion", 2.5));

		assertThatThrownBy(() -> parser.parse(config))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("malformed");
	}

	private static Map<String, Object> config(double tau, double riskAversion, String firstDate, String lastDate) {
		Map<String, String> universe = new LinkedHashMap<>();
		universe.put("GOVT_BONDS", "Government Bonds");
		universe.put("WORLD_EQUITY", "World Equity");
		universe.put("EM_EQUITY", "Emerging Markets Equity");

		Map<String, Object> parameters = new LinkedHashMap<>();
		parameters.put("tau", tau);
		parameters.put("risk_aversion", riskAversion);

		Map<String, Object> marketData = new LinkedHashMap<>();
		marketData.put("first_date", firstDate);
		marketData.put("last_date", lastDate);
		marketData.put("asset_universe", universe);

		Map<String, Object> config = new LinkedHashMap<>();
		config.put("parameters", parameters);
		config.put("market_data", marketData);
		return config;
	}
}
