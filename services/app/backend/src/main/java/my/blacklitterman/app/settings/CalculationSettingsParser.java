package my.blacklitterman.app.settings;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.json.JsonMapper;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link CalculationSettings} from a nested configuration mapping
 * ({@code parameters.tau}, {@code parameters.risk_aversion}, {@code market_data.first_date},
 * {@code market_data.last_date}, {@code market_data.asset_universe}).
 */
public class CalculationSettingsParser {
	private final ObjectMapper mapper;
	private final CalculationSettingsValidator validator;

	public CalculationSettingsParser() {
		this.mapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
		this.validator = new CalculationSettingsValidator();
	}

	public CalculationSettings parse(Map<String, ?> config) {
		if (config == null) {
			throw new ConfigurationException(List.of("Configuration is empty"));
		}
		CalculationSettingsDocument document;
		try {
			document = mapper.convertValue(config, CalculationSettingsDocument.class);
		} catch (JacksonException | IllegalArgumentException ex) {
			throw new ConfigurationException(List.of("Configuration is malformed: " + ex.getMessage()), ex);
		}
		List<String> errors = validator.validate(document);
		if (!errors.isEmpty()) {
			throw new ConfigurationException(errors);
		}
		return new CalculationSettings(
				document.parameters().tau(),
				document.parameters().riskAversion(),
				LocalDate.parse(document.marketData().firstDate().trim()),
				LocalDate.parse(document.marketData().lastDate().trim()),
				new LinkedHashMap<>(document.marketData().assetUniverse())
		);
	}
}
