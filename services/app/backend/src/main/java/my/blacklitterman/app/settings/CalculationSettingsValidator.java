package my.blacklitterman.app.settings;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class CalculationSettingsValidator {
	public List<String> validate(CalculationSettingsDocument document) {
		List<String> errors = new ArrayList<>();
		if (document == null) {
			errors.add("Configuration is empty");
			return errors;
		}
		CalculationSettingsDocument.Parameters parameters = document.parameters();
		if (parameters == null) {
			errors.add("parameters is required");
		} else {
			requirePositive(errors, "parameters.tau", parameters.tau());
			requirePositive(errors, "parameters.risk_aversion", parameters.riskAversion());
		}
		CalculationSettingsDocument.MarketData marketData = document.marketData();
		if (marketData == null) {
			errors.add("market_data is required");
			return errors;
		}
		LocalDate firstDate = requireDate(errors, "market_data.first_date", marketData.firstDate());
		LocalDate lastDate = requireDate(errors, "market_data.last_date", marketData.lastDate());
		if (firstDate != null && lastDate != null && firstDate.isAfter(lastDate)) {
			errors.add("market_data.first_date must not be after market_data.last_date");
		}
		Map<String, String> universe = marketData.assetUniverse();
		if (universe == null || universe.isEmpty()) {
			errors.add("market_data.asset_universe must not be empty");
		} else {
			for (String assetId : universe.keySet()) {
				if (assetId == null || assetId.isBlank()) {
					errors.add("market_data.asset_universe contains a blank asset id");
				}
			}
		}
		return errors;
	}

	private void requirePositive(List<String> errors, String key, Double value) {
		if (value == null) {
			errors.add(key + " is required");
		} else if (!Double.isFinite(value) || value <= 0.0d) {
			errors.add(key + " must be a positive number");
		}
	}

	private LocalDate requireDate(List<String> errors, String key, String value) {
		if (value == null || value.isBlank()) {
			errors.add(key + " is required");
			return null;
		}
		try {
			return LocalDate.parse(value.trim());
		} catch (DateTimeParseException ex) {
			errors.add(key + " must be an ISO date (yyyy-MM-dd)");
			return null;
		}
	}
}
