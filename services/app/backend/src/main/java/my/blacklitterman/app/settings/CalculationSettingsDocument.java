package my.blacklitterman.app.settings;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record CalculationSettingsDocument(
		@JsonProperty("parameters") Parameters parameters,
		@JsonProperty("market_data") MarketData marketData
) {
	public record Parameters(
			@JsonProperty("tau") Double tau,
			@JsonProperty("risk_aversion") Double riskAversion
	) {
	}

	public record MarketData(
			@JsonProperty("first_date") String firstDate,
			@JsonProperty("last_date") String lastDate,
			@JsonProperty("asset_universe") Map<String, String> assetUniverse
	) {
	}
}
