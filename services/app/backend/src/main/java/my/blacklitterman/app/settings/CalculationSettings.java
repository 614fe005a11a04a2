package my.blacklitterman.app.settings;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Model hyperparameters and analysis window. The asset universe maps asset id to a
 * descriptive label and keeps its configured order.
 */
public record CalculationSettings(
		double tau,
		double riskAversion,
		LocalDate startDate,
		LocalDate calculationDate,
		Map<String, String> assetUniverse
) {
	public CalculationSettings {
		Objects.requireNonNull(startDate, "startDate");
		Objects.requireNonNull(calculationDate, "calculationDate");
		Objects.requireNonNull(assetUniverse, "assetUniverse");
		assetUniverse = Collections.unmodifiableMap(new LinkedHashMap<>(assetUniverse));
	}

	public static CalculationSettings parseFromConfig(Map<String, ?> config) {
		return new CalculationSettingsParser().parse(config);
	}

	public List<String> assetIds() {
		return List.copyOf(assetUniverse.keySet());
	}
}
