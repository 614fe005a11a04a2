package my.blacklitterman.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Parameters parameters,
		@Valid @NotNull MarketData marketData,
		@Valid Calibration calibration
) {
	public record Parameters(
			@NotNull @Positive Double tau,
			@NotNull @Positive Double riskAversion
	) {
	}

	public record MarketData(
			@NotBlank String firstDate,
			@NotBlank String lastDate,
			@NotEmpty Map<String, String> assetUniverse
	) {
	}

	public record Calibration(
			@Positive Double initialVariance,
			@Min(1) Integer maxIterations,
			@Min(1) Integer maxEvaluations,
			@Min(1) Integer parallelism,
			String minimizer
	) {
	}
}
