package my.blacklitterman.app;

import my.blacklitterman.app.domain.LabeledMatrix;
import my.blacklitterman.app.domain.LabeledVector;
import my.blacklitterman.app.domain.View;
import my.blacklitterman.app.domain.ViewCollection;
import my.blacklitterman.app.service.BlackLittermanEngine;
import my.blacklitterman.app.service.BlackLittermanEngineFactory;
import my.blacklitterman.app.settings.CalculationSettings;
import my.blacklitterman.app.settings.ConfigurationException;
import my.blacklitterman.app.support.FixedMarketData;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class BlackLittermanApplicationTests {
	private static final List<String> ASSETS = List.of("GOVT_BONDS", "WORLD_EQUITY");

	@Autowired
	private CalculationSettings settings;

	@Autowired
	private BlackLittermanEngineFactory engineFactory;

	@Test
	void loadsSettingsFromTestProfile() {
		assertThat(settings.startDate()).isEqualTo(LocalDate.of(2018, 1, 1));
		assertThat(settings.calculationDate()).isEqualTo(LocalDate.of(2018, 12, 31));
		assertThat(settings.tau()).isEqualTo(0.05);
		assertThat(settings.assetIds()).containsExactlyElementsOf(ASSETS);
	}

	@Test
	void noMarketDataReaderIsRegistered() {
		assertThatThrownBy(engineFactory::createDefault).isInstanceOf(ConfigurationException.class);
	}

	@Test
	void blendsViewWithWiredEngine() {
		FixedMarketData market = new FixedMarketData(
				new LabeledVector(ASSETS, new double[]{0.4, 0.6}),
				LabeledMatrix.square(ASSETS, new double[][]{
						{0.0025, 0.001},
						{0.001, 0.0225}
				}));
		BlackLittermanEngine engine = engineFactory.create(market);
		Map<String, Double> allocation = new LinkedHashMap<>();
		allocation.put("WORLD_EQUITY", 1.0);
		allocation.put("GOVT_BONDS", -1.0);
		View equityPremium = new View("equity_premium", "Equities beat bonds by 5%", 0.5, 0.05, allocation);
		View bondRally = new View("bond_rally", "Bonds return 3%", 0.2, 0.03, Map.of("GOVT_BONDS", 1.0));

		LabeledVector weights = engine.getBlackLittermanWeights(ViewCollection.of(equityPremium, bondRally),
				settings.startDate(), settings.calculationDate());

		assertThat(weights.name()).isEqualTo(BlackLittermanEngine.BLACK_LITTERMAN_WEIGHTS);
		assertThat(weights.labels()).containsExactlyElementsOf(ASSETS);
		assertThat(weights.toMap().values()).allSatisfy(value -> assertThat(value).isFinite());
	}
}
