package my.blacklitterman.app.market;

import java.time.LocalDate;

public interface MarketDataReader {
	MarketDataEngine getMarketDataEngine(LocalDate startDate, LocalDate endDate);
}
