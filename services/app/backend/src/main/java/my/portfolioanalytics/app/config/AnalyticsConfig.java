package my.portfolioanalytics.app.config;

import my.portfolioanalytics.app.importer.HoldingsCsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class AnalyticsConfig {
	private static final Logger logger = LoggerFactory.getLogger(AnalyticsConfig.class);

	@Bean
	public Clock analyticsClock(AppProperties properties) {
		String zone = properties.analytics().zone();
		if (zone == null || zone.isBlank()) {
			return Clock.systemUTC();
		}
		logger.info("Evaluating maturities in time zone {}.", zone);
		return Clock.system(ZoneId.of(zone.trim()));
	}

	@Bean
	public HoldingsCsvReader holdingsCsvReader() {
		return new HoldingsCsvReader();
	}
}
