package my.portfolioanalytics.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Set;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Analytics analytics,
		@Valid Export export,
		List<@Valid Portfolio> portfolios
) {
	public AppProperties {
		analytics = analytics == null ? new Analytics(null, null, null, null) : analytics;
		export = export == null ? new Export(null, false) : export;
		portfolios = portfolios == null ? List.of() : List.copyOf(portfolios);
	}

	public record Analytics(
			@Positive Integer topHoldings,
			@Positive Integer categoricalTopN,
			Set<String> categoricalExcludedColumns,
			String zone
	) {
	}

	public record Export(
			String directory,
			boolean runOnStartup
	) {
	}

	public record Portfolio(
			@NotBlank String code,
			@NotBlank String name,
			@NotBlank String path,
			String prefix
	) {
	}
}
