package my.portfolioanalytics.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Headline figures of one portfolio. Optional metrics are null when their column is absent.")
public record PortfolioSummaryDto(
		String portfolio,
		double totalMarketValue,
		Double weightedYieldToWorst,
		Double averageMaturityYears
) {
}
