package my.portfolioanalytics.app.service;

import my.portfolioanalytics.app.analytics.PortfolioAnalyzer;
import my.portfolioanalytics.app.model.ColumnKind;
import my.portfolioanalytics.app.model.HoldingsTable;
import my.portfolioanalytics.app.model.ReportTable;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisReportBuilderTest {
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

	private final AnalysisReportBuilder builder = new AnalysisReportBuilder();

	@Test
	void buildsEveryReportWithPortfolioColumn() {
		Map<String, ReportTable> reports = build();

		assertThat(reports.keySet()).containsExactly(
				"_summary.csv",
				"_credit_distribution.csv",
				"_S&P_Rating_distribution.csv",
				"_sector_exposure.csv",
				"_krd_profile.csv",
				"_top_holdings.csv",
				"_duration.csv",
				"_maturity_buckets.csv",
				"_currency_exposure.csv",
				"_S&P_Rating_breakdown.csv",
				"_Sector_breakdown.csv");
		ReportTable sector = reports.get("_sector_exposure.csv");
		assertThat(sector.headers()).containsExactly("Sector", "Market Value %", "Portfolio");
		assertThat(sector.rows()).containsExactly(
				List.of("Banks", 75.0d, "USD Portfolio"),
				List.of("Energy", 25.0d, "USD Portfolio"));
	}

	@Test
	void summaryAndDurationKeepNullCells() {
		Map<String, ReportTable> reports = build();

		ReportTable summary = reports.get("_summary.csv");
		assertThat(summary.headers()).containsExactly("Portfolio", "Total Market Value", "Weighted Yield to Worst",
				"Average Maturity (yrs)");
		assertThat(summary.rows().get(0)).containsExactly("USD Portfolio", 400.0d, null, null);
		assertThat(reports.get("_duration.csv").rows().get(0)).containsExactly("USD Portfolio", null);
	}

	@Test
	void emptyResultsBecomeHeaderOnlyReports() {
		Map<String, ReportTable> reports = build();

		assertThat(reports.get("_top_holdings.csv").headers()).containsExactly("Issuer", "Market Value", "Portfolio");
		assertThat(reports.get("_top_holdings.csv").rows()).isEmpty();
		assertThat(reports.get("_maturity_buckets.csv").rows()).isEmpty();
		assertThat(reports.get("_krd_profile.csv").rows()).extracting(row -> row.get(0)).containsExactly("2Y");
	}

	@Test
	void fileTokenReplacesSpacesAndSeparators() {
		assertThat(AnalysisReportBuilder.fileToken(" Moody's Rating ")).isEqualTo("Moody's_Rating");
		assertThat(AnalysisReportBuilder.fileToken("Country/Region")).isEqualTo("Country_Region");
	}

	private Map<String, ReportTable> build() {
		HoldingsTable table = HoldingsTable.builder()
				.column("S&P Rating", ColumnKind.TEXT)
				.column("Sector", ColumnKind.TEXT)
				.column("Market Value", ColumnKind.NUMERIC)
				.column("2Y", ColumnKind.NUMERIC)
				.row("A", "Banks", 300.0, 0.1)
				.row("BBB", "Energy", 100.0, 0.2)
				.build();
		PortfolioAnalyzer analyzer = new PortfolioAnalyzer(table, "USD Portfolio", CLOCK);
		return builder.build(analyzer, 10, 10).stream()
				.collect(Collectors.toMap(ReportTable::fileSuffix, Function.identity(),
						(left, right) -> left, java.util.LinkedHashMap::new));
	}
}
