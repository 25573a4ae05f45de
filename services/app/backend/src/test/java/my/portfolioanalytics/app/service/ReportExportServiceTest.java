package my.portfolioanalytics.app.service;

import my.portfolioanalytics.app.config.AppProperties;
import my.portfolioanalytics.app.dto.ExportResultDto;
import my.portfolioanalytics.app.importer.HoldingsCsvReader;
import my.portfolioanalytics.app.model.ColumnKind;
import my.portfolioanalytics.app.model.HoldingsTable;
import my.portfolioanalytics.app.model.ReportTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReportExportServiceTest {
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

	@TempDir
	Path exportDir;

	@Test
	void exportsEachPortfolioAndCombinesSharedReports() throws IOException {
		ReportExportService service = buildService();

		ExportResultDto result = service.exportAll();

		assertThat(result.portfoliosExported()).isEqualTo(2);
		assertThat(result.files()).contains(
				"USD_Portfolio_summary.csv",
				"EUR_Portfolio_sector_exposure.csv",
				"USD_Portfolio_Fitch_distribution.csv",
				"ALL_Portfolios_summary.csv",
				"ALL_Portfolios_currency_exposure.csv");
		List<String> combined = Files.readAllLines(exportDir.resolve("ALL_Portfolios_summary.csv"));
		assertThat(combined).containsExactly(
				"Portfolio,Total Market Value,Weighted Yield to Worst,Average Maturity (yrs)",
				"USD Portfolio,400.0,,",
				"EUR Portfolio,100.0,,");
		List<String> sectors = Files.readAllLines(exportDir.resolve("USD_Portfolio_sector_exposure.csv"));
		assertThat(sectors).containsExactly(
				"Sector,Market Value %,Portfolio",
				"Banks,75.0,USD Portfolio",
				"Energy,25.0,USD Portfolio");
	}

	@Test
	void combineUnionsHeadersAndSkipsMissingFiles() throws IOException {
		ReportExportService service = buildService();
		Files.writeString(exportDir.resolve("a.csv"), "Rating,Market Value %,Portfolio\nAA,100.0,USD\n",
				StandardCharsets.UTF_8);
		Files.writeString(exportDir.resolve("b.csv"), "Rating,Market Value %,Portfolio,Extra\nA,100.0,EUR,x\n",
				StandardCharsets.UTF_8);

		Optional<Path> output = service.combine(exportDir, List.of("a.csv", "missing.csv", "b.csv"), "all.csv");

		assertThat(output).hasValue(exportDir.resolve("all.csv"));
		assertThat(Files.readAllLines(exportDir.resolve("all.csv"))).containsExactly(
				"Rating,Market Value %,Portfolio,Extra",
				"AA,100.0,USD,",
				"A,100.0,EUR,x");
	}

	@Test
	void combineWritesNothingWhenNoInputExists() {
		ReportExportService service = buildService();

		assertThat(service.combine(exportDir, List.of("none.csv"), "all.csv")).isEmpty();
		assertThat(Files.exists(exportDir.resolve("all.csv"))).isFalse();
	}

	@Test
	void writeRendersNumbersPlainAndNullsEmpty() throws IOException {
		ReportExportService service = buildService();
		ReportTable report = new ReportTable("_x.csv", List.of("Issuer", "Market Value", "Portfolio"),
				List.of(Arrays.asList("Acme, Inc.", 12500000.0d, null)));

		service.write(report, exportDir.resolve("x.csv"));

		assertThat(Files.readAllLines(exportDir.resolve("x.csv"))).containsExactly(
				"Issuer,Market Value,Portfolio",
				"\"Acme, Inc.\",12500000,");
	}

	@Test
	void prefixFallsBackToPortfolioName() {
		AppProperties.Portfolio portfolio = new AppProperties.Portfolio("gbp", "GBP Portfolio", "gbp.csv", null);

		assertThat(ReportExportService.prefixOf(portfolio)).isEqualTo("GBP_Portfolio");
	}

	private ReportExportService buildService() {
		HoldingsCsvReader reader = mock(HoldingsCsvReader.class);
		when(reader.read(any(Path.class))).thenAnswer(invocation -> {
			Path path = invocation.getArgument(0);
			return path.getFileName().toString().startsWith("usd") ? usdHoldings() : eurHoldings();
		});
		AppProperties properties = new AppProperties(
				new AppProperties.Analytics(null, null, null, "UTC"),
				new AppProperties.Export(exportDir.toString(), false),
				List.of(
						new AppProperties.Portfolio("usd", "USD Portfolio", "usd.csv", "USD_Portfolio"),
						new AppProperties.Portfolio("eur", "EUR Portfolio", "eur.csv", "EUR_Portfolio")
				)
		);
		PortfolioAnalysisService analysisService = new PortfolioAnalysisService(properties, reader, CLOCK);
		return new ReportExportService(properties, analysisService, new AnalysisReportBuilder());
	}

	private static HoldingsTable usdHoldings() {
		return HoldingsTable.builder()
				.column("Sector", ColumnKind.TEXT)
				.column("Fitch", ColumnKind.TEXT)
				.column("Currency", ColumnKind.TEXT)
				.column("Market Value", ColumnKind.NUMERIC)
				.row("Banks", "AA", "USD", 300.0)
				.row("Energy", "A", "USD", 100.0)
				.build();
	}

	private static HoldingsTable eurHoldings() {
		return HoldingsTable.builder()
				.column("Sector", ColumnKind.TEXT)
				.column("Currency", ColumnKind.TEXT)
				.column("Market Value", ColumnKind.NUMERIC)
				.row("Sovereign", "EUR", 100.0)
				.build();
	}
}
