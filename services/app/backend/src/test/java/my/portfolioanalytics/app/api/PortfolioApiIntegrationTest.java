package my.portfolioanalytics.app.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = my.portfolioanalytics.app.AppApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PortfolioApiIntegrationTest {
	@Autowired
	private MockMvc mockMvc;

	@DynamicPropertySource
	static void registerProperties(DynamicPropertyRegistry registry) {
		Path workDir = createWorkDir();
		Path holdings = workDir.resolve("port_usd.csv");
		copyResource("/holdings/port_usd.csv", holdings);
		registry.add("app.portfolios[0].code", () -> "usd");
		registry.add("app.portfolios[0].name", () -> "USD Portfolio");
		registry.add("app.portfolios[0].path", holdings::toString);
		registry.add("app.portfolios[0].prefix", () -> "USD_Portfolio");
		registry.add("app.export.directory", () -> workDir.resolve("exports").toString());
	}

	@Test
	void listsConfiguredPortfolios() throws Exception {
		mockMvc.perform(get("/api/portfolios"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$[0].code").value("usd"))
				.andExpect(jsonPath("$[0].name").value("USD Portfolio"));
	}

	@Test
	void summaryAndDurationAreWeightedByMarketValue() throws Exception {
		mockMvc.perform(get("/api/portfolios/usd/summary"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.portfolio").value("USD Portfolio"))
				.andExpect(jsonPath("$.totalMarketValue").value(200.0))
				.andExpect(jsonPath("$.weightedYieldToWorst", closeTo(4.55, 1e-9)));

		mockMvc.perform(get("/api/portfolios/usd/duration"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.weightedDuration", closeTo(4.85, 1e-9)));
	}

	@Test
	void creditDistributionUsesCompositeRating() throws Exception {
		mockMvc.perform(get("/api/portfolios/usd/credit-distribution"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.entries[0].label").value("A-"))
				.andExpect(jsonPath("$.entries[0].value").value(25.0))
				.andExpect(jsonPath("$.entries[1].label").value("AA"))
				.andExpect(jsonPath("$.entries[1].value").value(50.0))
				.andExpect(jsonPath("$.entries[2].label").value("Baa1"))
				.andExpect(jsonPath("$.entries[3].label").value(nullValue()))
				.andExpect(jsonPath("$.entries[3].value").value(10.0));

		mockMvc.perform(get("/api/portfolios/usd/rating-distributions"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$['Fitch Rating'].entries[0].label").value("AA"));
	}

	@Test
	void exposuresAndRiskProfiles() throws Exception {
		mockMvc.perform(get("/api/portfolios/usd/sector-exposure"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.entries[*].label", contains("Industrials", "Financials", "Utilities")));

		mockMvc.perform(get("/api/portfolios/usd/currency-exposure"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.entries[0].label").value("USD"))
				.andExpect(jsonPath("$.entries[0].value").value(85.0));

		mockMvc.perform(get("/api/portfolios/usd/krd-profile"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.entries[*].label", contains("2Y", "5Y")))
				.andExpect(jsonPath("$.entries[0].value", closeTo(0.0655, 1e-9)));

		mockMvc.perform(get("/api/portfolios/usd/maturity-buckets"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.entries[*].label", contains("0-3y", "3-5y", "5-10y", "10-30y", "30y+")));

		mockMvc.perform(get("/api/portfolios/usd/categorical-breakdowns").param("topN", "1"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.Sector.entries[0].label").value("Industrials"))
				.andExpect(jsonPath("$['Issuer Name']").doesNotExist());
	}

	@Test
	void topHoldingsGroupIssuers() throws Exception {
		mockMvc.perform(get("/api/portfolios/usd/top-holdings").param("n", "2"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.entries[0].label").value("Acme Corp"))
				.andExpect(jsonPath("$.entries[0].value").value(150.0))
				.andExpect(jsonPath("$.entries[1].label").value("Zeta Bank"))
				.andExpect(jsonPath("$.note").doesNotExist());

		mockMvc.perform(get("/api/portfolios/usd/top-holdings").param("n", "0"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.entries").isEmpty());

		mockMvc.perform(get("/api/portfolios/usd/top-holdings").param("n", "-1"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.detail").value("Invalid request."))
				.andExpect(jsonPath("$.path").value("/api/portfolios/usd/top-holdings"));
	}

	@Test
	void unknownPortfolioIsNotFound() throws Exception {
		mockMvc.perform(get("/api/portfolios/gbp/summary"))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.code").value("gbp"));
	}

	@Test
	void evictAndExport() throws Exception {
		mockMvc.perform(delete("/api/portfolios/usd/cache"))
				.andExpect(status().isNoContent());

		mockMvc.perform(post("/api/exports"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.portfoliosExported").value(1))
				.andExpect(jsonPath("$.files", hasItem("USD_Portfolio_krd_profile.csv")))
				.andExpect(jsonPath("$.files", hasItem("ALL_Portfolios_summary.csv")));
	}

	private static Path createWorkDir() {
		try {
			return Files.createTempDirectory("portfolio-analytics-it");
		} catch (IOException exc) {
			throw new UncheckedIOException(exc);
		}
	}

	private static void copyResource(String resource, Path target) {
		try (InputStream in = Objects.requireNonNull(PortfolioApiIntegrationTest.class.getResourceAsStream(resource))) {
			Files.copy(in, target);
		} catch (IOException exc) {
			throw new UncheckedIOException(exc);
		}
	}
}
