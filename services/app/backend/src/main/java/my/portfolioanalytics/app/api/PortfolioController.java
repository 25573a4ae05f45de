package my.portfolioanalytics.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.portfolioanalytics.app.dto.Distribution;
import my.portfolioanalytics.app.dto.DurationDto;
import my.portfolioanalytics.app.dto.PortfolioDto;
import my.portfolioanalytics.app.dto.PortfolioSummaryDto;
import my.portfolioanalytics.app.service.PortfolioAnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/portfolios")
@Tag(name = "Portfolio Analytics")
public class PortfolioController {
	private final PortfolioAnalysisService analysisService;

	public PortfolioController(PortfolioAnalysisService analysisService) {
		this.analysisService = analysisService;
	}

	@GetMapping
	@Operation(summary = "List configured portfolios")
	public List<PortfolioDto> list() {
		return analysisService.listPortfolios();
	}

	@GetMapping("/{code}/summary")
	@Operation(summary = "Total market value, weighted yield to worst and average maturity")
	public PortfolioSummaryDto summary(@PathVariable String code) {
		return analysisService.summary(code);
	}

	@GetMapping("/{code}/duration")
	@Operation(summary = "Market-value-weighted duration")
	public DurationDto duration(@PathVariable String code) {
		return analysisService.duration(code);
	}

	@GetMapping("/{code}/credit-distribution")
	@Operation(summary = "Composite rating distribution")
	public Distribution creditDistribution(@PathVariable String code) {
		return analysisService.creditDistribution(code);
	}

	@GetMapping("/{code}/rating-distributions")
	@Operation(summary = "Rating distribution per agency column")
	public Map<String, Distribution> ratingDistributions(@PathVariable String code) {
		return analysisService.ratingDistributions(code);
	}

	@GetMapping("/{code}/sector-exposure")
	public Distribution sectorExposure(@PathVariable String code) {
		return analysisService.sectorExposure(code);
	}

	@GetMapping("/{code}/currency-exposure")
	public Distribution currencyExposure(@PathVariable String code) {
		return analysisService.currencyExposure(code);
	}

	@GetMapping("/{code}/krd-profile")
	@Operation(summary = "Weighted key-rate-duration contribution per tenor")
	public Distribution krdProfile(@PathVariable String code) {
		return analysisService.krdProfile(code);
	}

	@GetMapping("/{code}/top-holdings")
	@Operation(summary = "Largest issuers by market value; n=0 returns no entries, negative n is rejected")
	public Distribution topHoldings(@PathVariable String code,
									@RequestParam(required = false) Integer n) {
		return analysisService.topHoldings(code, n);
	}

	@GetMapping("/{code}/maturity-buckets")
	public Distribution maturityBuckets(@PathVariable String code) {
		return analysisService.maturityBuckets(code);
	}

	@GetMapping("/{code}/categorical-breakdowns")
	@Operation(summary = "Weighted breakdown of every remaining text column")
	public Map<String, Distribution> categoricalBreakdowns(@PathVariable String code,
														   @RequestParam(required = false) Integer topN) {
		return analysisService.categoricalBreakdowns(code, topN);
	}

	@DeleteMapping("/{code}/cache")
	@Operation(summary = "Drop the loaded holdings so the next query reads the file again")
	public ResponseEntity<Void> evict(@PathVariable String code) {
		analysisService.evict(code);
		return ResponseEntity.noContent().build();
	}
}
