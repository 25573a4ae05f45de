package my.portfolioanalytics.app.service;

import my.portfolioanalytics.app.analytics.PortfolioAnalyzer;
import my.portfolioanalytics.app.dto.Distribution;
import my.portfolioanalytics.app.dto.DistributionEntry;
import my.portfolioanalytics.app.dto.DurationDto;
import my.portfolioanalytics.app.dto.PortfolioSummaryDto;
import my.portfolioanalytics.app.model.ReportTable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Turns analyzer results into the flat per-portfolio reports consumed by BI tools.
 */
@Component
public class AnalysisReportBuilder {
	public static final String SUMMARY = "_summary.csv";
	public static final String CREDIT_DISTRIBUTION = "_credit_distribution.csv";
	public static final String SECTOR_EXPOSURE = "_sector_exposure.csv";
	public static final String KRD_PROFILE = "_krd_profile.csv";
	public static final String TOP_HOLDINGS = "_top_holdings.csv";
	public static final String DURATION = "_duration.csv";
	public static final String MATURITY_BUCKETS = "_maturity_buckets.csv";
	public static final String CURRENCY_EXPOSURE = "_currency_exposure.csv";
	/** Reports that have the same shape for every portfolio and can be concatenated. */
	public static final List<String> COMBINABLE = List.of(SUMMARY, CREDIT_DISTRIBUTION, SECTOR_EXPOSURE,
			KRD_PROFILE, TOP_HOLDINGS, DURATION, MATURITY_BUCKETS, CURRENCY_EXPOSURE);

	private static final String PORTFOLIO = "Portfolio";
	private static final String MARKET_VALUE_PCT = "Market Value %";

	public List<ReportTable> build(PortfolioAnalyzer analyzer, int topHoldings, int categoricalTopN) {
		String portfolio = analyzer.name();
		List<ReportTable> reports = new ArrayList<>();
		reports.add(summary(analyzer.summary()));
		reports.add(distribution(CREDIT_DISTRIBUTION, "Rating", MARKET_VALUE_PCT,
				analyzer.creditDistribution(), portfolio));
		for (Map.Entry<String, Distribution> entry : analyzer.ratingDistributionsByAgency().entrySet()) {
			reports.add(distribution("_" + fileToken(entry.getKey()) + "_distribution.csv", "Rating",
					MARKET_VALUE_PCT, entry.getValue(), portfolio));
		}
		reports.add(distribution(SECTOR_EXPOSURE, "Sector", MARKET_VALUE_PCT, analyzer.sectorExposure(), portfolio));
		reports.add(distribution(KRD_PROFILE, "Tenor", "Contribution", analyzer.krdProfile(), portfolio));
		reports.add(distribution(TOP_HOLDINGS, "Issuer", "Market Value", analyzer.topHoldings(topHoldings), portfolio));
		reports.add(duration(analyzer.duration()));
		reports.add(distribution(MATURITY_BUCKETS, "Maturity Bucket", MARKET_VALUE_PCT,
				analyzer.maturityBuckets(), portfolio));
		reports.add(distribution(CURRENCY_EXPOSURE, "Currency", MARKET_VALUE_PCT,
				analyzer.currencyExposure(), portfolio));
		for (Map.Entry<String, Distribution> entry : analyzer.categoricalBreakdowns(categoricalTopN).entrySet()) {
			reports.add(distribution("_" + fileToken(entry.getKey()) + "_breakdown.csv", entry.getKey(),
					MARKET_VALUE_PCT, entry.getValue(), portfolio));
		}
		return reports;
	}

	ReportTable summary(PortfolioSummaryDto summary) {
		List<String> headers = List.of(PORTFOLIO, "Total Market Value", "Weighted Yield to Worst",
				"Average Maturity (yrs)");
		List<Object> row = Arrays.asList(summary.portfolio(), summary.totalMarketValue(),
				summary.weightedYieldToWorst(), summary.averageMaturityYears());
		return new ReportTable(SUMMARY, headers, List.of(row));
	}

	ReportTable duration(DurationDto duration) {
		List<Object> row = Arrays.asList(duration.portfolio(), duration.weightedDuration());
		return new ReportTable(DURATION, List.of(PORTFOLIO, "Weighted Duration"), List.of(row));
	}

	ReportTable distribution(String suffix, String keyHeader, String valueHeader, Distribution distribution,
							 String portfolio) {
		List<List<Object>> rows = new ArrayList<>();
		for (DistributionEntry entry : distribution.entries()) {
			rows.add(Arrays.asList(entry.label(), entry.value(), portfolio));
		}
		return new ReportTable(suffix, List.of(keyHeader, valueHeader, PORTFOLIO), rows);
	}

	static String fileToken(String columnName) {
		return columnName.trim().replaceAll("[\\s/\\\\]", "_");
	}
}
