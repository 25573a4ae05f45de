package my.portfolioanalytics.app.service;

import my.portfolioanalytics.app.analytics.PortfolioAnalyzer;
import my.portfolioanalytics.app.config.AppProperties;
import my.portfolioanalytics.app.dto.Distribution;
import my.portfolioanalytics.app.dto.DurationDto;
import my.portfolioanalytics.app.dto.PortfolioDto;
import my.portfolioanalytics.app.dto.PortfolioSummaryDto;
import my.portfolioanalytics.app.importer.HoldingsCsvReader;
import my.portfolioanalytics.app.model.HoldingsTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Serves analytics for the configured portfolios, keeping one loaded analyzer per input path.
 */
@Service
public class PortfolioAnalysisService {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioAnalysisService.class);

	private final AppProperties properties;
	private final HoldingsCsvReader reader;
	private final Clock clock;
	private final Map<Path, PortfolioAnalyzer> analyzers = new ConcurrentHashMap<>();

	public PortfolioAnalysisService(AppProperties properties, HoldingsCsvReader reader, Clock clock) {
		this.properties = properties;
		this.reader = reader;
		this.clock = clock;
	}

	public List<PortfolioDto> listPortfolios() {
		return properties.portfolios().stream()
				.map(portfolio -> new PortfolioDto(portfolio.code(), portfolio.name()))
				.toList();
	}

	public List<AppProperties.Portfolio> configuredPortfolios() {
		return properties.portfolios();
	}

	public AppProperties.Portfolio portfolio(String code) {
		String normalized = normalizeCode(code);
		return properties.portfolios().stream()
				.filter(portfolio -> normalizeCode(portfolio.code()).equals(normalized))
				.findFirst()
				.orElseThrow(() -> new PortfolioNotFoundException(code));
	}

	public PortfolioAnalyzer analyzer(String code) {
		AppProperties.Portfolio portfolio = portfolio(code);
		Path path = Path.of(portfolio.path()).toAbsolutePath().normalize();
		return analyzers.computeIfAbsent(path, key -> load(key, portfolio.name()));
	}

	public void evict(String code) {
		AppProperties.Portfolio portfolio = portfolio(code);
		Path path = Path.of(portfolio.path()).toAbsolutePath().normalize();
		if (analyzers.remove(path) != null) {
			logger.info("Evicted cached holdings for portfolio {} ({}).", portfolio.code(), path);
		}
	}

	public PortfolioSummaryDto summary(String code) {
		return query(code, PortfolioAnalyzer::summary);
	}

	public DurationDto duration(String code) {
		return query(code, PortfolioAnalyzer::duration);
	}

	public Distribution creditDistribution(String code) {
		return query(code, PortfolioAnalyzer::creditDistribution);
	}

	public Map<String, Distribution> ratingDistributions(String code) {
		return query(code, PortfolioAnalyzer::ratingDistributionsByAgency);
	}

	public Distribution sectorExposure(String code) {
		return query(code, PortfolioAnalyzer::sectorExposure);
	}

	public Distribution currencyExposure(String code) {
		return query(code, PortfolioAnalyzer::currencyExposure);
	}

	public Distribution krdProfile(String code) {
		return query(code, PortfolioAnalyzer::krdProfile);
	}

	public Distribution maturityBuckets(String code) {
		return query(code, PortfolioAnalyzer::maturityBuckets);
	}

	public Distribution topHoldings(String code, Integer n) {
		int limit = n == null ? topHoldingsLimit() : n;
		return query(code, analyzer -> analyzer.topHoldings(limit));
	}

	public Map<String, Distribution> categoricalBreakdowns(String code, Integer topN) {
		int limit = topN == null ? categoricalTopN() : topN;
		return query(code, analyzer -> analyzer.categoricalBreakdowns(limit));
	}

	public int topHoldingsLimit() {
		Integer configured = properties.analytics().topHoldings();
		return configured == null ? PortfolioAnalyzer.DEFAULT_TOP_N : configured;
	}

	public int categoricalTopN() {
		Integer configured = properties.analytics().categoricalTopN();
		return configured == null ? PortfolioAnalyzer.DEFAULT_TOP_N : configured;
	}

	private PortfolioAnalyzer load(Path path, String name) {
		HoldingsTable holdings = reader.read(path);
		logger.info("Loaded portfolio {} from {} ({} holdings, {} columns).", name, path,
				holdings.rowCount(), holdings.columns().size());
		return new PortfolioAnalyzer(holdings, name, clock, excludedColumns());
	}

	private Set<String> excludedColumns() {
		Set<String> configured = properties.analytics().categoricalExcludedColumns();
		return configured == null ? PortfolioAnalyzer.DEFAULT_EXCLUDED_COLUMNS : configured;
	}

	// analyzers memoize composite ratings, so queries on one instance are serialized
	private <T> T query(String code, Function<PortfolioAnalyzer, T> query) {
		PortfolioAnalyzer analyzer = analyzer(code);
		synchronized (analyzer) {
			return query.apply(analyzer);
		}
	}

	private String normalizeCode(String code) {
		return (code == null ? "" : code).trim().toLowerCase(Locale.ROOT);
	}
}
