package my.portfolioanalytics.app.analytics;

import my.portfolioanalytics.app.dto.Distribution;
import my.portfolioanalytics.app.dto.DistributionEntry;
import my.portfolioanalytics.app.dto.DurationDto;
import my.portfolioanalytics.app.dto.PortfolioSummaryDto;
import my.portfolioanalytics.app.model.ColumnKind;
import my.portfolioanalytics.app.model.HoldingsColumn;
import my.portfolioanalytics.app.model.HoldingsTable;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Risk and composition analytics over one fixed-income holdings table.
 * <p>
 * The analyzer works on its own copy of the table: column names are trimmed, tenor columns
 * ({@code 2Y}, {@code 6M}, ...) become {@code KRD Contribution <tenor>} and Market Value is
 * coerced to numbers. Every query is a read over that copy, except the composite rating,
 * which is derived on first use and then kept. Instances are not safe for concurrent use
 * until {@link #compositeRatingColumn()} has been called once.
 */
public class PortfolioAnalyzer {
	public static final String MARKET_VALUE = "Market Value";
	public static final String YIELD_TO_WORST = "Yield to Worst";
	public static final String MATURITY = "Maturity";
	public static final int DEFAULT_TOP_N = 10;
	public static final Set<String> DEFAULT_EXCLUDED_COLUMNS = Set.of("Issuer Name", "Description");
	static final String NO_ISSUER_COLUMN = "No Issuer Column Found";
	static final String NO_MATURITY_COLUMN = "No Maturity Column Found";
	static final String NO_CURRENCY_COLUMN = "No Currency Column Found";
	private static final double DAYS_PER_YEAR = 365.0d;

	private final HoldingsTable holdings;
	private final String name;
	private final Clock clock;
	private final Set<String> excludedCategoricalColumns;
	private final List<String> ratingColumns;
	private final String sectorColumn;
	private final String issuerColumn;
	private final String currencyColumn;
	private final String durationColumn;
	private final List<String> krdColumns;
	private final List<Double> marketValues;
	private List<String> compositeRatings;

	public PortfolioAnalyzer(HoldingsTable holdings, String name) {
		this(holdings, name, Clock.systemDefaultZone());
	}

	public PortfolioAnalyzer(HoldingsTable holdings, String name, Clock clock) {
		this(holdings, name, clock, DEFAULT_EXCLUDED_COLUMNS);
	}

	public PortfolioAnalyzer(HoldingsTable holdings, String name, Clock clock, Set<String> excludedCategoricalColumns) {
		if (holdings == null) {
			throw new IllegalArgumentException("Holdings table is required");
		}
		HoldingsTable normalized = holdings.renameColumns(ColumnResolver::normalizeColumnName);
		if (!normalized.hasColumn(MARKET_VALUE)) {
			throw new IllegalArgumentException("Holdings table has no " + MARKET_VALUE + " column");
		}
		this.holdings = normalized.withColumnKind(MARKET_VALUE, ColumnKind.NUMERIC);
		this.name = name == null || name.isBlank() ? "Portfolio" : name;
		this.clock = clock == null ? Clock.systemDefaultZone() : clock;
		this.excludedCategoricalColumns = excludedCategoricalColumns == null
				? DEFAULT_EXCLUDED_COLUMNS
				: Set.copyOf(excludedCategoricalColumns);

		ColumnResolver resolver = new ColumnResolver(this.holdings.columnNames());
		this.ratingColumns = resolver.findColumns(ColumnRole.RATING);
		this.sectorColumn = resolver.primaryColumn(ColumnRole.SECTOR).orElse(null);
		this.issuerColumn = resolver.primaryColumn(ColumnRole.ISSUER).orElse(null);
		this.currencyColumn = resolver.primaryColumn(ColumnRole.CURRENCY).orElse(null);
		this.durationColumn = resolver.durationColumn().orElse(null);
		this.krdColumns = resolver.krdColumns();
		this.marketValues = this.holdings.numbers(MARKET_VALUE);
	}

	public String name() {
		return name;
	}

	public HoldingsTable holdings() {
		return holdings;
	}

	public List<String> ratingColumns() {
		return ratingColumns;
	}

	public PortfolioSummaryDto summary() {
		double total = totalMarketValue();
		Double weightedYield = holdings.hasColumn(YIELD_TO_WORST) ? weightedAverage(YIELD_TO_WORST, total) : null;
		Double averageMaturity = holdings.hasColumn(MATURITY) ? averageMaturityYears() : null;
		return new PortfolioSummaryDto(name, total, weightedYield, averageMaturity);
	}

	public DurationDto duration() {
		if (durationColumn == null) {
			return new DurationDto(name, null);
		}
		return new DurationDto(name, weightedAverage(durationColumn, totalMarketValue()));
	}

	/**
	 * Name of the composite rating column, deriving the ratings on first call. Empty when the
	 * table has no rating columns at all.
	 */
	public Optional<String> compositeRatingColumn() {
		if (ratingColumns.isEmpty()) {
			return Optional.empty();
		}
		if (compositeRatings == null) {
			compositeRatings = CompositeRatings.derive(holdings, ratingColumns);
		}
		return Optional.of(CompositeRatings.COLUMN);
	}

	public List<String> compositeRatings() {
		return compositeRatingColumn().isPresent() ? compositeRatings : List.of();
	}

	public Distribution creditDistribution() {
		if (compositeRatingColumn().isEmpty()) {
			return Distribution.empty();
		}
		return WeightedDistributions.percentages(compositeRatings, marketValues,
				WeightedDistributions.Order.LABEL_ASCENDING, 0);
	}

	public Map<String, Distribution> ratingDistributionsByAgency() {
		Map<String, Distribution> results = new LinkedHashMap<>();
		for (String column : ratingColumns) {
			results.put(column, WeightedDistributions.percentages(holdings.labels(column), marketValues,
					WeightedDistributions.Order.LABEL_ASCENDING, 0));
		}
		return results;
	}

	public Distribution sectorExposure() {
		if (sectorColumn == null) {
			return Distribution.empty();
		}
		return WeightedDistributions.percentages(holdings.labels(sectorColumn), marketValues,
				WeightedDistributions.Order.VALUE_DESCENDING, 0);
	}

	public Distribution currencyExposure() {
		if (currencyColumn == null) {
			return Distribution.unavailable(NO_CURRENCY_COLUMN);
		}
		return WeightedDistributions.percentages(holdings.labels(currencyColumn), marketValues,
				WeightedDistributions.Order.VALUE_DESCENDING, 0);
	}

	public Map<String, Distribution> categoricalBreakdowns() {
		return categoricalBreakdowns(DEFAULT_TOP_N);
	}

	/**
	 * Weighted distribution of every text column outside the exclusion set, largest first,
	 * cut to {@code topN} entries per column. A {@code topN} of zero keeps the columns but no entries.
	 */
	public Map<String, Distribution> categoricalBreakdowns(int topN) {
		requireNonNegative(topN, "topN");
		Map<String, Distribution> results = new LinkedHashMap<>();
		for (HoldingsColumn column : holdings.columns()) {
			if (column.kind() != ColumnKind.TEXT || excludedCategoricalColumns.contains(column.name())) {
				continue;
			}
			results.put(column.name(), topN == 0
					? Distribution.empty()
					: WeightedDistributions.percentages(holdings.labels(column.name()), marketValues,
							WeightedDistributions.Order.VALUE_DESCENDING, topN));
		}
		return results;
	}

	public Distribution topHoldings() {
		return topHoldings(DEFAULT_TOP_N);
	}

	/**
	 * Largest issuers by summed market value. Holdings without an issuer are not ranked.
	 */
	public Distribution topHoldings(int n) {
		requireNonNegative(n, "n");
		if (issuerColumn == null) {
			return Distribution.unavailable(NO_ISSUER_COLUMN);
		}
		if (n == 0) {
			return Distribution.empty();
		}
		List<String> issuers = new ArrayList<>();
		List<Double> issuerMarketValues = new ArrayList<>();
		List<String> labels = holdings.labels(issuerColumn);
		for (int row = 0; row < labels.size(); row++) {
			if (labels.get(row) != null) {
				issuers.add(labels.get(row));
				issuerMarketValues.add(marketValues.get(row));
			}
		}
		return WeightedDistributions.sums(issuers, issuerMarketValues,
				WeightedDistributions.Order.VALUE_DESCENDING, n);
	}

	/**
	 * Market-value-weighted KRD contribution per tenor, in source column order. Values are
	 * {@code null} when the total market value is zero.
	 */
	public Distribution krdProfile() {
		if (krdColumns.isEmpty()) {
			return Distribution.empty();
		}
		double total = totalMarketValue();
		List<DistributionEntry> entries = new ArrayList<>(krdColumns.size());
		for (String column : krdColumns) {
			Double weighted = weightedAverage(column, total);
			entries.add(new DistributionEntry(ColumnResolver.tenorOf(column), weighted));
		}
		return Distribution.of(entries);
	}

	/**
	 * Percentage of market value per maturity bucket. Holdings without a usable maturity or
	 * already matured are left out of both the buckets and the total.
	 */
	public Distribution maturityBuckets() {
		if (!holdings.hasColumn(MATURITY)) {
			return Distribution.unavailable(NO_MATURITY_COLUMN);
		}
		Map<MaturityBucket, Double> sums = new EnumMap<>(MaturityBucket.class);
		for (MaturityBucket bucket : MaturityBucket.values()) {
			sums.put(bucket, 0.0d);
		}
		for (int row = 0; row < holdings.rowCount(); row++) {
			Double years = yearsToMaturity(row);
			Double marketValue = marketValues.get(row);
			if (years == null || marketValue == null) {
				continue;
			}
			MaturityBucket.of(years).ifPresent(bucket -> sums.merge(bucket, marketValue, Double::sum));
		}
		double total = sums.values().stream().mapToDouble(Double::doubleValue).sum();
		List<DistributionEntry> entries = new ArrayList<>();
		sums.forEach((bucket, sum) -> entries.add(
				new DistributionEntry(bucket.label(), WeightedDistributions.percentage(sum, total))));
		return Distribution.of(entries);
	}

	double totalMarketValue() {
		double total = 0.0d;
		for (Double marketValue : marketValues) {
			if (marketValue != null) {
				total += marketValue;
			}
		}
		return total;
	}

	private Double weightedAverage(String column, double totalMarketValue) {
		if (totalMarketValue == 0.0d) {
			return null;
		}
		double weighted = 0.0d;
		for (int row = 0; row < holdings.rowCount(); row++) {
			Double factor = holdings.number(row, column);
			Double marketValue = marketValues.get(row);
			if (factor != null && marketValue != null) {
				weighted += factor * marketValue;
			}
		}
		return weighted / totalMarketValue;
	}

	private Double averageMaturityYears() {
		double sum = 0.0d;
		int count = 0;
		for (int row = 0; row < holdings.rowCount(); row++) {
			Double years = yearsToMaturity(row);
			if (years != null) {
				sum += years;
				count++;
			}
		}
		return count == 0 ? null : sum / count;
	}

	private Double yearsToMaturity(int row) {
		LocalDate maturity = holdings.date(row, MATURITY);
		if (maturity == null) {
			return null;
		}
		return ChronoUnit.DAYS.between(LocalDate.now(clock), maturity) / DAYS_PER_YEAR;
	}

	private static void requireNonNegative(int value, String parameter) {
		if (value < 0) {
			throw new IllegalArgumentException(parameter + " must not be negative");
		}
	}
}
