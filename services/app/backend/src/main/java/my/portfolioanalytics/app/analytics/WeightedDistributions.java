package my.portfolioanalytics.app.analytics;

import my.portfolioanalytics.app.dto.Distribution;
import my.portfolioanalytics.app.dto.DistributionEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Market-value-weighted grouping shared by every categorical report.
 */
final class WeightedDistributions {
	enum Order {
		LABEL_ASCENDING,
		VALUE_DESCENDING
	}

	private WeightedDistributions() {
	}

	/**
	 * Groups {@code keys} (missing key is its own group), sums the aligned market values and
	 * expresses each group as a percentage of the grand total.
	 */
	static Distribution percentages(List<String> keys, List<Double> marketValues, Order order, int limit) {
		Map<String, Double> sums = groupSums(keys, marketValues);
		double total = sums.values().stream().mapToDouble(Double::doubleValue).sum();
		List<DistributionEntry> entries = new ArrayList<>(sums.size());
		for (Map.Entry<String, Double> entry : sums.entrySet()) {
			entries.add(new DistributionEntry(entry.getKey(), percentage(entry.getValue(), total)));
		}
		return Distribution.of(sortAndLimit(entries, order, limit));
	}

	/**
	 * Groups {@code keys} and returns the raw market value sums.
	 */
	static Distribution sums(List<String> keys, List<Double> marketValues, Order order, int limit) {
		List<DistributionEntry> entries = new ArrayList<>();
		groupSums(keys, marketValues).forEach((key, sum) -> entries.add(new DistributionEntry(key, sum)));
		return Distribution.of(sortAndLimit(entries, order, limit));
	}

	static double percentage(double value, double total) {
		if (total == 0.0d) {
			return 0.0d;
		}
		return value / total * 100.0d;
	}

	private static Map<String, Double> groupSums(List<String> keys, List<Double> marketValues) {
		if (keys.size() != marketValues.size()) {
			throw new IllegalArgumentException("Keys and market values differ in length");
		}
		Map<String, Double> sums = new LinkedHashMap<>();
		for (int i = 0; i < keys.size(); i++) {
			Double marketValue = marketValues.get(i);
			double contribution = marketValue == null ? 0.0d : marketValue;
			sums.merge(keys.get(i), contribution, Double::sum);
		}
		return sums;
	}

	private static List<DistributionEntry> sortAndLimit(List<DistributionEntry> entries, Order order, int limit) {
		Comparator<DistributionEntry> comparator = order == Order.LABEL_ASCENDING
				? Comparator.comparing(DistributionEntry::label, Comparator.nullsLast(Comparator.naturalOrder()))
				: Comparator.comparingDouble(DistributionEntry::value).reversed();
		entries.sort(comparator);
		if (limit > 0 && entries.size() > limit) {
			return entries.subList(0, limit);
		}
		return entries;
	}
}
