package my.portfolioanalytics.app.analytics;

import java.util.Optional;

/**
 * Half-open year ranges, lower bound inclusive. Negative years fall into no bucket.
 */
public enum MaturityBucket {
	UP_TO_3Y("0-3y", 0.0, 3.0),
	FROM_3_TO_5Y("3-5y", 3.0, 5.0),
	FROM_5_TO_10Y("5-10y", 5.0, 10.0),
	FROM_10_TO_30Y("10-30y", 10.0, 30.0),
	OVER_30Y("30y+", 30.0, Double.POSITIVE_INFINITY);

	private final String label;
	private final double lowerInclusive;
	private final double upperExclusive;

	MaturityBucket(String label, double lowerInclusive, double upperExclusive) {
		this.label = label;
		this.lowerInclusive = lowerInclusive;
		this.upperExclusive = upperExclusive;
	}

	public String label() {
		return label;
	}

	public static Optional<MaturityBucket> of(double years) {
		if (Double.isNaN(years)) {
			return Optional.empty();
		}
		for (MaturityBucket bucket : values()) {
			if (years >= bucket.lowerInclusive && years < bucket.upperExclusive) {
				return Optional.of(bucket);
			}
		}
		return Optional.empty();
	}
}
