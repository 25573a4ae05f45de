package my.portfolioanalytics.app.dto;

/**
 * One labeled value. The value is {@code null} when it cannot be computed, e.g. a weighted
 * figure over a zero total.
 */
public record DistributionEntry(String label, Double value) {
}
