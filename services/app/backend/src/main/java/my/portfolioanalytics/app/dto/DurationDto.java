package my.portfolioanalytics.app.dto;

public record DurationDto(String portfolio, Double weightedDuration) {
}
