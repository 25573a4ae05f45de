package my.portfolioanalytics.app.dto;

public record PortfolioDto(String code, String name) {
}
