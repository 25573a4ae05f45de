package my.portfolioanalytics.app.service;

public class PortfolioNotFoundException extends RuntimeException {
	private final String code;

	public PortfolioNotFoundException(String code) {
		super("Portfolio not found: " + code);
		this.code = code;
	}

	public String getCode() {
		return code;
	}
}
