package my.portfolioanalytics.app.analytics;

import java.util.List;

/**
 * Semantic roles a holdings column can play, with the name fragments that identify them.
 */
public enum ColumnRole {
	RATING(List.of("Rating", "Composite Rating", "Moody", "S&P", "Fitch", "MSCI")),
	SECTOR(List.of("Sector", "Issuer Sector", "Industry", "GICS Sector")),
	ISSUER(List.of("Issuer Name", "Issuer", "Security Name", "Description", "Ticker")),
	CURRENCY(List.of("Currency", "Ccy", "Base Currency", "Trade Currency"));

	private final List<String> aliases;

	ColumnRole(List<String> aliases) {
		this.aliases = aliases;
	}

	public List<String> aliases() {
		return aliases;
	}
}
