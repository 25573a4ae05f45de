package my.portfolioanalytics.app.model;

public record HoldingsColumn(String name, ColumnKind kind) {
	public HoldingsColumn {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Column name is required");
		}
		if (kind == null) {
			throw new IllegalArgumentException("Column kind is required for " + name);
		}
	}
}
