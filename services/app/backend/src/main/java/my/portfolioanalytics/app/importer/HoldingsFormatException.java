package my.portfolioanalytics.app.importer;

public class HoldingsFormatException extends RuntimeException {
	public HoldingsFormatException(String message) {
		super(message);
	}

	public HoldingsFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
