package my.portfolioanalytics.app.model;

import my.portfolioanalytics.app.util.CsvParsing;

import java.time.LocalDate;
import java.time.LocalDateTime;

public enum ColumnKind {
	NUMERIC,
	TEXT,
	DATE;

	/**
	 * Converts a raw cell into the storage type of this kind. Values that cannot be
	 * represented become {@code null}.
	 */
	public Object coerce(Object raw) {
		if (raw == null) {
			return null;
		}
		return switch (this) {
			case NUMERIC -> toNumber(raw);
			case DATE -> toDate(raw);
			case TEXT -> toText(raw);
		};
	}

	private static Double toNumber(Object raw) {
		if (raw instanceof Number number) {
			double value = number.doubleValue();
			return Double.isNaN(value) ? null : value;
		}
		return CsvParsing.parseNumber(raw.toString());
	}

	private static LocalDate toDate(Object raw) {
		if (raw instanceof LocalDate date) {
			return date;
		}
		if (raw instanceof LocalDateTime dateTime) {
			return dateTime.toLocalDate();
		}
		return CsvParsing.parseDate(raw.toString());
	}

	private static String toText(Object raw) {
		String value = raw.toString().trim();
		return value.isEmpty() ? null : value;
	}
}
