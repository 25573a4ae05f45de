package my.portfolioanalytics.app.util;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

public final class CsvParsing {
	private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
			DateTimeFormatter.ISO_LOCAL_DATE,
			DateTimeFormatter.ofPattern("dd.MM.yyyy", Locale.ROOT),
			DateTimeFormatter.ofPattern("M/d/yyyy", Locale.ROOT)
	);
	private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
			DateTimeFormatter.ISO_LOCAL_DATE_TIME,
			DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT)
	);

	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	/**
	 * Picks the delimiter from the header line: semicolon wins whenever it occurs there.
	 */
	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		int lineEnd = sample.indexOf('\n');
		String header = lineEnd < 0 ? sample : sample.substring(0, lineEnd);
		if (header.indexOf(';') >= 0) {
			return ';';
		}
		return ',';
	}

	public static String decodeUtf8(byte[] payload) {
		String raw = new String(payload, StandardCharsets.UTF_8);
		return stripBom(raw);
	}

	/**
	 * Parses a plain decimal cell such as {@code 12.5}, {@code -3} or {@code 1.2E3}. Blanks,
	 * {@code NaN} and anything else, including Java literal suffixes like {@code 30D}, are missing.
	 */
	public static Double parseNumber(String raw) {
		if (raw == null) {
			return null;
		}
		String value = raw.trim();
		if (value.isEmpty()) {
			return null;
		}
		try {
			double parsed = new BigDecimal(value).doubleValue();
			return Double.isFinite(parsed) ? parsed : null;
		} catch (NumberFormatException exc) {
			return null;
		}
	}

	public static boolean isNumber(String raw) {
		return parseNumber(raw) != null;
	}

	/**
	 * Parses a calendar date. A trailing time part is accepted and dropped.
	 */
	public static LocalDate parseDate(String raw) {
		if (raw == null || raw.isBlank()) {
			return null;
		}
		String value = raw.trim();
		for (DateTimeFormatter format : DATE_FORMATS) {
			try {
				return LocalDate.parse(value, format);
			} catch (DateTimeParseException ignored) {
				// next format
			}
		}
		for (DateTimeFormatter format : DATE_TIME_FORMATS) {
			try {
				return LocalDateTime.parse(value, format).toLocalDate();
			} catch (DateTimeParseException ignored) {
				// next format
			}
		}
		return null;
	}

	/**
	 * Renders a number for CSV output without exponent notation.
	 */
	public static String formatNumber(Double value) {
		if (value == null || !Double.isFinite(value)) {
			return null;
		}
		return BigDecimal.valueOf(value).toPlainString();
	}
}
