package my.portfolioanalytics.app.analytics;

import my.portfolioanalytics.app.model.HoldingsTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Derives one rating per holding from the agency columns present in the table.
 */
public final class CompositeRatings {
	public static final String COLUMN = "Composite Rating";
	public static final List<String> AGENCY_PRIORITY = List.of("Fitch", "Moody", "S&P", "MSCI");

	private CompositeRatings() {
	}

	/**
	 * Walks {@link #AGENCY_PRIORITY} and, per agency, the rating columns in table order; the
	 * first non-missing value wins. Rows without any agency rating get {@code null}.
	 */
	public static List<String> derive(HoldingsTable table, List<String> ratingColumns) {
		List<List<String>> columnsByAgency = new ArrayList<>();
		for (String agency : AGENCY_PRIORITY) {
			String lowerAgency = agency.toLowerCase(Locale.ROOT);
			columnsByAgency.add(ratingColumns.stream()
					.filter(column -> column.toLowerCase(Locale.ROOT).contains(lowerAgency))
					.toList());
		}
		List<String> ratings = new ArrayList<>(table.rowCount());
		for (int row = 0; row < table.rowCount(); row++) {
			ratings.add(pick(table, row, columnsByAgency));
		}
		return Collections.unmodifiableList(ratings);
	}

	private static String pick(HoldingsTable table, int row, List<List<String>> columnsByAgency) {
		for (List<String> columns : columnsByAgency) {
			for (String column : columns) {
				String rating = table.label(row, column);
				if (rating != null) {
					return rating;
				}
			}
		}
		return null;
	}
}
