package my.portfolioanalytics.app.analytics;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps semantic roles onto physical column names by case-insensitive substring match.
 * Results keep the column order of the table and absence is reported as an empty result.
 */
public final class ColumnResolver {
	public static final String KRD_PREFIX = "KRD Contribution ";
	private static final Pattern TENOR_RE = Pattern.compile("^\\d+[MY]$");
	private static final String DURATION_TOKEN = "duration";

	private final List<String> columnNames;

	public ColumnResolver(List<String> columnNames) {
		this.columnNames = columnNames == null ? List.of() : List.copyOf(columnNames);
	}

	public List<String> findColumns(ColumnRole role) {
		List<String> aliases = role.aliases().stream()
				.map(alias -> alias.toLowerCase(Locale.ROOT))
				.toList();
		return columnNames.stream()
				.filter(name -> {
					String lower = name.toLowerCase(Locale.ROOT);
					return aliases.stream().anyMatch(lower::contains);
				})
				.toList();
	}

	public Optional<String> primaryColumn(ColumnRole role) {
		return findColumns(role).stream().findFirst();
	}

	public Optional<String> durationColumn() {
		return columnNames.stream()
				.filter(name -> name.toLowerCase(Locale.ROOT).contains(DURATION_TOKEN))
				.findFirst();
	}

	public List<String> krdColumns() {
		return columnNames.stream()
				.filter(name -> name.contains(KRD_PREFIX.trim()))
				.toList();
	}

	public static boolean isTenorLabel(String name) {
		return name != null && TENOR_RE.matcher(name.trim()).matches();
	}

	/**
	 * Trims a raw header and tags tenor labels such as {@code 2Y} as KRD contribution columns.
	 */
	public static String normalizeColumnName(String raw) {
		String name = raw == null ? "" : raw.trim();
		return isTenorLabel(name) ? KRD_PREFIX + name : name;
	}

	public static String tenorOf(String krdColumn) {
		int index = krdColumn.indexOf(KRD_PREFIX.trim());
		if (index < 0) {
			return krdColumn;
		}
		return krdColumn.substring(index + KRD_PREFIX.trim().length()).trim();
	}
}
