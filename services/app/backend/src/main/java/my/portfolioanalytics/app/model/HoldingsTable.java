package my.portfolioanalytics.app.model;

import my.portfolioanalytics.app.util.CsvParsing;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Immutable holdings dataset: one row per security position, columns in source order.
 * <p>
 * Every cell is stored in the type of its column kind ({@link Double}, {@link String} or
 * {@link LocalDate}); missing or uncoercible values are {@code null}. Operations that
 * change the shape return a new table.
 */
public final class HoldingsTable {
	private final List<HoldingsColumn> columns;
	private final Map<String, Integer> indexByName;
	private final List<Object[]> rows;

	private HoldingsTable(List<HoldingsColumn> columns, List<Object[]> rows) {
		Map<String, Integer> index = new LinkedHashMap<>();
		for (int i = 0; i < columns.size(); i++) {
			String name = columns.get(i).name();
			if (index.putIfAbsent(name, i) != null) {
				throw new IllegalArgumentException("Duplicate column: " + name);
			}
		}
		this.columns = List.copyOf(columns);
		this.indexByName = Collections.unmodifiableMap(index);
		this.rows = rows;
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<HoldingsColumn> columns() {
		return columns;
	}

	public List<String> columnNames() {
		return columns.stream().map(HoldingsColumn::name).toList();
	}

	public Optional<HoldingsColumn> column(String name) {
		Integer index = indexByName.get(name);
		return index == null ? Optional.empty() : Optional.of(columns.get(index));
	}

	public boolean hasColumn(String name) {
		return indexByName.containsKey(name);
	}

	public int rowCount() {
		return rows.size();
	}

	public Object value(int row, String column) {
		int index = indexOf(column);
		return rows.get(row)[index];
	}

	/**
	 * Numeric view of a cell. Text cells are parsed on the fly, anything else is missing.
	 */
	public Double number(int row, String column) {
		Object value = value(row, column);
		if (value instanceof Double number) {
			return number;
		}
		if (value instanceof String text) {
			return CsvParsing.parseNumber(text);
		}
		return null;
	}

	public LocalDate date(int row, String column) {
		Object value = value(row, column);
		if (value instanceof LocalDate date) {
			return date;
		}
		if (value instanceof String text) {
			return CsvParsing.parseDate(text);
		}
		return null;
	}

	/**
	 * Grouping label of a cell: text as is, numbers in plain notation, dates in ISO form.
	 */
	public String label(int row, String column) {
		Object value = value(row, column);
		if (value == null) {
			return null;
		}
		if (value instanceof Double number) {
			return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
		}
		return value.toString();
	}

	public List<Double> numbers(String column) {
		List<Double> values = new ArrayList<>(rows.size());
		for (int row = 0; row < rows.size(); row++) {
			values.add(number(row, column));
		}
		return values;
	}

	public List<String> labels(String column) {
		List<String> values = new ArrayList<>(rows.size());
		for (int row = 0; row < rows.size(); row++) {
			values.add(label(row, column));
		}
		return values;
	}

	public HoldingsTable renameColumns(UnaryOperator<String> renamer) {
		List<HoldingsColumn> renamed = columns.stream()
				.map(column -> new HoldingsColumn(renamer.apply(column.name()), column.kind()))
				.toList();
		return new HoldingsTable(renamed, rows);
	}

	/**
	 * Returns a table where {@code name} is re-typed to {@code kind}, coercing every cell.
	 */
	public HoldingsTable withColumnKind(String name, ColumnKind kind) {
		int index = indexOf(name);
		if (columns.get(index).kind() == kind) {
			return this;
		}
		List<HoldingsColumn> retyped = new ArrayList<>(columns);
		retyped.set(index, new HoldingsColumn(name, kind));
		List<Object[]> coerced = new ArrayList<>(rows.size());
		for (Object[] row : rows) {
			Object[] copy = Arrays.copyOf(row, row.length);
			copy[index] = kind.coerce(row[index]);
			coerced.add(copy);
		}
		return new HoldingsTable(retyped, Collections.unmodifiableList(coerced));
	}

	private int indexOf(String column) {
		Integer index = indexByName.get(column);
		if (index == null) {
			throw new IllegalArgumentException("Unknown column: " + column);
		}
		return index;
	}

	public static final class Builder {
		private final List<HoldingsColumn> columns = new ArrayList<>();
		private final List<Object[]> rows = new ArrayList<>();

		private Builder() {
		}

		public Builder column(String name, ColumnKind kind) {
			if (!rows.isEmpty()) {
				throw new IllegalStateException("Columns must be declared before rows");
			}
			columns.add(new HoldingsColumn(name, kind));
			return this;
		}

		/**
		 * Adds a row in column order; shorter rows are padded with missing values.
		 */
		public Builder row(Object... values) {
			if (values.length > columns.size()) {
				throw new IllegalArgumentException("Row has " + values.length + " values but table has "
						+ columns.size() + " columns");
			}
			Object[] row = new Object[columns.size()];
			for (int i = 0; i < values.length; i++) {
				row[i] = columns.get(i).kind().coerce(values[i]);
			}
			rows.add(row);
			return this;
		}

		public Builder row(Map<String, ?> values) {
			Object[] ordered = new Object[columns.size()];
			for (int i = 0; i < columns.size(); i++) {
				ordered[i] = values.get(columns.get(i).name());
			}
			return row(ordered);
		}

		public HoldingsTable build() {
			List<Object[]> copy = new ArrayList<>(rows.size());
			for (Object[] row : rows) {
				copy.add(Arrays.copyOf(row, row.length));
			}
			return new HoldingsTable(columns, Collections.unmodifiableList(copy));
		}
	}
}
