package my.portfolioanalytics.app.importer;

import my.portfolioanalytics.app.analytics.PortfolioAnalyzer;
import my.portfolioanalytics.app.model.ColumnKind;
import my.portfolioanalytics.app.model.HoldingsTable;
import my.portfolioanalytics.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads a cleaned holdings export (header row plus one row per position) into a typed table.
 * <p>
 * Column kinds are inferred: {@code Maturity} is a date, identifier columns stay text,
 * Market Value is always numeric and every other column is numeric only when all of its
 * non-blank cells parse as numbers (a column without any value counts as numeric).
 */
public class HoldingsCsvReader {
	private static final Set<String> TEXT_COLUMNS = Set.of("CUSIP", "ISIN", "Security Description", "Ticker");

	public HoldingsTable read(Path path) {
		byte[] payload;
		try {
			payload = Files.readAllBytes(path);
		} catch (IOException exc) {
			throw new UncheckedIOException("Failed to read holdings file " + path, exc);
		}
		return read(payload);
	}

	public HoldingsTable read(byte[] payload) {
		if (payload == null || payload.length == 0) {
			throw new HoldingsFormatException("Holdings CSV is empty");
		}
		String content = CsvParsing.decodeUtf8(payload);
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setDelimiter(CsvParsing.sniffDelimiter(content))
				.setHeader()
				.setSkipHeaderRecord(true)
				.setTrim(true)
				.setIgnoreEmptyLines(true)
				.setDuplicateHeaderMode(DuplicateHeaderMode.DISALLOW)
				.build();

		List<String> headers;
		List<String[]> cells = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(new StringReader(content), format)) {
			headers = parser.getHeaderNames().stream().map(String::trim).toList();
			if (headers.isEmpty()) {
				throw new HoldingsFormatException("Holdings CSV has no header row");
			}
			for (CSVRecord record : parser) {
				String[] row = new String[headers.size()];
				for (int i = 0; i < headers.size() && i < record.size(); i++) {
					row[i] = record.get(i);
				}
				cells.add(row);
			}
		} catch (IOException | IllegalArgumentException | IllegalStateException exc) {
			throw new HoldingsFormatException("Failed to read holdings CSV: " + exc.getMessage(), exc);
		}

		try {
			HoldingsTable.Builder builder = HoldingsTable.builder();
			for (int i = 0; i < headers.size(); i++) {
				builder.column(headers.get(i), inferKind(headers.get(i), cells, i));
			}
			for (String[] row : cells) {
				builder.row((Object[]) row);
			}
			return builder.build();
		} catch (IllegalArgumentException exc) {
			throw new HoldingsFormatException("Invalid holdings header: " + exc.getMessage(), exc);
		}
	}

	ColumnKind inferKind(String header, List<String[]> cells, int index) {
		if (PortfolioAnalyzer.MATURITY.equals(header)) {
			return ColumnKind.DATE;
		}
		if (PortfolioAnalyzer.MARKET_VALUE.equals(header)) {
			return ColumnKind.NUMERIC;
		}
		if (TEXT_COLUMNS.contains(header)) {
			return ColumnKind.TEXT;
		}
		for (String[] row : cells) {
			String value = row[index];
			if (value == null || value.isBlank()) {
				continue;
			}
			if (!CsvParsing.isNumber(value)) {
				return ColumnKind.TEXT;
			}
		}
		return ColumnKind.NUMERIC;
	}
}
