package my.portfolioanalytics.app.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flat report handed to the exporter: a file suffix, a header and rows aligned to it.
 */
public record ReportTable(
		String fileSuffix,
		List<String> headers,
		List<List<Object>> rows
) {
	public ReportTable {
		headers = List.copyOf(headers);
		List<List<Object>> copied = new ArrayList<>(rows.size());
		for (List<Object> row : rows) {
			if (row.size() != headers.size()) {
				throw new IllegalArgumentException("Row width " + row.size() + " does not match header width "
						+ headers.size() + " in " + fileSuffix);
			}
			copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
		}
		rows = Collections.unmodifiableList(copied);
	}
}
