package my.portfolioanalytics.app.service;

import my.portfolioanalytics.app.analytics.PortfolioAnalyzer;
import my.portfolioanalytics.app.config.AppProperties;
import my.portfolioanalytics.app.dto.ExportResultDto;
import my.portfolioanalytics.app.model.ReportTable;
import my.portfolioanalytics.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Writes analyzer reports as CSV files and concatenates same-shaped reports across portfolios.
 */
@Service
public class ReportExportService {
	private static final Logger logger = LoggerFactory.getLogger(ReportExportService.class);
	static final String DEFAULT_DIRECTORY = "data/exports";
	static final String COMBINED_PREFIX = "ALL_Portfolios";

	private final AppProperties properties;
	private final PortfolioAnalysisService analysisService;
	private final AnalysisReportBuilder reportBuilder;

	public ReportExportService(AppProperties properties,
							   PortfolioAnalysisService analysisService,
							   AnalysisReportBuilder reportBuilder) {
		this.properties = properties;
		this.analysisService = analysisService;
		this.reportBuilder = reportBuilder;
	}

	/**
	 * Exports every configured portfolio, then writes the combined {@code ALL_Portfolios_*} files.
	 */
	public ExportResultDto exportAll() {
		Path directory = exportDirectory();
		List<String> written = new ArrayList<>();
		List<String> prefixes = new ArrayList<>();
		for (AppProperties.Portfolio portfolio : analysisService.configuredPortfolios()) {
			String prefix = prefixOf(portfolio);
			PortfolioAnalyzer analyzer = analysisService.analyzer(portfolio.code());
			List<Path> files;
			synchronized (analyzer) {
				files = exportPortfolio(analyzer, prefix, directory);
			}
			files.forEach(file -> written.add(file.getFileName().toString()));
			prefixes.add(prefix);
		}
		for (String suffix : AnalysisReportBuilder.COMBINABLE) {
			List<String> inputs = prefixes.stream().map(prefix -> prefix + suffix).toList();
			combine(directory, inputs, COMBINED_PREFIX + suffix)
					.ifPresent(file -> written.add(file.getFileName().toString()));
		}
		logger.info("Exported {} portfolios into {} ({} files).", prefixes.size(), directory, written.size());
		return new ExportResultDto(prefixes.size(), written);
	}

	public List<Path> exportPortfolio(PortfolioAnalyzer analyzer, String prefix, Path directory) {
		List<ReportTable> reports = reportBuilder.build(analyzer, analysisService.topHoldingsLimit(),
				analysisService.categoricalTopN());
		createDirectory(directory);
		List<Path> files = new ArrayList<>(reports.size());
		for (ReportTable report : reports) {
			Path file = directory.resolve(prefix + report.fileSuffix());
			write(report, file);
			files.add(file);
		}
		logger.info("Exported {} reports for portfolio {}.", files.size(), analyzer.name());
		return files;
	}

	public void write(ReportTable report, Path file) {
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setHeader(report.headers().toArray(String[]::new))
				.build();
		try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
			 CSVPrinter printer = new CSVPrinter(writer, format)) {
			for (List<Object> row : report.rows()) {
				printer.printRecord(row.stream().map(this::formatCell).toList());
			}
		} catch (IOException exc) {
			throw new UncheckedIOException("Failed to write report " + file, exc);
		}
		logger.debug("Wrote {} rows to {}.", report.rows().size(), file);
	}

	/**
	 * Concatenates the existing files among {@code files}; columns are the union of all headers
	 * in first-seen order. Returns empty when none of the inputs exist.
	 */
	public Optional<Path> combine(Path directory, List<String> files, String outputFile) {
		Set<String> headers = new LinkedHashSet<>();
		List<Map<String, String>> rows = new ArrayList<>();
		for (String name : files) {
			Path file = directory.resolve(name);
			if (!Files.exists(file)) {
				logger.warn("Skipping missing report {}.", file);
				continue;
			}
			readReport(file, headers, rows);
		}
		if (headers.isEmpty()) {
			return Optional.empty();
		}
		List<List<Object>> aligned = new ArrayList<>(rows.size());
		for (Map<String, String> row : rows) {
			List<Object> values = new ArrayList<>(headers.size());
			for (String header : headers) {
				values.add(row.get(header));
			}
			aligned.add(values);
		}
		Path output = directory.resolve(outputFile);
		write(new ReportTable(outputFile, new ArrayList<>(headers), aligned), output);
		return Optional.of(output);
	}

	Path exportDirectory() {
		String configured = properties.export().directory();
		return Path.of(configured == null || configured.isBlank() ? DEFAULT_DIRECTORY : configured);
	}

	static String prefixOf(AppProperties.Portfolio portfolio) {
		String prefix = portfolio.prefix();
		if (prefix == null || prefix.isBlank()) {
			prefix = portfolio.name();
		}
		return AnalysisReportBuilder.fileToken(prefix);
	}

	private void readReport(Path file, Set<String> headers, List<Map<String, String>> rows) {
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setHeader()
				.setSkipHeaderRecord(true)
				.build();
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
			 CSVParser parser = CSVParser.parse(reader, format)) {
			List<String> fileHeaders = parser.getHeaderNames();
			headers.addAll(fileHeaders);
			for (CSVRecord record : parser) {
				Map<String, String> row = new LinkedHashMap<>();
				for (String header : fileHeaders) {
					String value = record.isSet(header) ? record.get(header) : null;
					row.put(header, value == null || value.isEmpty() ? null : value);
				}
				rows.add(row);
			}
		} catch (IOException exc) {
			throw new UncheckedIOException("Failed to read report " + file, exc);
		}
	}

	private void createDirectory(Path directory) {
		try {
			Files.createDirectories(directory);
		} catch (IOException exc) {
			throw new UncheckedIOException("Failed to create export directory " + directory, exc);
		}
	}

	private Object formatCell(Object value) {
		if (value instanceof Double number) {
			return CsvParsing.formatNumber(number);
		}
		return value;
	}
}
