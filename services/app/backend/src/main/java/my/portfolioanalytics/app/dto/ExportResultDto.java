package my.portfolioanalytics.app.dto;

import java.util.List;

public record ExportResultDto(int portfoliosExported,
							  List<String> files) {
}
