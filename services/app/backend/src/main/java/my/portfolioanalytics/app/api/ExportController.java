package my.portfolioanalytics.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.portfolioanalytics.app.dto.ExportResultDto;
import my.portfolioanalytics.app.service.ReportExportService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/exports")
@Tag(name = "Report Exports")
public class ExportController {
	private final ReportExportService exportService;

	public ExportController(ReportExportService exportService) {
		this.exportService = exportService;
	}

	@PostMapping
	@Operation(summary = "Export all configured portfolios and the combined reports")
	public ExportResultDto exportAll() {
		return exportService.exportAll();
	}
}
