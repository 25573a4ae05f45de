package my.portfolioanalytics.app.config;

import my.portfolioanalytics.app.dto.ExportResultDto;
import my.portfolioanalytics.app.service.ReportExportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.export.run-on-startup", havingValue = "true")
public class ExportRunner implements ApplicationRunner {
	private static final Logger logger = LoggerFactory.getLogger(ExportRunner.class);

	private final ReportExportService exportService;

	public ExportRunner(ReportExportService exportService) {
		this.exportService = exportService;
	}

	@Override
	public void run(ApplicationArguments args) {
		ExportResultDto result = exportService.exportAll();
		logger.info("Startup export finished: {} portfolios, {} files.", result.portfoliosExported(),
				result.files().size());
	}
}
