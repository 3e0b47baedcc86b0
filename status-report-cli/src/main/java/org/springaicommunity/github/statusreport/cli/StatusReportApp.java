package org.springaicommunity.github.statusreport.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.statusreport.ArgumentParser;
import org.springaicommunity.github.statusreport.ParsedConfiguration;
import org.springaicommunity.github.statusreport.ReportConfiguration;
import org.springaicommunity.github.statusreport.ReportConfigurationLoader;
import org.springaicommunity.github.statusreport.ReportRequest;
import org.springaicommunity.github.statusreport.ReportRunResult;
import org.springaicommunity.github.statusreport.StatusReportBuilder;
import org.springaicommunity.github.statusreport.StatusReportConfig;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

import java.nio.file.Path;
import java.time.Clock;

/**
 * GitHub Status Report Spring Boot Application
 *
 * Spring Boot command-line application writing weekly status reports from a GitHub
 * project board. Shared infrastructure comes from the StatusReportConfig beans; the run
 * itself is wired per invocation because the configuration files are command line
 * arguments.
 *
 * Usage: java -cp status-report-cli.jar
 * org.springaicommunity.github.statusreport.cli.StatusReportApp [OPTIONS]
 */
@SpringBootApplication
@Import(StatusReportConfig.class)
public class StatusReportApp implements CommandLineRunner, ExitCodeGenerator {

	private static final Logger logger = LoggerFactory.getLogger(StatusReportApp.class);

	private final ArgumentParser argumentParser;

	private final ReportConfigurationLoader configurationLoader;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	private int exitCode = 0;

	public StatusReportApp(ArgumentParser argumentParser, ReportConfigurationLoader configurationLoader,
			ObjectMapper objectMapper, Clock clock) {
		this.argumentParser = argumentParser;
		this.configurationLoader = configurationLoader;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(StatusReportApp.class);
		app.setWebApplicationType(WebApplicationType.NONE);
		System.exit(SpringApplication.exit(app.run(args)));
	}

	@Override
	public void run(String... args) {
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return;
		}

		try {
			execute(argumentParser.parseAndValidate(args));
		}
		catch (RuntimeException e) {
			logger.error("Status report failed: {}", e.getMessage());
			logger.debug("Stack trace:", e);
			exitCode = 1;
		}
	}

	private void execute(ParsedConfiguration options) {
		if (options.debug) {
			StatusReportCli.enableDebugLogging();
		}

		ReportConfiguration config = configurationLoader.load(options.configPaths());
		if (options.show) {
			System.out.print(StatusReportCli.showConfiguration(configurationLoader, config));
			return;
		}

		StatusReportBuilder builder = StatusReportBuilder.create()
			.configuration(config)
			.objectMapper(objectMapper)
			.clock(clock)
			.debug(options.debug);
		ReportRequest request = new ReportRequest(options.dryRun, null);
		if (options.cacheFile != null) {
			request = request.withCache(builder.fileCache(Path.of(options.cacheFile)));
		}

		ReportRunResult result = builder.build().run(request);
		logger.info("Wrote {} reports, archived {} items", result.files().size(), result.archivedItemIds().size());
	}

	@Override
	public int getExitCode() {
		return exitCode;
	}

}
