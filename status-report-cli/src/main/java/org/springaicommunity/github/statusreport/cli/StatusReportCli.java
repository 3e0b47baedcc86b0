package org.springaicommunity.github.statusreport.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.statusreport.ArgumentParser;
import org.springaicommunity.github.statusreport.ItemCache;
import org.springaicommunity.github.statusreport.ParsedConfiguration;
import org.springaicommunity.github.statusreport.ReportConfiguration;
import org.springaicommunity.github.statusreport.ReportConfigurationException;
import org.springaicommunity.github.statusreport.ReportConfigurationLoader;
import org.springaicommunity.github.statusreport.ReportRequest;
import org.springaicommunity.github.statusreport.ReportRunResult;
import org.springaicommunity.github.statusreport.StatusReportBuilder;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * GitHub Status Report CLI Application
 *
 * Plain Java command-line application that writes weekly status reports from a GitHub
 * project board. No Spring dependencies - uses StatusReportBuilder for service wiring.
 *
 * Usage: java -jar status-report-cli.jar [OPTIONS]
 *
 * Examples: java -jar status-report-cli.jar -f team.yml java -jar status-report-cli.jar
 * -f config/ --dry-run --cache-file items.json
 */
public class StatusReportCli {

	private static final Logger logger = LoggerFactory.getLogger(StatusReportCli.class);

	static final String APPLICATION_LOGGER = "org.springaicommunity.github.statusreport";

	public static void main(String[] args) {
		int exitCode = run(args, System.out);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args) {
		return run(args, System.out);
	}

	static int run(String[] args, PrintStream out) {
		ArgumentParser argumentParser = new ArgumentParser();

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration options;
		try {
			options = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error("{}", e.getMessage());
			out.println(argumentParser.generateHelpText());
			return 1;
		}

		if (options.debug) {
			enableDebugLogging();
		}

		try {
			ReportConfigurationLoader loader = new ReportConfigurationLoader();
			ReportConfiguration config = loader.load(options.configPaths());

			if (options.show) {
				out.print(showConfiguration(loader, config));
				return 0;
			}

			StatusReportBuilder builder = StatusReportBuilder.create().configuration(config).debug(options.debug);
			ReportRequest request = new ReportRequest(options.dryRun, null);
			if (options.cacheFile != null) {
				ItemCache cache = builder.fileCache(Path.of(options.cacheFile));
				request = request.withCache(cache);
			}

			logConfiguration(options, config);
			ReportRunResult result = builder.build().run(request);
			logResults(result);
			return 0;
		}
		catch (ReportConfigurationException e) {
			logger.error("Invalid configuration: {}", e.getMessage());
			return 1;
		}
		catch (RuntimeException e) {
			logger.error("Status report failed: {}", e.getMessage());
			if (options.debug) {
				logger.error("Stack trace:", e);
			}
			return 1;
		}
	}

	/**
	 * The effective configuration as YAML, preceded by the sources it was merged from.
	 */
	static String showConfiguration(ReportConfigurationLoader loader, ReportConfiguration config) {
		StringBuilder text = new StringBuilder();
		for (String source : loader.sources()) {
			text.append("# source: ").append(source).append('\n');
		}
		text.append(loader.toYaml(config));
		return text.toString();
	}

	static void enableDebugLogging() {
		if (LoggerFactory.getLogger(APPLICATION_LOGGER) instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration options, ReportConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Project: {}/{}", config.getOwner(), config.getProjectNumber());
		logger.info("  Team: {}", config.getTeam());
		logger.info("  Output directory: {}", config.getOutputDirectory());
		logger.info("  Sections: {}", config.getSections().size());
		logger.info("  Dry run: {}", options.dryRun);
		logger.info("  Cache file: {}", options.cacheFile != null ? options.cacheFile : "(none)");
	}

	private static void logResults(ReportRunResult result) {
		logger.info("Status report completed successfully!");
		logger.info("Items considered: {}{}", result.itemCount(), result.fromCache() ? " (from cache)" : "");
		logger.info("Reports written: {}", result.files().size());
		for (Path file : result.files()) {
			logger.info("  - {}", file);
		}
		logger.info("Items archived: {}", result.archivedItemIds().size());
	}

}
