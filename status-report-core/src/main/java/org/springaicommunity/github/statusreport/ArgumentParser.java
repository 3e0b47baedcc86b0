package org.springaicommunity.github.statusreport;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the status report tool. Pure Java implementation with
 * no Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-f", "--file":
					config.configFiles.add(getRequiredValue(args, i, "file"));
					i++;
					break;

				case "-s", "--show":
					config.show = true;
					break;

				case "-d", "--dry-run":
					config.dryRun = true;
					break;

				case "--cache-file":
					config.cacheFile = getRequiredValue(args, i, "cache-file");
					i++;
					break;

				case "--debug":
					config.debug = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("--file=")) {
						config.configFiles.add(arg.substring("--file=".length()));
					}
					else if (arg.startsWith("--cache-file=")) {
						config.cacheFile = arg.substring("--cache-file=".length());
					}
					else if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					else {
						throw new IllegalArgumentException("Unexpected argument: " + arg);
					}
					break;
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-status-report [OPTIONS]\n");
		help.append("\n");
		help.append("Write weekly status reports from the done items of a GitHub project board\n");
		help.append("and archive the reported items.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -f, --file PATH         Configuration file or directory (repeatable, later wins)\n");
		help.append("    -s, --show              Print the effective configuration and exit\n");
		help.append("    -d, --dry-run           Write the reports but do not archive any item\n");
		help.append("    --cache-file PATH       Read items from PATH if it exists, otherwise fetch\n");
		help.append("                            them and save them to PATH\n");
		help.append("    --debug                 Verbose logging, including GraphQL queries\n");
		help.append("\n");
		help.append("ENVIRONMENT:\n");
		help.append("    Configuration values may reference variables as ${NAME}. The default\n");
		help.append("    token is ${GITHUB_TOKEN}. Variables missing from the process environment\n");
		help.append("    are looked up in a .env file in the working or home directory.\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-status-report -f team.yml\n");
		help.append("    github-status-report -f config/ --dry-run --cache-file items.json\n");
		help.append("    github-status-report -f team.yml --show\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		for (String file : config.configFiles) {
			if (file.isBlank()) {
				errors.add("Configuration file path cannot be empty");
			}
		}

		if (config.cacheFile != null && config.cacheFile.isBlank()) {
			errors.add("Cache file path cannot be empty");
		}

		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Configuration validation failed:\n  - " + String.join("\n  - ", errors));
		}
	}

}
