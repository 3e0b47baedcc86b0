package org.springaicommunity.github.statusreport;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a {@link ReportConfiguration} before any item is processed.
 *
 * <p>
 * All problems are collected and reported together in a single
 * {@link ReportConfigurationException}.
 */
public final class ReportConfigurationValidator {

	private ReportConfigurationValidator() {
	}

	/**
	 * Validate the configuration and fail with every problem found.
	 * @param config the configuration to check
	 * @param remoteAccess whether the run talks to GitHub, which requires owner, project
	 * number and token
	 * @throws ReportConfigurationException if the configuration is not usable
	 */
	public static void validate(ReportConfiguration config, boolean remoteAccess) {
		List<String> problems = findProblems(config, remoteAccess);
		if (!problems.isEmpty()) {
			StringBuilder message = new StringBuilder("Configuration validation failed:");
			for (String problem : problems) {
				message.append("\n  - ").append(problem);
			}
			throw new ReportConfigurationException(message.toString());
		}
	}

	/**
	 * Collect the problems of a configuration.
	 * @param config the configuration to check
	 * @param remoteAccess whether GitHub settings are required
	 * @return problem descriptions, empty if the configuration is valid
	 */
	public static List<String> findProblems(ReportConfiguration config, boolean remoteAccess) {
		List<String> problems = new ArrayList<>();

		if (remoteAccess) {
			if (config.getUrl().isBlank()) {
				problems.add("url must not be empty");
			}
			if (config.getOwner().isBlank()) {
				problems.add("owner must be set");
			}
			if (config.getProjectNumber() <= 0) {
				problems.add("project_number must be positive");
			}
			if (config.getToken().isBlank()) {
				problems.add("token must be set (e.g. token: ${GITHUB_TOKEN})");
			}
		}

		ReportConfiguration.Tuning tuning = config.getTuning();
		requirePositive(problems, "tuning.issue_count", tuning.getIssueCount());
		requirePositive(problems, "tuning.label_count", tuning.getLabelCount());
		requirePositive(problems, "tuning.field_value_count", tuning.getFieldValueCount());

		try {
			config.getReportWindow().anchorDay();
		}
		catch (IllegalArgumentException e) {
			problems.add("report_window.start_on_weekday '" + config.getReportWindow().getStartOnWeekday()
					+ "' is not a weekday");
		}

		if (config.getUnclassified().getName().isBlank()) {
			problems.add("unclassified.name must not be empty");
		}
		if (config.getSummary().isEnabled() && config.getSummary().getName().isBlank()) {
			problems.add("summary.name must not be empty");
		}

		List<SectionDefinition> sections = config.getSections();
		for (int i = 0; i < sections.size(); i++) {
			checkSection(problems, i, sections.get(i));
		}

		checkRenderOrders(problems, config);
		return problems;
	}

	private static void checkSection(List<String> problems, int index, SectionDefinition section) {
		String label = section.name().isBlank() ? "sections[" + index + "]" : "Section '" + section.name() + "'";
		if (section.name().isBlank()) {
			problems.add(label + " has no name");
		}
		SectionMatch match = section.match();
		if (match.isEmpty()) {
			problems.add(label + " has no match_on clauses");
		}
		for (BranchMatch branch : match.branches()) {
			if (branch.org().isBlank() || branch.repo().isBlank() || branch.branch().isBlank()) {
				problems.add(label + " has a branch rule without org, repo and branch");
			}
		}
		try {
			SectionClassifier.extract(List.of(), match);
		}
		catch (ReportConfigurationException e) {
			problems.add(label + " has an invalid pattern: " + e.getMessage());
		}
	}

	private static void checkRenderOrders(List<String> problems, ReportConfiguration config) {
		Map<Integer, String> owners = new HashMap<>();
		for (SectionDefinition section : config.getSections()) {
			claim(problems, owners, section.renderOrder(), "section '" + section.name() + "'");
		}
		claim(problems, owners, config.getUnclassified().getRenderOrder(), "unclassified section");
		if (config.getLabelSection().isEnabled()) {
			claim(problems, owners, config.getLabelSection().getRenderOrder(), "label section");
		}
		if (config.getSummary().isEnabled()) {
			claim(problems, owners, config.getSummary().getRenderOrder(), "summary section");
		}
	}

	private static void claim(List<String> problems, Map<Integer, String> owners, int renderOrder, String owner) {
		String previous = owners.putIfAbsent(renderOrder, owner);
		if (previous != null) {
			problems.add("render_order " + renderOrder + " is used by both " + previous + " and " + owner);
		}
	}

	private static void requirePositive(List<String> problems, String key, int value) {
		if (value <= 0) {
			problems.add(key + " must be positive");
		}
	}

}
