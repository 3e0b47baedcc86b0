package org.springaicommunity.github.statusreport;

import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Renders a {@link WeeklyReport} as a markdown document.
 *
 * <p>
 * The document starts with the title and the team heading, followed by the item sections,
 * the optional label summary and the optional free text summary, all placed by ascending
 * render order.
 */
public class MarkdownReportRenderer {

	private static final DateTimeFormatter TITLE_DATE = DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH);

	private final String team;

	private final ReportConfiguration.LabelSection labelSection;

	private final ReportConfiguration.Summary summary;

	public MarkdownReportRenderer(ReportConfiguration config) {
		this(config.getTeam(), config.getLabelSection(), config.getSummary());
	}

	public MarkdownReportRenderer(String team, ReportConfiguration.LabelSection labelSection,
			ReportConfiguration.Summary summary) {
		this.team = team;
		this.labelSection = labelSection;
		this.summary = summary;
	}

	/**
	 * Render one weekly report.
	 * @param report the report to render
	 * @return the markdown text
	 */
	public String render(WeeklyReport report) {
		SortedMap<Integer, String> parts = new TreeMap<>();
		for (Map.Entry<Integer, SectionResult> entry : report.sections().entrySet()) {
			parts.put(entry.getKey(), renderSection(entry.getValue()));
		}
		if (labelSection.isEnabled()) {
			parts.put(labelSection.getRenderOrder(), renderLabels(report.labelCounts()));
		}
		if (summary.isEnabled()) {
			parts.put(summary.getRenderOrder(), "\n## " + summary.getName() + "\n\n" + summary.getBody() + "\n\n");
		}

		StringBuilder markdown = new StringBuilder();
		markdown.append("# Status Report: ")
			.append(TITLE_DATE.format(report.window().firstDay()))
			.append(" ... ")
			.append(TITLE_DATE.format(report.window().lastDay()))
			.append("\n\n## ")
			.append(team)
			.append("\n\n");
		parts.values().forEach(markdown::append);
		return markdown.toString();
	}

	private static String renderSection(SectionResult result) {
		if (result.isOmitted()) {
			return "";
		}
		StringBuilder section = new StringBuilder();
		section.append("\n## ").append(result.section().name()).append(" (").append(result.items().size()).append(")\n\n");
		for (Item item : result.items()) {
			section.append(String.format("- %s **[[#%d](%s)]** ([%s](%s))\n", item.title(), item.number(), item.url(),
					item.repository().slug(), item.repository().url()));
		}
		return section.toString();
	}

	private static String renderLabels(SortedMap<String, Integer> labelCounts) {
		StringBuilder labels = new StringBuilder("\n## By Label\n\n");
		labelCounts.forEach((label, count) -> labels.append("- ").append(label).append(" (").append(count).append(")\n"));
		return labels.toString();
	}

}
