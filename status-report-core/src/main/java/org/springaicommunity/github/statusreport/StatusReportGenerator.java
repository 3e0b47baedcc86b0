package org.springaicommunity.github.statusreport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Turns a flat list of project items into weekly reports.
 *
 * <p>
 * Done items are grouped into weekly windows; the items of each window are classified
 * into sections once and their labels are counted once. The result is keyed by render
 * order so that a renderer only has to iterate.
 */
public class StatusReportGenerator {

	private static final Logger logger = LoggerFactory.getLogger(StatusReportGenerator.class);

	private final WeeklyWindowBuilder windowBuilder;

	private final SectionClassifier classifier;

	public StatusReportGenerator(WeeklyWindowBuilder windowBuilder, SectionClassifier classifier) {
		this.windowBuilder = windowBuilder;
		this.classifier = classifier;
	}

	/**
	 * Create a generator for a configuration.
	 * @param config a validated configuration
	 * @return the generator
	 * @throws ReportConfigurationException if a section pattern is malformed
	 */
	public static StatusReportGenerator from(ReportConfiguration config) {
		return new StatusReportGenerator(new WeeklyWindowBuilder(config.getReportWindow().anchorDay()),
				new SectionClassifier(config.getSections(), config.getUnclassified().toDefinition()));
	}

	/**
	 * Generate the reports for all complete weeks.
	 * @param items every item of the project, in discovery order
	 * @param now the reference instant deciding where the current week starts
	 * @return one report per window, most recent first
	 */
	public List<WeeklyReport> generate(List<Item> items, Instant now) {
		List<Item> done = items.stream().filter(Item::isDone).toList();
		logger.info("{} of {} items are done", done.size(), items.size());

		List<WeeklyReport> reports = new ArrayList<>();
		for (WeeklyWindow window : windowBuilder.splitByWeeks(done, now)) {
			reports.add(report(window));
		}
		return reports;
	}

	/**
	 * The ids of every item placed in any of the reports.
	 * @param reports the generated reports
	 * @return item ids, in report order
	 */
	public static List<String> archivableItemIds(List<WeeklyReport> reports) {
		List<String> ids = new ArrayList<>();
		for (WeeklyReport report : reports) {
			for (Item item : report.window().items()) {
				ids.add(item.id());
			}
		}
		return ids;
	}

	private WeeklyReport report(WeeklyWindow window) {
		SectionClassifier.Classification classification = classifier.classify(window.items());
		SortedMap<Integer, SectionResult> sections = new TreeMap<>();
		for (SectionResult result : classification.all()) {
			SectionResult previous = sections.putIfAbsent(result.section().renderOrder(), result);
			if (previous != null) {
				throw new ReportConfigurationException("Sections '" + previous.section().name() + "' and '"
						+ result.section().name() + "' share render_order " + result.section().renderOrder());
			}
		}
		return new WeeklyReport(window, sections, LabelAggregator.sortedLabelCounts(window.items()));
	}

}
