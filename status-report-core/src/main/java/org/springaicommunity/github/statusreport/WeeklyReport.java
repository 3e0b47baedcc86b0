package org.springaicommunity.github.statusreport;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Classification results for one weekly window, ready for rendering.
 *
 * @param window the week and its items
 * @param sections section results keyed by render order, including the unclassified
 * section
 * @param labelCounts label occurrences across all items of the window, sorted by label
 */
public record WeeklyReport(WeeklyWindow window, SortedMap<Integer, SectionResult> sections,
		SortedMap<String, Integer> labelCounts) {

	public WeeklyReport {
		sections = Collections.unmodifiableSortedMap(new TreeMap<>(sections));
		labelCounts = Collections.unmodifiableSortedMap(new TreeMap<>(labelCounts));
	}

	/**
	 * Number of items in the window.
	 * @return item count
	 */
	public int itemCount() {
		return window.items().size();
	}

}
