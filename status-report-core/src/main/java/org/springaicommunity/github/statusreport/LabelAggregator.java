package org.springaicommunity.github.statusreport;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Counts how often each label occurs across a set of items.
 *
 * <p>
 * Labels are counted as-is: no trimming and no case folding, so {@code Bug} and
 * {@code bug} are counted separately.
 */
public final class LabelAggregator {

	private LabelAggregator() {
	}

	/**
	 * Count label occurrences.
	 * @param items the items to inspect
	 * @return label to number of occurrences, in no particular order
	 */
	public static Map<String, Integer> countLabels(List<Item> items) {
		Map<String, Integer> counts = new HashMap<>();
		for (Item item : items) {
			for (String label : item.labels()) {
				counts.merge(label, 1, Integer::sum);
			}
		}
		return counts;
	}

	/**
	 * Count label occurrences with the labels sorted for display.
	 * @param items the items to inspect
	 * @return label to number of occurrences, ordered by label
	 */
	public static SortedMap<String, Integer> sortedLabelCounts(List<Item> items) {
		return new TreeMap<>(countLabels(items));
	}

}
