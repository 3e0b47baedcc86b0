package org.springaicommunity.github.statusreport;

import java.util.List;

/**
 * The items assigned to one section of one weekly report.
 *
 * @param section the section definition
 * @param items the matched items, in matching order
 */
public record SectionResult(SectionDefinition section, List<Item> items) {

	public SectionResult {
		items = List.copyOf(items);
	}

	/**
	 * Returns true if the section is configured to disappear when empty and is empty.
	 * @return true if the renderer should skip this section
	 */
	public boolean isOmitted() {
		return section.omitIfEmpty() && items.isEmpty();
	}

}
