package org.springaicommunity.github.statusreport;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A user defined report section.
 *
 * <p>
 * The position of a section in the configured list decides matching precedence: an item
 * lands in the first section that matches it. {@code renderOrder} only decides where the
 * section is placed in the rendered report.
 *
 * @param name the heading of the section
 * @param renderOrder placement in the report, lowest first
 * @param omitIfEmpty leave the section out of the report when no item matched
 * @param match the matching clauses
 */
public record SectionDefinition(String name, int renderOrder, boolean omitIfEmpty,
		@JsonProperty("match_on") SectionMatch match) {

	public SectionDefinition {
		name = name == null ? "" : name;
		match = match == null ? SectionMatch.NONE : match;
	}

	/**
	 * Create a section without matching clauses, such as the unclassified section.
	 * @param name the heading
	 * @param renderOrder placement in the report
	 * @param omitIfEmpty leave out when empty
	 * @return the section definition
	 */
	public static SectionDefinition catchAll(String name, int renderOrder, boolean omitIfEmpty) {
		return new SectionDefinition(name, renderOrder, omitIfEmpty, SectionMatch.NONE);
	}

}
