package org.springaicommunity.github.statusreport;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * The matching clauses of one section. Clauses are a logical OR: an item belongs to the
 * section if any label, prefix or branch rule matches it.
 *
 * @param labels label globs, compared case-insensitively against each label
 * @param prefixes title prefix globs
 * @param branches repository and branch rules
 */
public record SectionMatch(List<String> labels, List<String> prefixes, List<BranchMatch> branches) {

	/**
	 * A match that selects nothing, used by the unclassified section.
	 */
	public static final SectionMatch NONE = new SectionMatch(List.of(), List.of(), List.of());

	public SectionMatch {
		labels = labels == null ? List.of() : List.copyOf(labels);
		prefixes = prefixes == null ? List.of() : List.copyOf(prefixes);
		branches = branches == null ? List.of() : List.copyOf(branches);
	}

	public static SectionMatch labels(String... labels) {
		return new SectionMatch(List.of(labels), List.of(), List.of());
	}

	public static SectionMatch prefixes(String... prefixes) {
		return new SectionMatch(List.of(), List.of(prefixes), List.of());
	}

	public static SectionMatch branches(BranchMatch... branches) {
		return new SectionMatch(List.of(), List.of(), List.of(branches));
	}

	/**
	 * Returns true if no clause is configured.
	 * @return true if this match can never select an item
	 */
	@JsonIgnore
	public boolean isEmpty() {
		return labels.isEmpty() && prefixes.isEmpty() && branches.isEmpty();
	}

}
