package org.springaicommunity.github.statusreport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Routes items into the configured report sections.
 *
 * <p>
 * Sections are tried in the order they are configured. Within a section the three clause
 * families run in a fixed order (labels, then prefixes, then branches), and every family
 * only sees the items the previous families left over. Across sections, each section only
 * sees what the sections before it left over, and whatever no section claims ends up in
 * the unclassified section. Every input item therefore lands in exactly one section.
 *
 * <p>
 * Render order plays no part in matching.
 *
 * <p>
 * All patterns are compiled in the constructor, so a malformed pattern fails the run
 * before any item is looked at.
 */
public class SectionClassifier {

	private static final Logger logger = LoggerFactory.getLogger(SectionClassifier.class);

	private final List<CompiledSection> sections;

	private final SectionDefinition unclassified;

	/**
	 * Create a classifier.
	 * @param sections the user sections in matching order
	 * @param unclassified the section receiving items no user section claims
	 * @throws ReportConfigurationException if any pattern is malformed
	 */
	public SectionClassifier(List<SectionDefinition> sections, SectionDefinition unclassified) {
		List<CompiledSection> compiled = new ArrayList<>(sections.size());
		for (SectionDefinition section : sections) {
			compiled.add(CompiledSection.of(section));
		}
		this.sections = List.copyOf(compiled);
		this.unclassified = unclassified;
	}

	/**
	 * Split items into those matched by a single set of clauses and the rest.
	 * @param items the candidate items
	 * @param match the clauses to apply
	 * @return matched and remaining items
	 * @throws ReportConfigurationException if any pattern is malformed
	 */
	public static Extraction extract(List<Item> items, SectionMatch match) {
		return CompiledSection.of(new SectionDefinition("", 0, false, match)).extract(items);
	}

	/**
	 * Assign every item to exactly one section.
	 * @param items the items of one weekly window
	 * @return per-section results in matching order plus the unclassified result
	 */
	public Classification classify(List<Item> items) {
		List<SectionResult> results = new ArrayList<>(sections.size());
		List<Item> remaining = items;
		for (CompiledSection section : sections) {
			Extraction extraction = section.extract(remaining);
			results.add(new SectionResult(section.definition(), extraction.matched()));
			remaining = extraction.remaining();
			logger.debug("Section '{}' matched {} items, {} left", section.definition().name(),
					extraction.matched().size(), remaining.size());
		}
		return new Classification(results, new SectionResult(unclassified, remaining));
	}

	/**
	 * The outcome of applying one section's clauses.
	 *
	 * @param matched items claimed by the section, grouped by clause family
	 * @param remaining items left for later sections, in input order
	 */
	public record Extraction(List<Item> matched, List<Item> remaining) {

		public Extraction {
			matched = List.copyOf(matched);
			remaining = List.copyOf(remaining);
		}

	}

	/**
	 * The outcome of classifying the items of one window.
	 *
	 * @param sections results for the user sections, in matching order
	 * @param unclassified items no user section claimed
	 */
	public record Classification(List<SectionResult> sections, SectionResult unclassified) {

		public Classification {
			sections = List.copyOf(sections);
		}

		/**
		 * All results including the unclassified one, which comes last.
		 * @return every section result
		 */
		public List<SectionResult> all() {
			List<SectionResult> all = new ArrayList<>(sections);
			all.add(unclassified);
			return all;
		}

	}

	private record BranchRule(GlobPattern slug, GlobPattern branch) {

	}

	private record CompiledSection(SectionDefinition definition, List<GlobPattern> labels,
			List<GlobPattern> prefixes, List<BranchRule> branches) {

		static CompiledSection of(SectionDefinition definition) {
			SectionMatch match = definition.match();
			try {
				List<GlobPattern> labels = match.labels().stream().map(GlobPattern::compile).toList();
				List<GlobPattern> prefixes = match.prefixes().stream().map(GlobPattern::compilePrefix).toList();
				List<BranchRule> branches = match.branches()
					.stream()
					.map(b -> new BranchRule(GlobPattern.compile(b.slugGlob()), GlobPattern.compile(b.branch())))
					.toList();
				return new CompiledSection(definition, labels, prefixes, branches);
			}
			catch (ReportConfigurationException e) {
				throw new ReportConfigurationException(
						"Section '" + definition.name() + "' has an invalid pattern: " + e.getMessage(), e);
			}
		}

		Extraction extract(List<Item> items) {
			List<Item> matched = new ArrayList<>();
			List<Item> remaining = items;
			remaining = take(remaining, matched,
					item -> labels.stream().anyMatch(label -> ItemMatcher.matchesLabel(item, label)));
			remaining = take(remaining, matched,
					item -> prefixes.stream().anyMatch(prefix -> ItemMatcher.matchesPrefix(item, prefix)));
			for (BranchRule rule : branches) {
				remaining = take(remaining, matched, item -> ItemMatcher.matchesBranch(item, rule.slug(), rule.branch()));
			}
			return new Extraction(matched, remaining);
		}

		private static List<Item> take(List<Item> pool, List<Item> matched, Predicate<Item> predicate) {
			List<Item> left = new ArrayList<>(pool.size());
			for (Item item : pool) {
				if (predicate.test(item)) {
					matched.add(item);
				}
				else {
					left.add(item);
				}
			}
			return left;
		}

	}

}
