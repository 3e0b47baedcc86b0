package org.springaicommunity.github.statusreport;

/**
 * Decides whether a single item satisfies a label, title prefix or repository/branch
 * rule.
 *
 * <p>
 * All rules use {@link GlobPattern} semantics: case-insensitive, trimmed, with {@code *},
 * {@code ?} and character sets. The string overloads compile the pattern on every call and
 * are meant for one-off checks; {@link SectionClassifier} compiles its patterns once.
 */
public final class ItemMatcher {

	private static final String WILDCARD = "*";

	private ItemMatcher() {
	}

	/**
	 * Returns true if any label of the item matches the glob. A lone {@code *} matches
	 * every item, labelled or not.
	 * @param item the item to test
	 * @param pattern the label glob
	 * @return true on match
	 * @throws ReportConfigurationException if the glob is malformed
	 */
	public static boolean matchesLabel(Item item, String pattern) {
		return matchesLabel(item, GlobPattern.compile(pattern));
	}

	/**
	 * Returns true if the beginning of the item title matches the glob.
	 * @param item the item to test
	 * @param pattern the prefix glob
	 * @return true on match
	 * @throws ReportConfigurationException if the glob is malformed
	 */
	public static boolean matchesPrefix(Item item, String pattern) {
		return matchesPrefix(item, GlobPattern.compilePrefix(pattern));
	}

	/**
	 * Returns true if the item is a change against a matching repository and branch.
	 * Items without a repository slug or without a branch (issues, drafts) never match.
	 * @param item the item to test
	 * @param org the owner glob
	 * @param repo the repository glob
	 * @param branchPattern the branch glob
	 * @return true on match
	 * @throws ReportConfigurationException if a glob is malformed
	 */
	public static boolean matchesBranch(Item item, String org, String repo, String branchPattern) {
		BranchMatch rule = new BranchMatch(org, repo, branchPattern);
		return matchesBranch(item, GlobPattern.compile(rule.slugGlob()), GlobPattern.compile(branchPattern));
	}

	static boolean matchesLabel(Item item, GlobPattern pattern) {
		if (WILDCARD.equals(pattern.glob())) {
			return true;
		}
		for (String label : item.labels()) {
			if (pattern.matches(label)) {
				return true;
			}
		}
		return false;
	}

	static boolean matchesPrefix(Item item, GlobPattern pattern) {
		return pattern.matches(item.title());
	}

	static boolean matchesBranch(Item item, GlobPattern slug, GlobPattern branch) {
		RepositoryInfo repository = item.repository();
		if (repository.slug().isBlank() || repository.branch().isBlank()) {
			return false;
		}
		return slug.matches(repository.slug()) && branch.matches(repository.branch());
	}

}
