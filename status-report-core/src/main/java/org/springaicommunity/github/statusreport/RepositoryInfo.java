package org.springaicommunity.github.statusreport;

/**
 * The repository that owns an item.
 *
 * <p>
 * Draft issues belong to no repository and use {@link #NONE}. The branch is only set for
 * pull requests, where it holds the base branch the change targets.
 *
 * @param name the repository name (without owner)
 * @param slug the full repository name in "owner/repo" format
 * @param url the web URL for the repository
 * @param branch the base branch of a pull request, empty otherwise
 */
public record RepositoryInfo(String name, String slug, String url, String branch) {

	/**
	 * Placeholder for items without a repository.
	 */
	public static final RepositoryInfo NONE = new RepositoryInfo("", "", "", "");

	/**
	 * Create repository information for an issue, which carries no branch.
	 * @param name the repository name
	 * @param slug the "owner/repo" slug
	 * @param url the repository URL
	 * @return repository information with an empty branch
	 */
	public static RepositoryInfo of(String name, String slug, String url) {
		return new RepositoryInfo(name, slug, url, "");
	}

	/**
	 * Return a copy of this repository information targeting the given branch.
	 * @param branch the base branch name
	 * @return new repository information
	 */
	public RepositoryInfo withBranch(String branch) {
		return new RepositoryInfo(name, slug, url, branch);
	}

}
