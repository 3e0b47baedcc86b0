package org.springaicommunity.github.statusreport;

/**
 * A repository and branch rule. All three values are globs; the org and repo globs are
 * joined with {@code /} and matched against the item's repository slug.
 *
 * @param org the owner glob, e.g. {@code xmidt-org} or {@code *}
 * @param repo the repository name glob
 * @param branch the base branch glob, e.g. {@code main} or {@code release/*}
 */
public record BranchMatch(String org, String repo, String branch) {

	public BranchMatch {
		org = org == null ? "" : org;
		repo = repo == null ? "" : repo;
		branch = branch == null ? "" : branch;
	}

	/**
	 * The slug glob formed from the org and repo globs.
	 * @return glob in "org/repo" form
	 */
	public String slugGlob() {
		return org.trim() + "/" + repo.trim();
	}

}
