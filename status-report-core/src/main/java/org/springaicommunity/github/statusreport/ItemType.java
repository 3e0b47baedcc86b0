package org.springaicommunity.github.statusreport;

/**
 * The kind of content a project item wraps.
 */
public enum ItemType {

	ISSUE,

	PULL_REQUEST,

	/**
	 * A draft issue that only exists on the project board. Drafts have no repository and
	 * never carry a branch.
	 */
	DRAFT_ISSUE

}
