package org.springaicommunity.github.statusreport;

import org.jspecify.annotations.Nullable;

/**
 * Parameters of one report run.
 *
 * @param dryRun write the reports but leave the project board untouched
 * @param cache local item cache; when it holds items GitHub is not queried for them, when
 * it is empty it receives the fetched items (null to always fetch)
 */
public record ReportRequest(boolean dryRun, @Nullable ItemCache cache) {

	/**
	 * A run that fetches from GitHub and archives the reported items.
	 * @return the request
	 */
	public static ReportRequest archiving() {
		return new ReportRequest(false, null);
	}

	/**
	 * A run that fetches from GitHub without archiving.
	 * @return the request
	 */
	public static ReportRequest preview() {
		return new ReportRequest(true, null);
	}

	/**
	 * Returns a copy of this request using the given cache.
	 * @param cache the item cache
	 * @return new request
	 */
	public ReportRequest withCache(ItemCache cache) {
		return new ReportRequest(dryRun, cache);
	}

}
