package org.springaicommunity.github.statusreport;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a report run.
 *
 * @param itemCount the number of project items considered
 * @param reports the generated reports, most recent week first
 * @param files the written report files, in the order of {@code reports}
 * @param archivedItemIds the items archived on the board, empty for dry runs
 * @param fromCache whether the items were read from the local cache
 */
public record ReportRunResult(int itemCount, List<WeeklyReport> reports, List<Path> files,
		List<String> archivedItemIds, boolean fromCache) {

	public ReportRunResult {
		reports = List.copyOf(reports);
		files = List.copyOf(files);
		archivedItemIds = List.copyOf(archivedItemIds);
	}

}
