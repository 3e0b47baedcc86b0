package org.springaicommunity.github.statusreport;

import java.util.List;

/**
 * Operations on a GitHub ProjectV2 board.
 *
 * <p>
 * Extracted to enable mocking in tests.
 */
public interface ProjectService {

	/**
	 * Look up the node id of an organization project.
	 * @param owner the organization login
	 * @param number the project number
	 * @return the project node id
	 * @throws GitHubHttpClient.GitHubApiException if the project cannot be found
	 */
	String findProjectId(String owner, int number);

	/**
	 * Fetch every item of the project, following pagination to the end.
	 * @param projectId the project node id
	 * @param tuning page and nested list sizes
	 * @return all items in board order
	 */
	List<Item> fetchItems(String projectId, ReportConfiguration.Tuning tuning);

	/**
	 * Archive an item on the board.
	 * @param projectId the project node id
	 * @param itemId the project item id
	 */
	void archiveItem(String projectId, String itemId);

	/**
	 * Restore an archived item.
	 * @param projectId the project node id
	 * @param itemId the project item id
	 */
	void unarchiveItem(String projectId, String itemId);

}
