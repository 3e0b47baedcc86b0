package org.springaicommunity.github.statusreport;

import java.nio.file.Path;

/**
 * Destination of rendered weekly reports.
 */
public interface ReportRepository {

	/**
	 * Store the rendered report of one window.
	 * @param window the window the report covers, used to name the report
	 * @param content the rendered markdown
	 * @return where the report was written
	 */
	Path save(WeeklyWindow window, String content);

}
