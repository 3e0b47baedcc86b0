package org.springaicommunity.github.statusreport;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the complete report cycle: load the project items, write one report per complete
 * week and archive every reported item so that the next run starts from a clean board.
 *
 * <p>
 * The configuration is validated at the start of every run. Settings that are only
 * needed to talk to GitHub (owner, project number, token) are only required when the run
 * actually fetches or archives.
 */
public class StatusReportService {

	private static final Logger logger = LoggerFactory.getLogger(StatusReportService.class);

	private final ReportConfiguration config;

	private final ProjectService projectService;

	private final ReportRepository reportRepository;

	private final Clock clock;

	public StatusReportService(ReportConfiguration config, ProjectService projectService,
			ReportRepository reportRepository, Clock clock) {
		this.config = config;
		this.projectService = projectService;
		this.reportRepository = reportRepository;
		this.clock = clock;
	}

	/**
	 * Execute one run.
	 * @param request the run parameters
	 * @return what was written and archived
	 * @throws ReportConfigurationException if the configuration is invalid; nothing is
	 * written in that case
	 */
	public ReportRunResult run(ReportRequest request) {
		ItemCache cache = request.cache();
		boolean fromCache = cache != null && cache.exists();
		ReportConfigurationValidator.validate(config, !fromCache || !request.dryRun());

		StatusReportGenerator generator = StatusReportGenerator.from(config);
		MarkdownReportRenderer renderer = new MarkdownReportRenderer(config);

		ProjectHandle project = new ProjectHandle();
		List<Item> items = fromCache ? cache.read() : fetch(project, cache);

		List<WeeklyReport> reports = generator.generate(items, clock.instant());
		List<Path> files = new ArrayList<>(reports.size());
		for (WeeklyReport report : reports) {
			files.add(reportRepository.save(report.window(), renderer.render(report)));
		}
		logger.info("Wrote {} weekly reports", files.size());

		List<String> archived = List.of();
		List<String> ids = StatusReportGenerator.archivableItemIds(reports);
		if (request.dryRun()) {
			logger.info("DRY RUN: {} items would be archived", ids.size());
		}
		else if (!ids.isEmpty()) {
			archived = archive(project, ids);
		}
		return new ReportRunResult(items.size(), reports, files, archived, fromCache);
	}

	private List<Item> fetch(ProjectHandle project, @Nullable ItemCache cache) {
		logger.info("Fetching items of project {}/{}", config.getOwner(), config.getProjectNumber());
		List<Item> items = projectService.fetchItems(project.id(), config.getTuning());
		if (cache != null) {
			cache.write(items);
		}
		return items;
	}

	private List<String> archive(ProjectHandle project, List<String> ids) {
		String projectId = project.id();
		List<String> archived = new ArrayList<>(ids.size());
		for (String id : ids) {
			projectService.archiveItem(projectId, id);
			archived.add(id);
		}
		logger.info("Archived {} items", archived.size());
		return archived;
	}

	/**
	 * Resolves the project id on first use, at most once per run.
	 */
	private final class ProjectHandle {

		private @Nullable String id;

		String id() {
			String resolved = id;
			if (resolved == null) {
				resolved = projectService.findProjectId(config.getOwner(), config.getProjectNumber());
				id = resolved;
			}
			return resolved;
		}

	}

}
