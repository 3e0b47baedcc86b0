package org.springaicommunity.github.statusreport;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Builder for a {@link StatusReportService} without Spring.
 *
 * <pre>
 * {@code
 * ReportConfiguration config = new ReportConfigurationLoader().load(List.of(Path.of("team.yml")));
 * ReportRunResult result = StatusReportBuilder.create()
 *     .configuration(config)
 *     .build()
 *     .run(ReportRequest.archiving());
 *
 * // For testing with a mock project service
 * ProjectService projects = mock(ProjectService.class);
 * StatusReportService service = StatusReportBuilder.create()
 *     .configuration(config)
 *     .projectService(projects)
 *     .clock(Clock.fixed(now, ZoneOffset.UTC))
 *     .build();
 * }
 * </pre>
 */
public class StatusReportBuilder {

	private ReportConfiguration configuration = new ReportConfiguration();

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private @Nullable ProjectService projectService;

	private @Nullable ReportRepository reportRepository;

	private Clock clock = Clock.systemUTC();

	private boolean debug;

	private StatusReportBuilder() {
	}

	public static StatusReportBuilder create() {
		return new StatusReportBuilder();
	}

	/**
	 * Set the report configuration.
	 * @param configuration the loaded configuration
	 * @return this builder
	 */
	public StatusReportBuilder configuration(ReportConfiguration configuration) {
		this.configuration = configuration;
		return this;
	}

	/**
	 * Set a custom ObjectMapper for GraphQL payloads.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public StatusReportBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient. When unset, a {@link GitHubHttpClient} for the configured
	 * URL and token wrapped in a {@link RetryingGitHubClient} is used.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public StatusReportBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom ProjectService, bypassing the GitHub client entirely.
	 * @param projectService custom ProjectService implementation (null to use default)
	 * @return this builder
	 */
	public StatusReportBuilder projectService(@Nullable ProjectService projectService) {
		this.projectService = projectService;
		return this;
	}

	/**
	 * Set a custom ReportRepository. When unset, reports are written to the configured
	 * output directory.
	 * @param reportRepository custom ReportRepository implementation (null to use default)
	 * @return this builder
	 */
	public StatusReportBuilder reportRepository(@Nullable ReportRepository reportRepository) {
		this.reportRepository = reportRepository;
		return this;
	}

	public StatusReportBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Log GraphQL queries at DEBUG.
	 * @param debug true to log queries
	 * @return this builder
	 */
	public StatusReportBuilder debug(boolean debug) {
		this.debug = debug;
		return this;
	}

	/**
	 * Create a file based item cache using this builder's ObjectMapper.
	 * @param file the cache file
	 * @return the cache
	 */
	public ItemCache fileCache(Path file) {
		return new FileItemCache(file, mapper());
	}

	/**
	 * Build the StatusReportService.
	 * @return configured StatusReportService
	 */
	public StatusReportService build() {
		Components components = buildComponents();
		return new StatusReportService(configuration, components.projectService(), components.reportRepository(),
				clock);
	}

	private Components buildComponents() {
		ObjectMapper mapper = mapper();
		ProjectService projects = this.projectService;
		if (projects == null) {
			GitHubClient client = this.httpClient != null ? this.httpClient
					: RetryingGitHubClient.builder()
						.wrapping(new GitHubHttpClient(configuration.getUrl(), configuration.getToken()))
						.build();
			projects = new GitHubProjectService(client, mapper, new ProjectItemParser(), debug);
		}
		ReportRepository repository = this.reportRepository != null ? this.reportRepository
				: new FileSystemReportRepository(Path.of(configuration.getOutputDirectory()));
		return new Components(projects, repository);
	}

	private ObjectMapper mapper() {
		return objectMapper != null ? objectMapper : ObjectMapperFactory.create();
	}

	private record Components(ProjectService projectService, ReportRepository reportRepository) {
	}

}
