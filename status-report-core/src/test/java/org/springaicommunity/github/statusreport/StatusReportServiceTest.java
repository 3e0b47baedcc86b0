package org.springaicommunity.github.statusreport;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for StatusReportService with a mocked ProjectService. NO real GitHub API calls.
 */
@DisplayName("StatusReportService Tests - Mocked ProjectService")
@ExtendWith(MockitoExtension.class)
class StatusReportServiceTest {

	private static final Clock CLOCK = Clock.fixed(Instant.parse("2022-08-07T15:30:00Z"), ZoneOffset.UTC);

	@Mock
	private ProjectService projectService;

	@TempDir
	Path tempDir;

	private ReportConfiguration config;

	private Path reportDir;

	private final List<Item> items = List.of(
			TestItems.item("deploy")
				.done()
				.title("Roll out")
				.labels("deployment")
				.completedAt("2022-08-01T10:00:00Z")
				.build(),
			TestItems.item("update")
				.done()
				.title("Update Something")
				.pullRequest("org/repo", "main")
				.completedAt("2022-08-03T10:00:00Z")
				.build(),
			TestItems.doneAt("old", "2022-07-20T10:00:00Z"),
			TestItems.item("todo").status("Todo").completedAt("2022-08-02T10:00:00Z").build());

	@BeforeEach
	void setUp() {
		config = new ReportConfiguration();
		config.setOwner("xmidt-org");
		config.setProjectNumber(4);
		config.setToken("ghp_secret");
		config.setTeam("Platform");
		List<SectionDefinition> sections = new ArrayList<>();
		sections.add(new SectionDefinition("Deployments", 1, false, SectionMatch.labels("deployment")));
		sections.add(new SectionDefinition("Updates", 2, true, SectionMatch.prefixes("Update")));
		config.setSections(sections);
		reportDir = tempDir.resolve("reports");
	}

	private StatusReportService service() {
		return new StatusReportService(config, projectService, new FileSystemReportRepository(reportDir), CLOCK);
	}

	@Nested
	@DisplayName("Fetching From GitHub")
	class FetchTest {

		@Test
		@DisplayName("Should write one report per week and archive every reported item")
		void shouldWriteReportsAndArchive() throws IOException {
			when(projectService.findProjectId("xmidt-org", 4)).thenReturn("PVT_1");
			when(projectService.fetchItems(eq("PVT_1"), any())).thenReturn(items);

			ReportRunResult result = service().run(ReportRequest.archiving());

			assertThat(result.itemCount()).isEqualTo(4);
			assertThat(result.fromCache()).isFalse();
			assertThat(result.files()).extracting(path -> path.getFileName().toString())
				.containsExactly("2022.07.31-2022.08.06.md", "2022.07.24-2022.07.30.md", "2022.07.17-2022.07.23.md");
			assertThat(Files.readString(result.files().get(0))).contains("## Deployments (1)")
				.contains("## Updates (1)")
				.contains("- Update Something");
			assertThat(Files.readString(result.files().get(1))).contains("## Deployments (0)")
				.doesNotContain("Updates");
			assertThat(result.archivedItemIds()).containsExactly("deploy", "update", "old");

			InOrder inOrder = inOrder(projectService);
			inOrder.verify(projectService).findProjectId("xmidt-org", 4);
			inOrder.verify(projectService).fetchItems(eq("PVT_1"), any());
			inOrder.verify(projectService).archiveItem("PVT_1", "deploy");
			inOrder.verify(projectService).archiveItem("PVT_1", "update");
			inOrder.verify(projectService).archiveItem("PVT_1", "old");
			verify(projectService, times(1)).findProjectId(anyString(), anyInt());
			verifyNoMoreInteractions(projectService);
		}

		@Test
		@DisplayName("Should not archive anything on a dry run")
		void shouldNotArchiveOnDryRun() {
			when(projectService.findProjectId("xmidt-org", 4)).thenReturn("PVT_1");
			when(projectService.fetchItems(eq("PVT_1"), any())).thenReturn(items);

			ReportRunResult result = service().run(ReportRequest.preview());

			assertThat(result.files()).hasSize(3);
			assertThat(result.archivedItemIds()).isEmpty();
			verify(projectService, never()).archiveItem(anyString(), anyString());
		}

		@Test
		@DisplayName("Should save fetched items to the cache")
		void shouldWriteCache() {
			when(projectService.findProjectId("xmidt-org", 4)).thenReturn("PVT_1");
			when(projectService.fetchItems(eq("PVT_1"), any())).thenReturn(items);
			FileItemCache cache = new FileItemCache(tempDir.resolve("items.json"), ObjectMapperFactory.create());

			service().run(ReportRequest.preview().withCache(cache));

			assertThat(cache.exists()).isTrue();
			assertThat(cache.read()).containsExactlyElementsOf(items);
		}

		@Test
		@DisplayName("Should propagate GitHub failures without archiving")
		void shouldPropagateFetchFailures() {
			when(projectService.findProjectId("xmidt-org", 4)).thenReturn("PVT_1");
			when(projectService.fetchItems(eq("PVT_1"), any()))
				.thenThrow(new GitHubHttpClient.GitHubApiException("GitHub API error: 502", 502, ""));

			assertThatThrownBy(() -> service().run(ReportRequest.archiving()))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class);
			assertThat(reportDir).doesNotExist();
			verify(projectService, never()).archiveItem(anyString(), anyString());
		}

	}

	@Nested
	@DisplayName("Working From Cache")
	class CacheTest {

		private FileItemCache cache;

		@BeforeEach
		void writeCache() {
			cache = new FileItemCache(tempDir.resolve("items.json"), ObjectMapperFactory.create());
			cache.write(items);
		}

		@Test
		@DisplayName("Should render from the cache without contacting GitHub on a dry run")
		void shouldWorkOfflineOnDryRun() {
			config.setToken("");
			config.setOwner("");
			config.setProjectNumber(0);

			ReportRunResult result = service().run(ReportRequest.preview().withCache(cache));

			assertThat(result.fromCache()).isTrue();
			assertThat(result.files()).hasSize(3);
			verifyNoInteractions(projectService);
		}

		@Test
		@DisplayName("Should archive cached items when not a dry run")
		void shouldArchiveCachedItems() {
			when(projectService.findProjectId("xmidt-org", 4)).thenReturn("PVT_1");

			ReportRunResult result = service().run(ReportRequest.archiving().withCache(cache));

			assertThat(result.archivedItemIds()).containsExactly("deploy", "update", "old");
			verify(projectService, never()).fetchItems(anyString(), any());
		}

		@Test
		@DisplayName("Should require GitHub settings to archive cached items")
		void shouldRequireRemoteSettingsToArchive() {
			config.setToken("");

			assertThatThrownBy(() -> service().run(ReportRequest.archiving().withCache(cache)))
				.isInstanceOf(ReportConfigurationException.class)
				.hasMessageContaining("token must be set");
		}

	}

	@Test
	@DisplayName("Should write nothing when the configuration is invalid")
	void shouldWriteNothingForInvalidConfiguration() {
		config.getSections().add(new SectionDefinition("Broken", 3, false, SectionMatch.labels("[abc")));

		assertThatThrownBy(() -> service().run(ReportRequest.archiving()))
			.isInstanceOf(ReportConfigurationException.class)
			.hasMessageStartingWith("Configuration validation failed:");
		assertThat(reportDir).doesNotExist();
		verifyNoInteractions(projectService);
	}

}
