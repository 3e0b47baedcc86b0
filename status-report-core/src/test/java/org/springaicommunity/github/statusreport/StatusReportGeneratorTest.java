package org.springaicommunity.github.statusreport;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StatusReportGenerator Tests")
class StatusReportGeneratorTest {

	private static final Instant NOW = Instant.parse("2022-08-07T15:30:00Z");

	private static final SectionDefinition UNCLASSIFIED = SectionDefinition.catchAll("Unclassified Items", 1000, true);

	private final Item deployment = TestItems.item("deploy")
		.done()
		.title("Roll out")
		.labels("deployment")
		.completedAt("2022-08-01T10:00:00Z")
		.build();

	private final Item update = TestItems.item("update")
		.done()
		.title("Update Something")
		.pullRequest("org/repo", "main")
		.completedAt("2022-08-03T10:00:00Z")
		.build();

	private final Item old = TestItems.item("old").done().title("Other").completedAt("2022-07-20T10:00:00Z").build();

	private final Item todo = TestItems.item("todo")
		.status("In Progress")
		.labels("deployment")
		.completedAt("2022-08-02T10:00:00Z")
		.build();

	private StatusReportGenerator generator(List<SectionDefinition> sections) {
		return new StatusReportGenerator(new WeeklyWindowBuilder(), new SectionClassifier(sections, UNCLASSIFIED));
	}

	@Nested
	@DisplayName("Report Generation")
	class GenerationTest {

		@Test
		@DisplayName("Should classify each week and key sections by render order")
		void shouldClassifyEachWeek() {
			SectionDefinition deployments = new SectionDefinition("Deployments", 2, false,
					SectionMatch.labels("deployment"));
			SectionDefinition updates = new SectionDefinition("Updates", 1, false,
					SectionMatch.branches(new BranchMatch("org", "*", "main")));

			List<WeeklyReport> reports = generator(List.of(deployments, updates)).generate(List.of(deployment, update, old, todo),
					NOW);

			assertThat(reports).hasSize(3);

			WeeklyReport latest = reports.get(0);
			assertThat(latest.sections().keySet()).containsExactly(1, 2, 1000);
			assertThat(latest.sections().get(1).items()).containsExactly(update);
			assertThat(latest.sections().get(2).items()).containsExactly(deployment);
			assertThat(latest.sections().get(1000).items()).isEmpty();
			assertThat(latest.sections().get(1000).isOmitted()).isTrue();
			assertThat(latest.labelCounts()).containsExactly(entry("deployment", 1));
			assertThat(latest.itemCount()).isEqualTo(2);

			assertThat(reports.get(1).itemCount()).isZero();
			assertThat(reports.get(1).sections()).hasSize(3);

			assertThat(reports.get(2).sections().get(1000).items()).containsExactly(old);
		}

		@Test
		@DisplayName("Should ignore items that are not done")
		void shouldIgnoreItemsNotDone() {
			List<WeeklyReport> reports = generator(List.of()).generate(List.of(todo), NOW);

			assertThat(reports).isEmpty();
		}

		@Test
		@DisplayName("Should reject sections sharing a render order")
		void shouldRejectDuplicateRenderOrder() {
			SectionDefinition first = new SectionDefinition("First", 5, false, SectionMatch.labels("a"));
			SectionDefinition second = new SectionDefinition("Second", 5, false, SectionMatch.labels("b"));

			assertThatThrownBy(() -> generator(List.of(first, second)).generate(List.of(deployment), NOW))
				.isInstanceOf(ReportConfigurationException.class)
				.hasMessageContaining("'First'")
				.hasMessageContaining("'Second'")
				.hasMessageContaining("render_order 5");
		}

		@Test
		@DisplayName("Should build a generator from configuration")
		void shouldBuildFromConfiguration() {
			ReportConfiguration config = new ReportConfiguration();
			List<SectionDefinition> sections = new ArrayList<>();
			sections.add(new SectionDefinition("Deployments", 1, false, SectionMatch.labels("deploy*")));
			config.setSections(sections);

			List<WeeklyReport> reports = StatusReportGenerator.from(config).generate(List.of(deployment, old), NOW);

			assertThat(reports.get(0).sections().get(1).items()).containsExactly(deployment);
			assertThat(reports.get(0).sections().get(1000).section().name()).isEqualTo("Unclassified Items");
		}

	}

	@Test
	@DisplayName("Should list every windowed item as archivable")
	void shouldListArchivableItems() {
		List<WeeklyReport> reports = generator(List.of()).generate(List.of(old, update, deployment, todo), NOW);

		assertThat(StatusReportGenerator.archivableItemIds(reports)).containsExactly("deploy", "update", "old");
	}

}
