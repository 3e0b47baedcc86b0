package org.springaicommunity.github.statusreport;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link GitHubClient} - GraphQL transport</li>
 * <li>{@link ProjectService} - Project board operations</li>
 * <li>{@link ReportRepository} - Report persistence</li>
 * <li>{@link ItemCache} - Item cache persistence</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   StatusReportService → Interfaces (NOT concrete implementations)
 *   Decorators → Interface they decorate
 *   Windowing, classification and rendering → no I/O
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.github.statusreport",
		importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule report_service_should_depend_on_interfaces = noClasses().that()
		.haveSimpleName("StatusReportService")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubProjectService")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("FileSystemReportRepository")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("FileItemCache")
		.because("StatusReportService should depend on ProjectService, ReportRepository and ItemCache");

	@ArchTest
	static final ArchRule services_should_depend_on_client_interface = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("RetryingGitHubClient")
		.because("Services should depend on the GitHubClient interface, not a concrete client");

	@ArchTest
	static final ArchRule services_should_not_use_http_directly = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.should()
		.accessClassesThat()
		.resideInAPackage("java.net.http..")
		.because("Services should reach GitHub through GitHubClient");

	// ========== No I/O in the Report Core ==========

	@ArchTest
	static final ArchRule report_core_should_not_do_io = noClasses().that()
		.haveSimpleName("SectionClassifier")
		.or()
		.haveSimpleName("ItemMatcher")
		.or()
		.haveSimpleName("GlobPattern")
		.or()
		.haveSimpleName("WeeklyWindowBuilder")
		.or()
		.haveSimpleName("LabelAggregator")
		.or()
		.haveSimpleName("StatusReportGenerator")
		.or()
		.haveSimpleName("MarkdownReportRenderer")
		.should()
		.dependOnClassesThat()
		.resideInAnyPackage("java.nio.file..", "java.net.http..")
		.because("Windowing, classification and rendering work on in-memory items only");

	// ========== Decorator Rules ==========

	@ArchTest
	static final ArchRule github_client_decorators_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("GitHubClient")
		.and()
		.doNotHaveSimpleName("GitHubClient")
		.should()
		.implement(GitHubClient.class)
		.because("All *GitHubClient classes should implement the GitHubClient interface");

	@ArchTest
	static final ArchRule decorators_should_not_depend_on_concrete_http_client = noClasses().that()
		.haveSimpleName("RetryingGitHubClient")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Decorators should depend on the GitHubClient interface, not concrete implementation");

	// ========== Implementation Rules ==========

	@ArchTest
	static final ArchRule repositories_should_implement_interface = classes().that()
		.haveSimpleNameStartingWith("FileSystem")
		.and()
		.haveSimpleNameEndingWith("Repository")
		.should()
		.implement(ReportRepository.class)
		.because("Report persistence goes through the ReportRepository interface");

}
