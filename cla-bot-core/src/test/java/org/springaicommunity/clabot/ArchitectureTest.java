package org.springaicommunity.clabot;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Dependency rules between the bot's layers.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link GitHubClient} - HTTP operations for the GitHub REST API</li>
 * <li>{@link PlatformClient} - pull request, label, status and comment operations</li>
 * <li>{@link AgreementClient} - agreement service operations</li>
 * <li>{@link AgreementRecordRepository} - persistent CLA state</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Reconcilers → Interfaces (NOT concrete clients or the JDBC store)
 *   Decorators → Interface they decorate
 *   Only ClaBotBuilder wires concrete implementations
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.clabot", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule handlers_should_not_depend_on_concrete_clients = noClasses().that()
		.haveSimpleNameEndingWith("Reconciler")
		.or()
		.haveSimpleName("ResendCommandHandler")
		.or()
		.haveSimpleName("PullRequestStatusUpdater")
		.or()
		.haveSimpleName("ExemptionPolicy")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubPlatformClient")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("ConcordAgreementClient")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("JdbcAgreementRecordRepository")
		.because("Handlers should depend on PlatformClient, AgreementClient and AgreementRecordRepository");

	@ArchTest
	static final ArchRule handlers_should_not_use_jdbc = noClasses().that()
		.haveSimpleNameEndingWith("Reconciler")
		.or()
		.haveSimpleName("ResendCommandHandler")
		.should()
		.dependOnClassesThat()
		.resideInAnyPackage("org.springframework.jdbc..", "java.sql..")
		.because("Handlers should reach the database through AgreementRecordRepository");

	@ArchTest
	static final ArchRule platform_client_should_use_client_interface = noClasses().that()
		.haveSimpleName("GitHubPlatformClient")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("RetryingGitHubClient")
		.because("GitHubPlatformClient should depend on the GitHubClient interface");

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
	static final ArchRule platform_clients_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("PlatformClient")
		.and()
		.doNotHaveSimpleName("PlatformClient")
		.should()
		.implement(PlatformClient.class);

	@ArchTest
	static final ArchRule agreement_clients_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("AgreementClient")
		.and()
		.doNotHaveSimpleName("AgreementClient")
		.should()
		.implement(AgreementClient.class);

	// ========== Model Independence ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_handlers = noClasses().that()
		.haveSimpleNameEndingWith("Event")
		.or()
		.haveSimpleNameEndingWith("Request")
		.or()
		.haveSimpleNameEndingWith("Summary")
		.or()
		.haveSimpleName("ContributorAgreement")
		.or()
		.haveSimpleName("TrackedPullRequest")
		.or()
		.haveSimpleName("PullRequestDetails")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Reconciler")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Client")
		.because("Model classes should be pure data");

	// ========== Builder Rules ==========

	@ArchTest
	static final ArchRule only_builder_should_use_concrete_clients = noClasses().that()
		.doNotHaveSimpleName("ClaBotBuilder")
		.and()
		.doNotHaveSimpleName("GitHubPlatformClient")
		.and()
		.doNotHaveSimpleName("ConcordAgreementClient")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubPlatformClient")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("ConcordAgreementClient")
		.because("Only ClaBotBuilder should create concrete clients");

}
