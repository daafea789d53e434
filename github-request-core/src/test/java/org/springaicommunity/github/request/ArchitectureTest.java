package org.springaicommunity.github.request;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Layers</h3> <pre>
 *   GitHubClient / Endpoint      (facade)
 *        ↓
 *   RequestDispatcher, PaginationIterator
 *        ↓
 *   RetryPolicy, MutationThrottle  |  GitHubTransport (interface)
 *                                         ↑
 *                                   JdkHttpTransport
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.github.request", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Transport Rules ==========

	@ArchTest
	static final ArchRule dispatcher_should_depend_on_transport_interface = noClasses().that()
		.haveSimpleNameStartingWith("RequestDispatcher")
		.or()
		.haveSimpleNameStartingWith("PaginationIterator")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("JdkHttpTransport")
		.because("The dispatcher should only talk to the GitHubTransport interface");

	@ArchTest
	static final ArchRule transports_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("Transport")
		.and()
		.doNotHaveSimpleName("GitHubTransport")
		.should()
		.implement(GitHubTransport.class)
		.because("All *Transport classes should implement the GitHubTransport interface");

	@ArchTest
	static final ArchRule only_transport_should_use_http_client = noClasses().that()
		.doNotHaveSimpleName("JdkHttpTransport")
		.should()
		.dependOnClassesThat()
		.belongToAnyOf(java.net.http.HttpClient.class, java.net.http.HttpRequest.class)
		.because("Only JdkHttpTransport should send HTTP requests");

	// ========== Decision Logic Rules ==========

	@ArchTest
	static final ArchRule retry_policy_should_not_perform_io = noClasses().that()
		.haveSimpleNameStartingWith("RetryPolicy")
		.or()
		.haveSimpleNameStartingWith("RetryConfig")
		.or()
		.haveSimpleNameStartingWith("MutationThrottle")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Transport")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("Sleeper")
		.because("Retry and pacing decisions are pure functions of their inputs");

	@ArchTest
	static final ArchRule lower_layers_should_not_depend_on_facade = noClasses().that()
		.haveSimpleNameStartingWith("RequestDispatcher")
		.or()
		.haveSimpleNameStartingWith("PaginationIterator")
		.or()
		.haveSimpleNameStartingWith("RetryPolicy")
		.or()
		.haveSimpleNameStartingWith("JdkHttpTransport")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubClient")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("Endpoint")
		.because("Only the facade composes the lower layers");

	// ========== Error Rules ==========

	@ArchTest
	static final ArchRule exceptions_should_extend_base = classes().that()
		.haveSimpleNameEndingWith("Exception")
		.and()
		.doNotHaveSimpleName("GitHubRequestException")
		.should()
		.beAssignableTo(GitHubRequestException.class)
		.because("All errors raised by the library share the GitHubRequestException root");

	// ========== Configuration Rules ==========

	@ArchTest
	static final ArchRule only_config_should_use_spring = noClasses().that()
		.doNotHaveSimpleName("GitHubRequestConfig")
		.should()
		.dependOnClassesThat()
		.resideInAPackage("org.springframework..")
		.because("The library is usable without Spring; only GitHubRequestConfig wires it into a context");

	@ArchTest
	static final ArchRule only_environment_should_use_dotenv = noClasses().that()
		.doNotHaveSimpleName("GitHubEnvironment")
		.should()
		.dependOnClassesThat()
		.resideInAPackage("io.github.cdimascio..")
		.because("Environment lookup is centralised in GitHubEnvironment");

}
