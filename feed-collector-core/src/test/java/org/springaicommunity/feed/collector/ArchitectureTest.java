package org.springaicommunity.feed.collector;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link Source} - a fetchable content source</li>
 * <li>{@link FeedHttpClient} - transport for raw feed bytes</li>
 * <li>{@link FeedFormat} - one supported feed schema</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Orchestrator → Source (NOT FeedSource, NOT the transport)
 *   FeedSource → FeedHttpClient (NOT JdkFeedHttpClient)
 *   Decoding → no transport, no orchestration
 *   Only builder and Spring config pick concrete implementations
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.feed.collector", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule orchestrator_should_depend_on_source_contract_only = noClasses().that()
		.haveSimpleNameStartingWith("FetchOrchestrator")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("FeedSource")
		.orShould()
		.dependOnClassesThat()
		.areAssignableTo(FeedHttpClient.class)
		.because("The orchestrator works against the Source contract, not a transport");

	@ArchTest
	static final ArchRule feed_source_should_depend_on_client_interface = noClasses().that()
		.haveSimpleName("FeedSource")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("JdkFeedHttpClient")
		.because("FeedSource should depend on the FeedHttpClient interface");

	// ========== Decoding Layer Rules ==========

	@ArchTest
	static final ArchRule decoding_should_not_depend_on_transport_or_orchestration = noClasses().that()
		.haveSimpleNameEndingWith("Format")
		.or()
		.haveSimpleName("FeedDecoder")
		.or()
		.haveSimpleName("FeedText")
		.or()
		.haveSimpleName("FeedDates")
		.should()
		.dependOnClassesThat()
		.areAssignableTo(FeedHttpClient.class)
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameStartingWith("FetchOrchestrator")
		.orShould()
		.accessClassesThat()
		.resideInAPackage("java.net.http..")
		.because("Decoding turns bytes into items and knows nothing about how the bytes were fetched");

	@ArchTest
	static final ArchRule formats_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("Format")
		.and()
		.doNotHaveSimpleName("FeedFormat")
		.and()
		.areTopLevelClasses()
		.should()
		.implement(FeedFormat.class)
		.because("All *Format classes should implement the FeedFormat interface");

	@ArchTest
	static final ArchRule http_clients_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("HttpClient")
		.and()
		.doNotHaveSimpleName("FeedHttpClient")
		.should()
		.implement(FeedHttpClient.class)
		.because("All *HttpClient classes should implement the FeedHttpClient interface");

	// ========== Model Independence ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_services = noClasses().that()
		.haveSimpleName("Item")
		.or()
		.haveSimpleName("RunStats")
		.or()
		.haveSimpleName("SourceError")
		.or()
		.haveSimpleName("FetchRun")
		.or()
		.haveSimpleName("SourceDefinition")
		.or()
		.haveSimpleNameStartingWith("FetchOutcome")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Orchestrator")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("FeedDecoder")
		.orShould()
		.dependOnClassesThat()
		.areAssignableTo(FeedHttpClient.class)
		.because("Model classes should be pure data without service dependencies");

	// ========== Builder/Configuration Rules ==========

	@ArchTest
	static final ArchRule only_wiring_should_instantiate_jdk_client = noClasses().that()
		.doNotHaveSimpleName("FeedCollectorBuilder")
		.and()
		.doNotHaveSimpleName("FeedCollectorConfig")
		.and()
		.doNotHaveSimpleName("JdkFeedHttpClient")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("JdkFeedHttpClient")
		.because("Only FeedCollectorBuilder and FeedCollectorConfig should create the concrete transport");

	@ArchTest
	static final ArchRule spring_should_stay_in_configuration = noClasses().that()
		.doNotHaveSimpleName("FeedCollectorConfig")
		.should()
		.dependOnClassesThat()
		.resideInAPackage("org.springframework..")
		.because("The library is usable without Spring; only FeedCollectorConfig wires it into a context");

}
