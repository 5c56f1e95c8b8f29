package org.springaicommunity.feed.collector;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Builder for wiring feed sources and the orchestrator without Spring.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * FeedCollectorBuilder builder = FeedCollectorBuilder.create().propertiesFromEnv();
 *
 * List<Source> sources = builder.buildSources(List.of(
 *     new SourceDefinition("Tech News", "https://example.com/rss"),
 *     new SourceDefinition("Release Notes", "https://example.org/atom.xml")));
 *
 * try (FetchOrchestrator orchestrator = builder.buildOrchestrator()) {
 *     FetchRun run = orchestrator.fetchAll(sources);
 * }
 *
 * // For testing with a mock transport
 * FeedHttpClient mockClient = mock(FeedHttpClient.class);
 * Source source = FeedCollectorBuilder.create()
 *     .httpClient(mockClient)
 *     .buildSource("Test", "https://example.com/feed");
 * }
 * </pre>
 */
public class FeedCollectorBuilder {

	private CollectorProperties properties;

	private @Nullable FeedHttpClient httpClient;

	private @Nullable FeedDecoder decoder;

	private FeedCollectorBuilder() {
		this.properties = new CollectorProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new FeedCollectorBuilder
	 */
	public static FeedCollectorBuilder create() {
		return new FeedCollectorBuilder();
	}

	/**
	 * Set collection properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public FeedCollectorBuilder properties(@Nullable CollectorProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Read collection properties from {@code FEED_*} environment variables.
	 * @return this builder
	 * @throws FeedCollectorException of kind {@code CONFIG} if a variable is malformed
	 */
	public FeedCollectorBuilder propertiesFromEnv() {
		this.properties = CollectorProperties.fromEnvironment();
		return this;
	}

	/**
	 * Set a custom transport. Useful for testing with mocks or for plugging in another
	 * HTTP stack.
	 * @param httpClient custom client (null to use the JDK client)
	 * @return this builder
	 */
	public FeedCollectorBuilder httpClient(@Nullable FeedHttpClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom decoder, e.g. one with additional formats.
	 * @param decoder custom decoder (null to use RSS then Atom)
	 * @return this builder
	 */
	public FeedCollectorBuilder decoder(@Nullable FeedDecoder decoder) {
		this.decoder = decoder;
		return this;
	}

	/**
	 * Build an orchestrator using the configured timeout and concurrency limit. The
	 * caller owns it and should close it.
	 * @return new FetchOrchestrator
	 */
	public FetchOrchestrator buildOrchestrator() {
		return new FetchOrchestrator(properties);
	}

	/**
	 * Build one network-backed source.
	 * @param name display name
	 * @param address feed URL
	 * @return new Source
	 */
	public Source buildSource(String name, String address) {
		return buildSources(List.of(new SourceDefinition(name, address))).get(0);
	}

	/**
	 * Build network-backed sources sharing one transport and decoder.
	 * @param definitions configured name and address pairs
	 * @return sources in definition order
	 */
	public List<Source> buildSources(List<SourceDefinition> definitions) {
		FeedHttpClient client = this.httpClient != null ? this.httpClient : new JdkFeedHttpClient(properties);
		FeedDecoder feedDecoder = this.decoder != null ? this.decoder : new FeedDecoder();
		return definitions.stream()
			.<Source>map(definition -> new FeedSource(definition, client, feedDecoder))
			.toList();
	}

	public CollectorProperties getProperties() {
		return properties;
	}

}
