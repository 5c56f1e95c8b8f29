package org.springaicommunity.feed.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Spring configuration for the feed collector beans.
 *
 * <p>
 * Settings are read from {@code feed.collector.*} properties and fall back to the
 * {@link CollectorProperties} defaults.
 */
@Configuration
public class FeedCollectorConfig {

	@Value("${feed.collector.fetch-timeout-seconds:10}")
	private int fetchTimeoutSeconds;

	@Value("${feed.collector.max-concurrent-fetches:0}")
	private int maxConcurrentFetches;

	@Value("${feed.collector.connect-timeout-seconds:10}")
	private int connectTimeoutSeconds;

	@Value("${feed.collector.request-timeout-seconds:30}")
	private int requestTimeoutSeconds;

	@Value("${feed.collector.user-agent:feed-collector/1.0}")
	private String userAgent;

	@Bean
	public CollectorProperties collectorProperties() {
		CollectorProperties properties = new CollectorProperties();
		properties.setFetchTimeout(Duration.ofSeconds(fetchTimeoutSeconds));
		properties.setMaxConcurrentFetches(maxConcurrentFetches);
		properties.setConnectTimeout(Duration.ofSeconds(connectTimeoutSeconds));
		properties.setRequestTimeout(Duration.ofSeconds(requestTimeoutSeconds));
		properties.setUserAgent(userAgent);
		return properties;
	}

	@Bean
	public FeedHttpClient feedHttpClient(CollectorProperties collectorProperties) {
		return new JdkFeedHttpClient(collectorProperties);
	}

	@Bean
	public FeedDecoder feedDecoder() {
		return new FeedDecoder();
	}

	@Bean(destroyMethod = "close")
	public FetchOrchestrator fetchOrchestrator(CollectorProperties collectorProperties) {
		return new FetchOrchestrator(collectorProperties);
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

}
