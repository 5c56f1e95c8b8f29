package org.springaicommunity.feed.collector;

import java.time.Duration;

/**
 * Configuration properties for feed collection.
 *
 * <p>
 * Properties can be set directly via setters, read from the environment with
 * {@link #fromEnvironment()}, or bound by {@link FeedCollectorConfig}. Default values
 * suit interactive use: a 10 second budget per source and no limit on concurrent
 * fetches.
 */
public class CollectorProperties {

	static final String FETCH_TIMEOUT_VARIABLE = "FEED_FETCH_TIMEOUT_SECONDS";

	static final String MAX_CONCURRENT_FETCHES_VARIABLE = "FEED_MAX_CONCURRENT_FETCHES";

	static final String REQUEST_TIMEOUT_VARIABLE = "FEED_REQUEST_TIMEOUT_SECONDS";

	static final String USER_AGENT_VARIABLE = "FEED_USER_AGENT";

	/**
	 * Time budget of a single source within a run.
	 */
	private Duration fetchTimeout = FetchOrchestrator.DEFAULT_TIMEOUT;

	/**
	 * Maximum number of fetches in flight at once (0 means unbounded).
	 */
	private int maxConcurrentFetches = 0;

	/**
	 * TCP connect timeout of the HTTP client.
	 */
	private Duration connectTimeout = Duration.ofSeconds(10);

	/**
	 * Timeout of a single HTTP request, bounding abandoned fetches.
	 */
	private Duration requestTimeout = Duration.ofSeconds(30);

	/**
	 * User-Agent header sent with every request.
	 */
	private String userAgent = "feed-collector/1.0";

	/**
	 * Create properties from the defaults overridden by {@code FEED_*} environment
	 * variables (see {@link EnvironmentSupport}).
	 * @return properties
	 * @throws FeedCollectorException of kind {@code CONFIG} if a variable is malformed
	 */
	public static CollectorProperties fromEnvironment() {
		CollectorProperties properties = new CollectorProperties();
		properties.setFetchTimeout(EnvironmentSupport.getSeconds(FETCH_TIMEOUT_VARIABLE, properties.getFetchTimeout()));
		properties.setMaxConcurrentFetches(
				EnvironmentSupport.getInt(MAX_CONCURRENT_FETCHES_VARIABLE, properties.getMaxConcurrentFetches()));
		properties.setRequestTimeout(
				EnvironmentSupport.getSeconds(REQUEST_TIMEOUT_VARIABLE, properties.getRequestTimeout()));
		String userAgent = EnvironmentSupport.get(USER_AGENT_VARIABLE);
		if (userAgent != null) {
			properties.setUserAgent(userAgent);
		}
		return properties;
	}

	/**
	 * Returns the per-source time budget.
	 * @return the fetch timeout
	 */
	public Duration getFetchTimeout() {
		return fetchTimeout;
	}

	/**
	 * Sets the per-source time budget.
	 * @param fetchTimeout positive duration
	 */
	public void setFetchTimeout(Duration fetchTimeout) {
		requirePositive("fetchTimeout", fetchTimeout);
		this.fetchTimeout = fetchTimeout;
	}

	/**
	 * Returns the maximum number of concurrent fetches.
	 * @return the limit, 0 for unbounded
	 */
	public int getMaxConcurrentFetches() {
		return maxConcurrentFetches;
	}

	/**
	 * Sets the maximum number of concurrent fetches.
	 * @param maxConcurrentFetches the limit, 0 for unbounded
	 */
	public void setMaxConcurrentFetches(int maxConcurrentFetches) {
		if (maxConcurrentFetches < 0) {
			throw new FeedCollectorException(FeedCollectorException.ErrorKind.CONFIG,
					"maxConcurrentFetches must not be negative, got " + maxConcurrentFetches);
		}
		this.maxConcurrentFetches = maxConcurrentFetches;
	}

	/**
	 * Returns the HTTP connect timeout.
	 * @return the connect timeout
	 */
	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	/**
	 * Sets the HTTP connect timeout.
	 * @param connectTimeout positive duration
	 */
	public void setConnectTimeout(Duration connectTimeout) {
		requirePositive("connectTimeout", connectTimeout);
		this.connectTimeout = connectTimeout;
	}

	/**
	 * Returns the HTTP request timeout.
	 * @return the request timeout
	 */
	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	/**
	 * Sets the HTTP request timeout.
	 * @param requestTimeout positive duration
	 */
	public void setRequestTimeout(Duration requestTimeout) {
		requirePositive("requestTimeout", requestTimeout);
		this.requestTimeout = requestTimeout;
	}

	/**
	 * Returns the User-Agent header value.
	 * @return the user agent
	 */
	public String getUserAgent() {
		return userAgent;
	}

	/**
	 * Sets the User-Agent header value.
	 * @param userAgent non-blank user agent
	 */
	public void setUserAgent(String userAgent) {
		if (userAgent.isBlank()) {
			throw new FeedCollectorException(FeedCollectorException.ErrorKind.CONFIG, "userAgent must not be blank");
		}
		this.userAgent = userAgent;
	}

	private static void requirePositive(String name, Duration value) {
		if (value.isNegative() || value.isZero()) {
			throw new FeedCollectorException(FeedCollectorException.ErrorKind.CONFIG,
					name + " must be positive, got " + value);
		}
	}

}
