package org.springaicommunity.feed.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link FeedHttpClient} backed by the JDK {@link HttpClient}.
 *
 * <p>
 * Follows redirects, applies a connect timeout and a per-request timeout, and treats
 * every non-2xx status as a transport failure.
 */
public class JdkFeedHttpClient implements FeedHttpClient {

	private static final Logger logger = LoggerFactory.getLogger(JdkFeedHttpClient.class);

	private static final String ACCEPT = "application/rss+xml, application/atom+xml, application/xml;q=0.9, "
			+ "text/xml;q=0.9, */*;q=0.8";

	private final HttpClient httpClient;

	private final Duration requestTimeout;

	private final String userAgent;

	public JdkFeedHttpClient() {
		this(new CollectorProperties());
	}

	public JdkFeedHttpClient(CollectorProperties properties) {
		this.requestTimeout = properties.getRequestTimeout();
		this.userAgent = properties.getUserAgent();
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(properties.getConnectTimeout())
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public byte[] get(String url) {
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request;
		try {
			request = HttpRequest.newBuilder()
				.uri(URI.create(url))
				.timeout(requestTimeout)
				.header("Accept", ACCEPT)
				.header("User-Agent", userAgent)
				.GET()
				.build();
		}
		catch (IllegalArgumentException e) {
			throw new FeedCollectorException(FeedCollectorException.ErrorKind.TRANSPORT,
					"Invalid feed URL " + url + ": " + e.getMessage(), e);
		}

		try {
			byte[] body = executeRequest(request);
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start, body.length);
			return body;
		}
		catch (FeedCollectorException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	private byte[] executeRequest(HttpRequest request) {
		try {
			HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			throw new FeedCollectorException(FeedCollectorException.ErrorKind.TRANSPORT,
					"HTTP " + statusCode + " from " + request.uri());
		}
		catch (IOException e) {
			throw new FeedCollectorException(FeedCollectorException.ErrorKind.TRANSPORT,
					"Request to " + request.uri() + " failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new FeedCollectorException(FeedCollectorException.ErrorKind.TRANSPORT,
					"Request to " + request.uri() + " interrupted", e);
		}
	}

}
