package org.springaicommunity.feed.collector;

/**
 * Interface for retrieving raw feed documents.
 *
 * <p>
 * Abstracts the transport so that {@link FeedSource} can be tested with mocks and so
 * that callers can plug in their own HTTP stack.
 */
public interface FeedHttpClient {

	/**
	 * Execute a GET request.
	 * @param url absolute feed URL
	 * @return response body bytes
	 * @throws FeedCollectorException of kind {@code TRANSPORT} if the request fails or
	 * the response status is not 2xx
	 */
	byte[] get(String url);

}
