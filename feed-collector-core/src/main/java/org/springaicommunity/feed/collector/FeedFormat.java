package org.springaicommunity.feed.collector;

/**
 * One supported feed schema.
 *
 * <p>
 * Implementations never throw for malformed input; they report a structural mismatch
 * through {@link DecodeAttempt#failure(String, String)} so that {@link FeedDecoder} can
 * move on to the next format.
 */
public interface FeedFormat {

	/**
	 * Short name used in log and error messages (e.g. "RSS").
	 * @return format name
	 */
	String name();

	/**
	 * Try to read the given response body as this format.
	 * @param content raw response bytes
	 * @param sourceName name stamped on every produced item
	 * @return success with the extracted items, or failure with a reason
	 */
	DecodeAttempt attempt(byte[] content, String sourceName);

}
