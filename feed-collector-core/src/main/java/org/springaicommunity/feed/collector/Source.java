package org.springaicommunity.feed.collector;

import java.util.List;

/**
 * A fetchable content source.
 *
 * <p>
 * {@link #fetch()} is the only operation that may block and the only one that may fail.
 * Implementations make a single attempt per call and never retry internally. Sources are
 * shared read-only between concurrent fetch units, so {@link #name()} and
 * {@link #address()} must be safe to call from any thread.
 */
public interface Source {

	/**
	 * Display name of this source, as given by configuration.
	 * @return source name
	 */
	String name();

	/**
	 * Endpoint address of this source.
	 * @return source URL
	 */
	String address();

	/**
	 * Retrieve and normalize the current items of this source.
	 * @return items in feed order (possibly empty)
	 * @throws FeedCollectorException if retrieval or decoding fails
	 */
	List<Item> fetch();

}
