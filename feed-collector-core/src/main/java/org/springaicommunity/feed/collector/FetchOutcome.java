package org.springaicommunity.feed.collector;

import java.util.List;

/**
 * Result of one source's fetch within a run: either {@link Success} or {@link Failure}.
 *
 * <p>
 * Exactly one outcome is produced per source per run.
 */
public interface FetchOutcome {

	String sourceName();

	/**
	 * The source was fetched and decoded.
	 *
	 * @param sourceName source name
	 * @param items decoded items (possibly empty)
	 */
	record Success(String sourceName, List<Item> items) implements FetchOutcome {

		public Success {
			items = List.copyOf(items);
		}

	}

	/**
	 * The source failed or timed out.
	 *
	 * @param sourceName source name
	 * @param errorDescription human-readable description, prefixed with the error label
	 */
	record Failure(String sourceName, String errorDescription) implements FetchOutcome {
	}

}
