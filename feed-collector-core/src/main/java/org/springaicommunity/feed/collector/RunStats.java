package org.springaicommunity.feed.collector;

import java.util.List;

/**
 * Aggregate statistics of one fetch run.
 *
 * <p>
 * For a completed run {@code succeeded + failed == totalSources} and
 * {@code errors.size() == failed}. Errors are listed in the order the failures arrived.
 *
 * @param totalSources number of sources in the run
 * @param succeeded sources that produced a result
 * @param failed sources that failed or timed out
 * @param totalItems items contributed by successful sources
 * @param errors per-source failures in arrival order
 */
public record RunStats(int totalSources, int succeeded, int failed, int totalItems, List<SourceError> errors) {

	public RunStats {
		errors = List.copyOf(errors);
	}

	/**
	 * Statistics at the start of a run, before any outcome has arrived.
	 * @param totalSources number of sources in the run
	 * @return zeroed stats
	 */
	public static RunStats empty(int totalSources) {
		return new RunStats(totalSources, 0, 0, 0, List.of());
	}

	/**
	 * One-line run summary, e.g. {@code "Fetched 12 items from 3 of 4 sources"}.
	 * @return summary text
	 */
	public String summary() {
		return "Fetched " + totalItems + " items from " + succeeded + " of " + totalSources + " sources";
	}

}
