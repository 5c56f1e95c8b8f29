package org.springaicommunity.feed.collector;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds per-source {@link FetchOutcome}s into {@link RunStats}.
 *
 * <p>
 * Not thread-safe. The orchestrator records outcomes from the calling thread after all
 * fetch units have finished.
 */
public class StatsAggregator {

	private final int totalSources;

	private int succeeded;

	private int failed;

	private int totalItems;

	private final List<SourceError> errors = new ArrayList<>();

	public StatsAggregator(int totalSources) {
		if (totalSources < 0) {
			throw new IllegalArgumentException("totalSources must not be negative: " + totalSources);
		}
		this.totalSources = totalSources;
	}

	public void record(FetchOutcome outcome) {
		if (outcome instanceof FetchOutcome.Success success) {
			succeeded++;
			totalItems += success.items().size();
		}
		else if (outcome instanceof FetchOutcome.Failure failure) {
			failed++;
			errors.add(new SourceError(failure.sourceName(), failure.errorDescription()));
		}
		else {
			throw new IllegalArgumentException("Unknown outcome type: " + outcome.getClass().getName());
		}
	}

	public RunStats toStats() {
		return new RunStats(totalSources, succeeded, failed, totalItems, errors);
	}

}
