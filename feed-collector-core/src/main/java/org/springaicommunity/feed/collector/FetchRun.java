package org.springaicommunity.feed.collector;

import java.util.List;

/**
 * Items and statistics of one {@link FetchOrchestrator#fetchAll} call.
 *
 * @param items items of all successful sources, grouped by source in completion order
 * @param stats run statistics
 */
public record FetchRun(List<Item> items, RunStats stats) {

	public FetchRun {
		items = List.copyOf(items);
	}

}
