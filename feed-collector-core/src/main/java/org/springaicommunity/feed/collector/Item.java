package org.springaicommunity.feed.collector;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

/**
 * A single normalized content entry extracted from a feed.
 *
 * <p>
 * Items are only ever created with a non-blank title and link. The identifier is
 * generated when the item is decoded and is never derived from its content, so decoding
 * the same feed twice yields items with different identifiers.
 *
 * @param id opaque unique identifier generated at decode time
 * @param sourceName name of the source the item was fetched from
 * @param title entity-decoded, whitespace-normalized title
 * @param link absolute URL of the entry
 * @param summary normalized summary text (null if the entry had none)
 * @param pubDate publication timestamp in UTC (null if absent or unparseable)
 */
public record Item(String id, String sourceName, String title, String link, @Nullable String summary,
		@Nullable Instant pubDate) {

	public Item {
		if (title == null || title.isBlank()) {
			throw new IllegalArgumentException("Item title must not be blank");
		}
		if (link == null || link.isBlank()) {
			throw new IllegalArgumentException("Item link must not be blank");
		}
	}

	/**
	 * Create an item with a freshly generated identifier.
	 * @param sourceName owning source name
	 * @param title normalized title
	 * @param link entry link
	 * @param summary normalized summary, or null
	 * @param pubDate publication time, or null
	 * @return new Item
	 */
	public static Item create(String sourceName, String title, String link, @Nullable String summary,
			@Nullable Instant pubDate) {
		return new Item(UUID.randomUUID().toString(), sourceName, title, link, summary, pubDate);
	}

}
