package org.springaicommunity.feed.collector;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Result of trying to read a response body with one {@link FeedFormat}.
 *
 * <p>
 * A successful attempt may carry zero items: a structurally valid feed whose entries
 * were all skipped is still a success.
 *
 * @param format name of the format that was tried
 * @param items decoded items (empty when the attempt failed)
 * @param failureReason why the body is not of this format (null on success)
 */
public record DecodeAttempt(String format, List<Item> items, @Nullable String failureReason) {

	public static DecodeAttempt success(String format, List<Item> items) {
		return new DecodeAttempt(format, List.copyOf(items), null);
	}

	public static DecodeAttempt failure(String format, String reason) {
		return new DecodeAttempt(format, List.of(), reason);
	}

	public boolean succeeded() {
		return failureReason == null;
	}

}
