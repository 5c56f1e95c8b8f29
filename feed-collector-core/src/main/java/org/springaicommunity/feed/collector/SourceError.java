package org.springaicommunity.feed.collector;

/**
 * One failed source as recorded in {@link RunStats}.
 *
 * @param sourceName name of the failed source
 * @param description human-readable failure description
 */
public record SourceError(String sourceName, String description) {
}
