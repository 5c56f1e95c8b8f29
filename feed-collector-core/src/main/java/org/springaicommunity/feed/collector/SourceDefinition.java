package org.springaicommunity.feed.collector;

/**
 * A configured {@code (name, address)} pair from which a {@link Source} is built.
 *
 * <p>
 * The configuration layer guarantees a non-empty name and a well-formed HTTP(S) address;
 * nothing in this package validates them again.
 *
 * @param name display name of the source
 * @param address feed URL
 */
public record SourceDefinition(String name, String address) {
}
