package org.springaicommunity.feed.collector;

import java.util.List;

/**
 * A {@link Source} that downloads its feed over HTTP and decodes it with a
 * {@link FeedDecoder}.
 *
 * <p>
 * The client and decoder are shared read-only collaborators, so many sources can be
 * fetched concurrently.
 */
public class FeedSource implements Source {

	private final String name;

	private final String address;

	private final FeedHttpClient httpClient;

	private final FeedDecoder decoder;

	public FeedSource(String name, String address, FeedHttpClient httpClient, FeedDecoder decoder) {
		this.name = name;
		this.address = address;
		this.httpClient = httpClient;
		this.decoder = decoder;
	}

	public FeedSource(SourceDefinition definition, FeedHttpClient httpClient, FeedDecoder decoder) {
		this(definition.name(), definition.address(), httpClient, decoder);
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public String address() {
		return address;
	}

	@Override
	public List<Item> fetch() {
		byte[] content = httpClient.get(address);
		return decoder.decode(content, name);
	}

	@Override
	public String toString() {
		return "FeedSource[" + name + " -> " + address + "]";
	}

}
