package org.springaicommunity.feed.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a raw feed response body into normalized {@link Item}s.
 *
 * <p>
 * Formats are tried in order and the first one that recognizes the document wins, even
 * if every entry in it was skipped. When no format recognizes the body a
 * {@link FeedCollectorException} of kind {@code DECODE} is thrown that names the source
 * and lists why each format rejected it.
 *
 * <p>
 * Instances are stateless and safe to share between concurrent fetches.
 */
public class FeedDecoder {

	private static final Logger logger = LoggerFactory.getLogger(FeedDecoder.class);

	private final List<FeedFormat> formats;

	/**
	 * Create a decoder that tries RSS first, then Atom.
	 */
	public FeedDecoder() {
		this(List.of(new RssChannelFormat(), new AtomFeedFormat()));
	}

	public FeedDecoder(List<FeedFormat> formats) {
		if (formats.isEmpty()) {
			throw new IllegalArgumentException("At least one feed format is required");
		}
		this.formats = List.copyOf(formats);
	}

	/**
	 * Decode a response body.
	 * @param content raw response bytes
	 * @param sourceName name stamped on every item and used in error messages
	 * @return items in document order (possibly empty)
	 * @throws FeedCollectorException of kind {@code DECODE} if no format matches
	 */
	public List<Item> decode(byte[] content, String sourceName) {
		List<String> rejections = new ArrayList<>();
		for (FeedFormat format : formats) {
			DecodeAttempt attempt = format.attempt(content, sourceName);
			if (attempt.succeeded()) {
				logger.debug("Decoded {} items from {} as {}", attempt.items().size(), sourceName, format.name());
				return attempt.items();
			}
			rejections.add(format.name() + ": " + attempt.failureReason());
		}

		String tried = formats.stream().map(FeedFormat::name).collect(Collectors.joining(" or "));
		throw new FeedCollectorException(FeedCollectorException.ErrorKind.DECODE,
				"Failed to parse feed from " + sourceName + " as " + tried + " [" + String.join("; ", rejections)
						+ "]");
	}

	public List<FeedFormat> getFormats() {
		return formats;
	}

}
