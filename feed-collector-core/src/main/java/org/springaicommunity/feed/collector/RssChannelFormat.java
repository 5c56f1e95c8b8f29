package org.springaicommunity.feed.collector;

import com.rometools.rome.feed.rss.Channel;
import com.rometools.rome.feed.rss.Description;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.WireFeedParser;
import com.rometools.rome.io.impl.RSS10Parser;
import com.rometools.rome.io.impl.RSS20Parser;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.Namespace;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads RSS channels: {@code <rss><channel><item>...} documents of any 0.9x/2.0 version,
 * and RSS 1.0 {@code <rdf:RDF>} documents whose items sit next to the channel.
 *
 * <p>
 * The raw bytes go straight to the XML parser so the document's own encoding
 * declaration is honoured. Item dates are taken from the raw {@code pubDate} text (or
 * {@code dc:date} for RSS 1.0) and run through {@link FeedDates#parseLenient(String)}.
 */
public class RssChannelFormat implements FeedFormat {

	private static final Logger logger = LoggerFactory.getLogger(RssChannelFormat.class);

	@Override
	public String name() {
		return "RSS";
	}

	@Override
	public DecodeAttempt attempt(byte[] content, String sourceName) {
		Document document;
		try {
			document = FeedDocuments.parse(new ByteArrayInputStream(content));
		}
		catch (JDOMException | IOException e) {
			return DecodeAttempt.failure(name(), "malformed XML (" + e.getMessage() + ")");
		}

		WireFeedParser parser = parserFor(document);
		if (parser == null) {
			return DecodeAttempt.failure(name(), "root element <" + document.getRootElement().getName()
					+ "> is neither an <rss> channel nor an RSS 1.0 <rdf:RDF> document");
		}

		Channel channel;
		try {
			channel = (Channel) parser.parse(document, false, Locale.US);
		}
		catch (FeedException | RuntimeException e) {
			return DecodeAttempt.failure(name(), "invalid channel (" + e.getMessage() + ")");
		}

		List<Item> items = new ArrayList<>();
		for (com.rometools.rome.feed.rss.Item candidate : channel.getItems()) {
			toItem(candidate, sourceName).ifPresent(items::add);
		}
		return DecodeAttempt.success(name(), items);
	}

	@Nullable
	private static WireFeedParser parserFor(Document document) {
		ChannelParser channelParser = new ChannelParser();
		if (channelParser.isMyType(document)) {
			return channelParser;
		}
		RdfChannelParser rdfParser = new RdfChannelParser();
		return rdfParser.isMyType(document) ? rdfParser : null;
	}

	private static Optional<Item> toItem(com.rometools.rome.feed.rss.Item candidate, String sourceName) {
		String rawTitle = candidate.getTitle();
		String rawLink = candidate.getLink();
		if (rawTitle == null || rawTitle.isBlank() || rawLink == null || rawLink.isBlank()) {
			logger.debug("Skipping RSS item without title or link from {}", sourceName);
			return Optional.empty();
		}

		String title = FeedText.clean(rawTitle);
		if (title.isEmpty()) {
			logger.debug("Skipping RSS item with whitespace-only title from {}", sourceName);
			return Optional.empty();
		}

		Description description = candidate.getDescription();
		String summary = (description != null && description.getValue() != null)
				? FeedText.clean(description.getValue()) : null;
		Instant pubDate = candidate.getPubDate() != null ? candidate.getPubDate().toInstant() : null;

		return Optional.of(Item.create(sourceName, title, rawLink.trim(), emptyToNull(summary), pubDate));
	}

	@Nullable
	private static String emptyToNull(@Nullable String text) {
		return (text == null || text.isEmpty()) ? null : text;
	}

	/**
	 * Rome's RSS 2.0 parser, widened to accept every {@code <rss>} version and to use
	 * the collector's own date layouts for {@code pubDate}.
	 */
	static final class ChannelParser extends RSS20Parser {

		@Override
		public boolean isMyType(Document document) {
			Element root = document.getRootElement();
			return "rss".equals(root.getName()) && Namespace.NO_NAMESPACE.equals(root.getNamespace())
					&& root.getChild("channel") != null;
		}

		@Override
		public com.rometools.rome.feed.rss.Item parseItem(Element rssRoot, Element eItem, Locale locale) {
			com.rometools.rome.feed.rss.Item item = super.parseItem(rssRoot, eItem, locale);
			item.setPubDate(FeedDates.parseLenient(eItem.getChildText("pubDate")).map(Date::from).orElse(null));
			return item;
		}

	}

	/**
	 * Rome's RSS 1.0 parser, reading item dates from {@code dc:date}.
	 */
	static final class RdfChannelParser extends RSS10Parser {

		private static final Namespace DUBLIN_CORE = Namespace.getNamespace("http://purl.org/dc/elements/1.1/");

		@Override
		public com.rometools.rome.feed.rss.Item parseItem(Element rssRoot, Element eItem, Locale locale) {
			com.rometools.rome.feed.rss.Item item = super.parseItem(rssRoot, eItem, locale);
			item.setPubDate(
					FeedDates.parseLenient(eItem.getChildText("date", DUBLIN_CORE)).map(Date::from).orElse(null));
			return item;
		}

	}

}
