package org.springaicommunity.feed.collector;

import com.rometools.rome.feed.atom.Content;
import com.rometools.rome.feed.atom.Entry;
import com.rometools.rome.feed.atom.Feed;
import com.rometools.rome.feed.atom.Link;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.impl.Atom10Parser;
import org.jdom2.Document;
import org.jdom2.JDOMException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads Atom 1.0 feeds ({@code <feed><entry>...}).
 *
 * <p>
 * The body must be valid UTF-8. Each entry uses its first alternate link (or its first
 * link of any kind), its summary (or first content block) and its published date (or
 * updated date).
 */
public class AtomFeedFormat implements FeedFormat {

	private static final Logger logger = LoggerFactory.getLogger(AtomFeedFormat.class);

	private static final char BYTE_ORDER_MARK = '\uFEFF';

	@Override
	public String name() {
		return "Atom";
	}

	@Override
	public DecodeAttempt attempt(byte[] content, String sourceName) {
		String text;
		try {
			text = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
				.decode(ByteBuffer.wrap(content))
				.toString();
		}
		catch (CharacterCodingException e) {
			return DecodeAttempt.failure(name(), "body is not valid UTF-8");
		}
		if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
			text = text.substring(1);
		}

		Document document;
		try {
			document = FeedDocuments.parse(new StringReader(text));
		}
		catch (JDOMException | IOException e) {
			return DecodeAttempt.failure(name(), "malformed XML (" + e.getMessage() + ")");
		}

		Atom10Parser parser = new Atom10Parser();
		if (!"feed".equals(document.getRootElement().getName()) || !parser.isMyType(document)) {
			return DecodeAttempt.failure(name(), "root element is not an Atom 1.0 <feed>");
		}

		Feed feed;
		try {
			feed = (Feed) parser.parse(document, false, Locale.US);
		}
		catch (FeedException | RuntimeException e) {
			return DecodeAttempt.failure(name(), "invalid feed (" + e.getMessage() + ")");
		}

		List<Item> items = new ArrayList<>();
		for (Entry entry : feed.getEntries()) {
			toItem(entry, sourceName).ifPresent(items::add);
		}
		return DecodeAttempt.success(name(), items);
	}

	private static Optional<Item> toItem(Entry entry, String sourceName) {
		String rawTitle = entry.getTitle();
		String rawLink = preferredLink(entry);
		if (rawTitle == null || rawTitle.isBlank() || rawLink == null || rawLink.isBlank()) {
			logger.debug("Skipping Atom entry without title or link from {}", sourceName);
			return Optional.empty();
		}

		String title = FeedText.clean(rawTitle);
		if (title.isEmpty()) {
			logger.debug("Skipping Atom entry with whitespace-only title from {}", sourceName);
			return Optional.empty();
		}

		String rawSummary = summaryText(entry);
		String summary = rawSummary != null ? FeedText.clean(rawSummary) : null;

		Date date = entry.getPublished() != null ? entry.getPublished() : entry.getUpdated();
		Instant pubDate = date != null ? date.toInstant() : null;

		return Optional.of(Item.create(sourceName, title, rawLink.trim(),
				(summary == null || summary.isEmpty()) ? null : summary, pubDate));
	}

	@Nullable
	private static String preferredLink(Entry entry) {
		List<Link> alternates = entry.getAlternateLinks();
		if (!alternates.isEmpty()) {
			return alternates.get(0).getHref();
		}
		List<Link> others = entry.getOtherLinks();
		return others.isEmpty() ? null : others.get(0).getHref();
	}

	@Nullable
	private static String summaryText(Entry entry) {
		Content summary = entry.getSummary();
		if (summary != null && summary.getValue() != null) {
			return summary.getValue();
		}
		List<Content> contents = entry.getContents();
		return contents.isEmpty() ? null : contents.get(0).getValue();
	}

}
