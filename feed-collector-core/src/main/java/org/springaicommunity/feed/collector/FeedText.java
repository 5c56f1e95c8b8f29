package org.springaicommunity.feed.collector;

import org.jsoup.parser.Parser;

import java.util.regex.Pattern;

/**
 * Text normalization applied to feed titles and summaries.
 */
public final class FeedText {

	// \s misses U+00A0 and the other Unicode space separators
	private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\p{Z}]+");

	private FeedText() {
	}

	/**
	 * Decode HTML entities (named, decimal and hex) left in feed text after XML parsing,
	 * e.g. {@code "&amp;copy;"} arrives as {@code "&copy;"} and becomes {@code "©"}.
	 * @param text raw text
	 * @return decoded text
	 */
	public static String decodeEntities(String text) {
		return Parser.unescapeEntities(text, false);
	}

	/**
	 * Collapse every run of whitespace to a single space and trim both ends. Applying it
	 * twice gives the same result as applying it once.
	 * @param text input text
	 * @return normalized text
	 */
	public static String normalizeWhitespace(String text) {
		return WHITESPACE_RUN.matcher(text).replaceAll(" ").trim();
	}

	/**
	 * Entity decoding followed by whitespace normalization.
	 * @param text raw feed text
	 * @return display-ready text, possibly empty
	 */
	public static String clean(String text) {
		return normalizeWhitespace(decodeEntities(text));
	}

}
