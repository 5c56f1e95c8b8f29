package org.springaicommunity.feed.collector;

/**
 * Exception thrown when fetching or decoding a feed fails.
 *
 * <p>
 * Carries an {@link ErrorKind} so callers can tell transport problems from decode
 * problems without parsing the message. The message is always prefixed with the kind's
 * label, e.g. {@code "Parse error: Failed to parse feed from Tech News as RSS or Atom"}.
 */
public class FeedCollectorException extends RuntimeException {

	private final ErrorKind kind;

	public FeedCollectorException(ErrorKind kind, String detail) {
		super(kind.label() + ": " + detail);
		this.kind = kind;
	}

	public FeedCollectorException(ErrorKind kind, String detail, Throwable cause) {
		super(kind.label() + ": " + detail, cause);
		this.kind = kind;
	}

	public ErrorKind getKind() {
		return kind;
	}

	/**
	 * Category of a feed collection failure.
	 */
	public enum ErrorKind {

		/**
		 * The underlying retrieval failed or returned a non-success status.
		 */
		TRANSPORT("Network error"),

		/**
		 * The per-source time bound elapsed before the fetch completed.
		 */
		TIMEOUT("Timeout error"),

		/**
		 * Neither supported feed schema could be parsed from the response.
		 */
		DECODE("Parse error"),

		/**
		 * A date string matched none of the supported layouts.
		 */
		DATE_PARSE("Date parse error"),

		/**
		 * A configuration value was missing or malformed.
		 */
		CONFIG("Configuration error");

		private final String label;

		ErrorKind(String label) {
			this.label = label;
		}

		public String label() {
			return label;
		}

	}

}
