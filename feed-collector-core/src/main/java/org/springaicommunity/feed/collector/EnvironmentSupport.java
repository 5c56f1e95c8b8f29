package org.springaicommunity.feed.collector;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Resolves collector settings from the environment. A {@code .env} file is consulted
 * alongside the process environment; both files are loaded once per process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get a variable value. Blank values count as unset.
	 * @param name the variable name
	 * @return the trimmed value, or {@code null} if not set
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return (value == null || value.isBlank()) ? null : value.trim();
	}

	/**
	 * Get a non-negative integer variable.
	 * @param name the variable name
	 * @param defaultValue value used when the variable is not set
	 * @return parsed value or the default
	 * @throws FeedCollectorException of kind {@code CONFIG} if the value is malformed
	 */
	public static int getInt(String name, int defaultValue) {
		return parseInt(name, get(name), defaultValue);
	}

	/**
	 * Get a duration variable expressed in whole seconds.
	 * @param name the variable name
	 * @param defaultValue value used when the variable is not set
	 * @return parsed duration or the default
	 * @throws FeedCollectorException of kind {@code CONFIG} if the value is malformed or
	 * not positive
	 */
	public static Duration getSeconds(String name, Duration defaultValue) {
		return parseSeconds(name, get(name), defaultValue);
	}

	static int parseInt(String name, @Nullable String value, int defaultValue) {
		if (value == null) {
			return defaultValue;
		}
		try {
			int parsed = Integer.parseInt(value.trim());
			if (parsed < 0) {
				throw new FeedCollectorException(FeedCollectorException.ErrorKind.CONFIG,
						name + " must not be negative, got " + parsed);
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new FeedCollectorException(FeedCollectorException.ErrorKind.CONFIG,
					name + " must be an integer, got '" + value + "'", e);
		}
	}

	static Duration parseSeconds(String name, @Nullable String value, Duration defaultValue) {
		if (value == null) {
			return defaultValue;
		}
		int seconds = parseInt(name, value, 0);
		if (seconds == 0) {
			throw new FeedCollectorException(FeedCollectorException.ErrorKind.CONFIG,
					name + " must be a positive number of seconds");
		}
		return Duration.ofSeconds(seconds);
	}

}
