package org.springaicommunity.feed.collector;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Loads feed documents from {@code src/test/resources/fixtures}.
 */
final class Fixtures {

	private Fixtures() {
	}

	static byte[] load(String name) {
		try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
			if (in == null) {
				throw new IllegalArgumentException("Missing fixture: " + name);
			}
			return in.readAllBytes();
		}
		catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

}
