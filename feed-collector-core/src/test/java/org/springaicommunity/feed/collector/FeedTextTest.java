package org.springaicommunity.feed.collector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FeedText Tests")
class FeedTextTest {

	@Nested
	@DisplayName("Entity Decoding")
	class EntityDecodingTest {

		@Test
		@DisplayName("Should decode named entities")
		void shouldDecodeNamedEntities() {
			assertThat(FeedText.decodeEntities("Article &amp; Title &lt;with&gt; entities"))
				.isEqualTo("Article & Title <with> entities");
			assertThat(FeedText.decodeEntities("&copy; 2025")).isEqualTo("© 2025");
		}

		@Test
		@DisplayName("Should decode decimal and hex numeric references")
		void shouldDecodeNumericReferences() {
			assertThat(FeedText.decodeEntities("a&#8212;b")).isEqualTo("a\u2014b");
			assertThat(FeedText.decodeEntities("&#x41;&#x42;C")).isEqualTo("ABC");
		}

		@Test
		@DisplayName("Should leave plain text untouched")
		void shouldLeavePlainTextUntouched() {
			assertThat(FeedText.decodeEntities("Nothing to see here")).isEqualTo("Nothing to see here");
		}

	}

	@Nested
	@DisplayName("Whitespace Normalization")
	class WhitespaceNormalizationTest {

		@Test
		@DisplayName("Should collapse runs and trim ends")
		void shouldCollapseRunsAndTrim() {
			assertThat(FeedText.normalizeWhitespace("  Java \t turns\n\n thirty  ")).isEqualTo("Java turns thirty");
		}

		@Test
		@DisplayName("Should treat non-breaking space as whitespace")
		void shouldTreatNonBreakingSpaceAsWhitespace() {
			assertThat(FeedText.normalizeWhitespace("\u00a0a\u00a0\u2003b\u00a0")).isEqualTo("a b");
		}

		@ParameterizedTest
		@ValueSource(strings = { "", "   ", "a  b", " leading", "trailing\n", "\tmixed \n\r whitespace\u00a0" })
		@DisplayName("Should be idempotent")
		void shouldBeIdempotent(String input) {
			String once = FeedText.normalizeWhitespace(input);
			assertThat(FeedText.normalizeWhitespace(once)).isEqualTo(once);
		}

	}

	@Test
	@DisplayName("clean() should decode before normalizing")
	void cleanShouldDecodeBeforeNormalizing() {
		assertThat(FeedText.clean("  Fish &amp;&nbsp;&nbsp;Chips ")).isEqualTo("Fish & Chips");
		assertThat(FeedText.clean("&nbsp; &#160; ")).isEmpty();
	}

}
