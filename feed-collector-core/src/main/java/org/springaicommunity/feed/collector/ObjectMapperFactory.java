package org.springaicommunity.feed.collector;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for the {@link ObjectMapper} that hands collected {@link Item}s to a storage
 * layer and reads them back.
 *
 * <p>
 * An item is written as one flat JSON object with snake_case keys: {@code id},
 * {@code source_name}, {@code title}, {@code link}, {@code summary} and
 * {@code pub_date}. A missing summary or publication date is written as an explicit
 * {@code null}, and {@code pub_date} is an ISO-8601 UTC string
 * (e.g.&nbsp;{@code 2025-01-01T12:00:00Z}). Columns a store adds of its own (such as
 * an ingestion timestamp) are ignored when a stored row is read back as an item.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a mapper for item hand-off.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		return mapper;
	}

}
