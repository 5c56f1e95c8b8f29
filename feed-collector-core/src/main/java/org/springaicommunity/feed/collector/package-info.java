/**
 * Feed Collector core package.
 *
 * <p>
 * Concurrent fetching of RSS and Atom sources, normalization of their entries into
 * {@link org.springaicommunity.feed.collector.Item} records, and per-run statistics.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.feed.collector;

import org.jspecify.annotations.NullMarked;
