package org.springaicommunity.feed.collector;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link Source} for orchestrator tests. Optionally sleeps before answering
 * and counts how many fetches are running at the same time.
 */
class StubSource implements Source {

	private final String name;

	private final Duration delay;

	private final List<Item> items;

	private final Throwable error;

	private AtomicInteger inFlight;

	private AtomicInteger peak;

	private StubSource(String name, Duration delay, List<Item> items, Throwable error) {
		this.name = name;
		this.delay = delay;
		this.items = items;
		this.error = error;
	}

	static StubSource returning(String name, int itemCount) {
		return slow(name, Duration.ZERO, itemCount);
	}

	static StubSource slow(String name, Duration delay, int itemCount) {
		List<Item> items = new ArrayList<>();
		for (int i = 1; i <= itemCount; i++) {
			items.add(Item.create(name, name + " item " + i, "https://example.com/" + name + "/" + i, null, null));
		}
		return new StubSource(name, delay, items, null);
	}

	static StubSource failing(String name, RuntimeException error) {
		return new StubSource(name, Duration.ZERO, List.of(), error);
	}

	static StubSource crashing(String name, Error error) {
		return new StubSource(name, Duration.ZERO, List.of(), error);
	}

	StubSource trackingConcurrency(AtomicInteger inFlight, AtomicInteger peak) {
		this.inFlight = inFlight;
		this.peak = peak;
		return this;
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public String address() {
		return "stub://" + name;
	}

	@Override
	public List<Item> fetch() {
		if (inFlight != null) {
			int running = inFlight.incrementAndGet();
			peak.accumulateAndGet(running, Math::max);
		}
		try {
			if (!delay.isZero()) {
				Thread.sleep(delay.toMillis());
			}
			if (error instanceof Error fatal) {
				throw fatal;
			}
			if (error != null) {
				throw (RuntimeException) error;
			}
			return items;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("interrupted", e);
		}
		finally {
			if (inFlight != null) {
				inFlight.decrementAndGet();
			}
		}
	}

}
