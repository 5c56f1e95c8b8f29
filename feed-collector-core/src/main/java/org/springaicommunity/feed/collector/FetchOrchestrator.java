package org.springaicommunity.feed.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches many sources concurrently, each bounded by its own timeout, and aggregates the
 * results.
 *
 * <p>
 * Every source runs as an independent unit on the orchestrator's worker pool. When
 * {@code maxConcurrentFetches} is set, units wait in submission order for a free slot
 * and a unit's timer starts only once it holds one, so time spent queueing does not use
 * up its timeout. When the timer fires first the source is recorded as failed and its
 * fetch is abandoned: it is not interrupted and whatever it returns later is discarded.
 * The slot is freed as soon as the unit completes, so an abandoned fetch never holds
 * back the sources queued behind it.
 *
 * <p>
 * A failing or slow source never affects the others, and {@link #fetchAll} never throws
 * because of a source. Items are merged in the order the sources completed.
 *
 * <pre>
 * {@code
 * try (FetchOrchestrator orchestrator = new FetchOrchestrator()) {
 *     FetchRun run = orchestrator.fetchAll(sources, Duration.ofSeconds(5));
 *     System.out.println(run.stats().summary());
 * }
 * }
 * </pre>
 */
public class FetchOrchestrator implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(FetchOrchestrator.class);

	/**
	 * Per-source timeout used when none is given.
	 */
	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

	private final ExecutorService executor;

	private final Duration defaultTimeout;

	private final int maxConcurrentFetches;

	@Nullable
	private final Semaphore slots;

	private final Queue<Runnable> waiting = new ConcurrentLinkedQueue<>();

	public FetchOrchestrator() {
		this(DEFAULT_TIMEOUT, 0);
	}

	public FetchOrchestrator(CollectorProperties properties) {
		this(properties.getFetchTimeout(), properties.getMaxConcurrentFetches());
	}

	/**
	 * Create an orchestrator.
	 * @param defaultTimeout per-source timeout for {@link #fetchAll(List)}
	 * @param maxConcurrentFetches maximum number of fetches in flight, or 0 for no limit
	 */
	public FetchOrchestrator(Duration defaultTimeout, int maxConcurrentFetches) {
		requirePositive(defaultTimeout);
		if (maxConcurrentFetches < 0) {
			throw new IllegalArgumentException("maxConcurrentFetches must not be negative: " + maxConcurrentFetches);
		}
		this.defaultTimeout = defaultTimeout;
		this.maxConcurrentFetches = maxConcurrentFetches;
		this.slots = maxConcurrentFetches == 0 ? null : new Semaphore(maxConcurrentFetches);
		this.executor = Executors.newCachedThreadPool(fetchThreads());
	}

	/**
	 * Fetch all sources with the default timeout.
	 * @param sources sources to fetch
	 * @return merged items and run statistics
	 */
	public FetchRun fetchAll(List<? extends Source> sources) {
		return fetchAll(sources, defaultTimeout);
	}

	/**
	 * Fetch all sources concurrently and wait for every one of them to succeed, fail or
	 * time out.
	 * @param sources sources to fetch
	 * @param timeout per-source time bound
	 * @return merged items and run statistics
	 */
	public FetchRun fetchAll(List<? extends Source> sources, Duration timeout) {
		requirePositive(timeout);
		if (sources.isEmpty()) {
			return new FetchRun(List.of(), RunStats.empty(0));
		}

		int total = sources.size();
		logger.info("Fetching content from {} sources...", total);

		Queue<FetchOutcome> arrivals = new ConcurrentLinkedQueue<>();
		CompletableFuture<?>[] units = new CompletableFuture<?>[total];
		for (int i = 0; i < total; i++) {
			Source source = sources.get(i);
			logger.info("  [{}/{}] Fetching {}", i + 1, total, source.name());
			units[i] = submit(source, timeout).handle((items, error) -> toOutcome(source, items, error))
				.thenAccept(arrivals::add);
		}
		CompletableFuture.allOf(units).join();

		StatsAggregator aggregator = new StatsAggregator(total);
		List<Item> items = new ArrayList<>();
		for (FetchOutcome outcome : arrivals) {
			aggregator.record(outcome);
			if (outcome instanceof FetchOutcome.Success success) {
				items.addAll(success.items());
			}
		}
		RunStats stats = aggregator.toStats();

		logger.info(stats.summary());
		for (SourceError error : stats.errors()) {
			logger.warn("  {} failed: {}", error.sourceName(), error.description());
		}
		return new FetchRun(items, stats);
	}

	/**
	 * Fetch a single source with the default timeout.
	 * @param source source to fetch
	 * @return the source's items
	 * @throws FeedCollectorException if the fetch fails or times out
	 */
	public List<Item> fetchOne(Source source) {
		return fetchOne(source, defaultTimeout);
	}

	/**
	 * Fetch a single source, bounded by a timeout.
	 * @param source source to fetch
	 * @param timeout time bound
	 * @return the source's items
	 * @throws FeedCollectorException of kind {@code TIMEOUT} if the time bound elapses,
	 * or the fetch's own failure
	 */
	public List<Item> fetchOne(Source source, Duration timeout) {
		requirePositive(timeout);
		try {
			return submit(source, timeout).join();
		}
		catch (CompletionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException runtimeException) {
				throw runtimeException;
			}
			if (cause instanceof Error error) {
				throw error;
			}
			throw new FeedCollectorException(FeedCollectorException.ErrorKind.TRANSPORT,
					"Fetch of " + source.name() + " failed: " + cause, cause);
		}
	}

	public Duration getDefaultTimeout() {
		return defaultTimeout;
	}

	public int getMaxConcurrentFetches() {
		return maxConcurrentFetches;
	}

	/**
	 * Stop accepting new fetches. Running fetches are left to finish on their own.
	 */
	@Override
	public void close() {
		executor.shutdown();
	}

	private CompletableFuture<List<Item>> submit(Source source, Duration timeout) {
		CompletableFuture<List<Item>> unit = new CompletableFuture<>();
		if (slots == null) {
			start(source, timeout, unit);
		}
		else {
			waiting.add(() -> {
				unit.whenComplete((items, error) -> releaseSlot());
				start(source, timeout, unit);
			});
			admitWaiting();
		}
		return unit;
	}

	private void start(Source source, Duration timeout, CompletableFuture<List<Item>> unit) {
		try {
			executor.execute(() -> run(source, timeout, unit));
		}
		catch (RejectedExecutionException e) {
			unit.completeExceptionally(e);
		}
	}

	// Both sides re-check after their own step, so a slot freed while a unit is being
	// queued is never lost.
	private void admitWaiting() {
		while (!waiting.isEmpty() && slots.tryAcquire()) {
			Runnable next = waiting.poll();
			if (next == null) {
				slots.release();
				return;
			}
			next.run();
		}
	}

	private void releaseSlot() {
		slots.release();
		admitWaiting();
	}

	private void run(Source source, Duration timeout, CompletableFuture<List<Item>> unit) {
		CompletableFuture.delayedExecutor(timeout.toNanos(), TimeUnit.NANOSECONDS)
			.execute(() -> unit.completeExceptionally(new FeedCollectorException(
					FeedCollectorException.ErrorKind.TIMEOUT,
					"Request to " + source.name() + " timed out after " + timeout.toMillis() + "ms")));
		try {
			List<Item> items = Objects.requireNonNull(source.fetch(), "Source returned null items");
			if (!unit.complete(items)) {
				logger.debug("Discarding late result of {} ({} items)", source.name(), items.size());
			}
		}
		catch (Throwable e) {
			if (!unit.completeExceptionally(e)) {
				logger.debug("Discarding late failure of {}: {}", source.name(), e.getMessage());
			}
		}
	}

	private static FetchOutcome toOutcome(Source source, @Nullable List<Item> items, @Nullable Throwable error) {
		if (error == null) {
			return new FetchOutcome.Success(source.name(), items != null ? items : List.of());
		}
		Throwable cause = (error instanceof CompletionException && error.getCause() != null) ? error.getCause()
				: error;
		return new FetchOutcome.Failure(source.name(), describe(cause));
	}

	private static String describe(Throwable error) {
		String message = error.getMessage();
		return (message == null || message.isBlank()) ? error.getClass().getSimpleName() : message;
	}

	private static void requirePositive(Duration timeout) {
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("Timeout must be positive: " + timeout);
		}
	}

	private static ThreadFactory fetchThreads() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "feed-fetch-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

}
