package net.preibisch.stemrecon.process.pool;

import java.util.ArrayDeque;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import net.preibisch.stemrecon.Threads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed pool of workers whose results can only be taken in submission order. Tasks run concurrently
 * (at most {@link #concurrency()} at a time) and may finish in any order; {@link #drainNext()} always
 * returns the result of the oldest task that was not drained yet, waiting for it if necessary.
 * <p>
 * Submission and draining are meant to happen on one thread. A failed task does not affect the workers,
 * its error is thrown when its result is drained.
 */
public class OrderedWorkerPool<T> implements AutoCloseable {

	private static final Logger LOG = LoggerFactory.getLogger(OrderedWorkerPool.class);

	private final int concurrency;
	private final ExecutorService executor;
	private final ArrayDeque<PendingResult<T>> pending = new ArrayDeque<>();

	private long submitted = 0;
	private long drained = 0;

	/**
	 * @param concurrency number of workers, anything below 1 uses all available processors
	 */
	public OrderedWorkerPool(final int concurrency) {
		this.concurrency = Threads.resolve(concurrency);
		this.executor = Threads.createFixedExecutorService(this.concurrency);
	}

	public PendingResult<T> submit(final String description, final Callable<T> task) {
		final PendingResult<T> result = new PendingResult<>(submitted++, description, executor.submit(task));
		pending.addLast(result);
		return result;
	}

	/**
	 * @return the result of the oldest pending task
	 * @throws IllegalStateException if nothing is pending
	 * @throws net.preibisch.stemrecon.process.StemProcessingException if that task failed
	 */
	public T drainNext() {
		final PendingResult<T> next = pending.peekFirst();
		if (next == null)
			throw new IllegalStateException("No pending results to drain.");

		final T result = next.get();
		pending.removeFirst();
		drained++;
		return result;
	}

	public boolean hasPending() {
		return !pending.isEmpty();
	}

	public int numPending() {
		return pending.size();
	}

	public long numSubmitted() {
		return submitted;
	}

	public long numDrained() {
		return drained;
	}

	public int concurrency() {
		return concurrency;
	}

	/**
	 * Stops the workers. Tasks that were not drained yet are cancelled.
	 */
	@Override
	public void close() {
		if (!pending.isEmpty()) {
			LOG.warn("Closing pool with {} undrained results, cancelling them.", pending.size());
			pending.forEach(PendingResult::cancel);
			pending.clear();
		}

		executor.shutdownNow();
		try {
			if (!executor.awaitTermination(10, TimeUnit.SECONDS))
				LOG.warn("Workers did not terminate within 10 seconds.");
		} catch (final InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}
}
