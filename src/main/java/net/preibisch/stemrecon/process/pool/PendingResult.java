package net.preibisch.stemrecon.process.pool;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import net.preibisch.stemrecon.process.StemProcessingException;

/**
 * Handle of one submitted task. Only {@link OrderedWorkerPool} hands these out, in submission order.
 */
public class PendingResult<T> {

	private final long sequence;
	private final String description;
	private final Future<T> future;

	PendingResult(final long sequence, final String description, final Future<T> future) {
		this.sequence = sequence;
		this.description = description;
		this.future = future;
	}

	public long sequence() {
		return sequence;
	}

	public String description() {
		return description;
	}

	public boolean isDone() {
		return future.isDone();
	}

	/**
	 * Waits for the task to finish.
	 *
	 * @return the result of the task
	 * @throws StemProcessingException if the task failed or the waiting thread was interrupted
	 */
	public T get() {
		try {
			return future.get();
		} catch (final ExecutionException e) {
			final Throwable cause = e.getCause() == null ? e : e.getCause();
			throw new StemProcessingException("Task for " + description + " failed: " + cause, cause);
		} catch (final InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new StemProcessingException("Interrupted while waiting for " + description, e);
		}
	}

	void cancel() {
		future.cancel(true);
	}
}
